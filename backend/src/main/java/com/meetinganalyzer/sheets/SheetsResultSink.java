package com.meetinganalyzer.sheets;

import com.meetinganalyzer.analysis.model.CanonicalRecord;
import com.meetinganalyzer.analysis.model.CanonicalSchema;
import com.meetinganalyzer.common.exception.ErrorKind;
import com.meetinganalyzer.common.exception.PipelineException;
import com.meetinganalyzer.config.AppProperties;
import com.meetinganalyzer.pipeline.service.ResultSink;
import org.springframework.stereotype.Component;

@Component
public class SheetsResultSink implements ResultSink {

    private final SheetsClient sheetsClient;
    private final String tab;
    private volatile boolean tabReady;

    public SheetsResultSink(SheetsClient sheetsClient, AppProperties appProperties) {
        this.sheetsClient = sheetsClient;
        this.tab = appProperties.sheets().resultsTab();
    }

    @Override
    public void append(CanonicalRecord record) {
        if (record.isEmpty()) {
            throw new IllegalArgumentException("Empty records are never persisted");
        }
        try {
            ensureTab();
            sheetsClient.appendRow(tab, record.toRow());
        } catch (RuntimeException exception) {
            throw new PipelineException(ErrorKind.PERSISTENCE_FAILURE,
                    "Writing results row failed: " + exception.getMessage(), exception);
        }
    }

    private synchronized void ensureTab() {
        if (!tabReady) {
            sheetsClient.ensureTab(tab, CanonicalSchema.FIELDS);
            tabReady = true;
        }
    }
}
