package com.meetinganalyzer.pipeline.service;

import com.meetinganalyzer.analysis.model.CanonicalRecord;
import com.meetinganalyzer.analysis.service.TranscriptAnalyzer;
import com.meetinganalyzer.common.exception.ErrorKind;
import com.meetinganalyzer.common.exception.PipelineException;
import com.meetinganalyzer.config.AppProperties;
import com.meetinganalyzer.drive.model.SourceObject;
import com.meetinganalyzer.drive.service.MediaFetcher;
import com.meetinganalyzer.drive.service.QuarantineService;
import com.meetinganalyzer.ledger.model.LedgerStatus;
import com.meetinganalyzer.ledger.service.LedgerService;
import com.meetinganalyzer.pipeline.model.PipelineRun;
import com.meetinganalyzer.pipeline.model.PipelineState;
import com.meetinganalyzer.pipeline.model.WorkItem;
import com.meetinganalyzer.transcription.service.TranscriptionAdapter;
import com.meetinganalyzer.transcription.service.TranscriptionOptions;
import com.meetinganalyzer.transcription.service.TranscriptionResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@Service
public class MeetingPipeline {

    private static final Logger log = LoggerFactory.getLogger(MeetingPipeline.class);

    private final MediaFetcher mediaFetcher;
    private final TranscriptionAdapter transcriptionAdapter;
    private final TranscriptAnalyzer transcriptAnalyzer;
    private final RecordEnricher recordEnricher;
    private final ResultSink resultSink;
    private final LedgerService ledgerService;
    private final QuarantineService quarantineService;
    private final TranscriptionOptions transcriptionOptions;
    private final Timer retrievalTimer;
    private final Timer transcriptionTimer;
    private final Timer analysisTimer;
    private final Counter processedCounter;
    private final Counter failedCounter;

    public MeetingPipeline(MediaFetcher mediaFetcher,
                           TranscriptionAdapter transcriptionAdapter,
                           TranscriptAnalyzer transcriptAnalyzer,
                           RecordEnricher recordEnricher,
                           ResultSink resultSink,
                           LedgerService ledgerService,
                           QuarantineService quarantineService,
                           AppProperties appProperties,
                           MeterRegistry meterRegistry) {
        this.mediaFetcher = mediaFetcher;
        this.transcriptionAdapter = transcriptionAdapter;
        this.transcriptAnalyzer = transcriptAnalyzer;
        this.recordEnricher = recordEnricher;
        this.resultSink = resultSink;
        this.ledgerService = ledgerService;
        this.quarantineService = quarantineService;
        this.transcriptionOptions = TranscriptionOptions.from(appProperties.asr());
        this.retrievalTimer = meterRegistry.timer("meetings.retrieval.latency");
        this.transcriptionTimer = meterRegistry.timer("meetings.transcription.latency");
        this.analysisTimer = meterRegistry.timer("meetings.analysis.latency");
        this.processedCounter = meterRegistry.counter("meetings.processed.total");
        this.failedCounter = meterRegistry.counter("meetings.failed.total");
    }

    public CanonicalRecord process(WorkItem item) {
        SourceObject source = item.source();
        PipelineRun run = new PipelineRun(source.id());
        Path localPath = null;

        try {
            run.advance(PipelineState.RETRIEVING);
            Timer.Sample retrievalSample = Timer.start();
            try {
                localPath = mediaFetcher.retrieve(source.id(), source.name());
            } finally {
                retrievalSample.stop(retrievalTimer);
            }

            run.advance(PipelineState.TRANSCRIBING);
            TranscriptionResult transcription;
            Timer.Sample transcriptionSample = Timer.start();
            try {
                transcription = transcriptionAdapter.transcribe(localPath, transcriptionOptions);
            } finally {
                transcriptionSample.stop(transcriptionTimer);
            }
            if (transcription == null || transcription.isEmpty()) {
                throw new PipelineException(ErrorKind.EMPTY_TRANSCRIPT, "Empty transcript for " + source.name());
            }

            run.advance(PipelineState.ANALYZING);
            CanonicalRecord analyzed;
            Timer.Sample analysisSample = Timer.start();
            try {
                analyzed = transcriptAnalyzer.analyze(transcription.text(), source.name());
            } finally {
                analysisSample.stop(analysisTimer);
            }
            if (analyzed.isEmpty()) {
                throw new PipelineException(ErrorKind.UNPARSABLE_RESPONSE,
                        "Analysis returned no usable data for " + source.name());
            }
            CanonicalRecord record = recordEnricher.enrich(analyzed, item, transcription);

            run.advance(PipelineState.PERSISTING);
            resultSink.append(record);
            ledgerService.recordOutcome(source.id(), LedgerStatus.PROCESSED, "", source.name());
            run.advance(PipelineState.PROCESSED);
            processedCounter.increment();
            log.info("Processed {} ({}) in {} min of audio", source.name(), source.id(), transcription.durationMinutes());

            quarantineService.moveToProcessed(source.id(), item.folderId());
            return record;
        } catch (PipelineException exception) {
            throw fail(run, item, exception);
        } catch (RuntimeException exception) {
            throw fail(run, item, new PipelineException(kindFor(run.getState()), exception.getMessage(), exception));
        } finally {
            deleteLocalCopy(localPath);
        }
    }

    private PipelineException fail(PipelineRun run, WorkItem item, PipelineException error) {
        SourceObject source = item.source();
        PipelineState failedAt = run.getState();
        if (!failedAt.isTerminal()) {
            run.fail();
        }
        failedCounter.increment();
        log.error("Processing of {} ({}) failed while {}: [{}] {}",
                source.name(), source.id(), failedAt, error.getKind(), error.getMessage(), error);

        String reason = "[" + error.getKind() + "] " + (error.getMessage() == null ? "no detail" : error.getMessage());
        try {
            ledgerService.recordOutcome(source.id(), LedgerStatus.FAILED, reason, source.name());
        } catch (PipelineException ledgerError) {
            log.error("Could not record failure of {} in the ledger", source.id(), ledgerError);
            error.addSuppressed(ledgerError);
        }

        if (!quarantineService.quarantine(source.id(), item.folderId(), reason)) {
            log.error("{} stays in its folder; quarantine did not complete", source.name());
            error.addSuppressed(new PipelineException(ErrorKind.QUARANTINE_FAILURE,
                    "Quarantine of " + source.id() + " did not complete"));
        }
        return error;
    }

    private static ErrorKind kindFor(PipelineState state) {
        return switch (state) {
            case TRANSCRIBING -> ErrorKind.EMPTY_TRANSCRIPT;
            case ANALYZING -> ErrorKind.PROVIDER_UNAVAILABLE;
            case PERSISTING -> ErrorKind.PERSISTENCE_FAILURE;
            default -> ErrorKind.RETRIEVAL_FAILED;
        };
    }

    private void deleteLocalCopy(Path localPath) {
        if (localPath == null) {
            return;
        }
        try {
            Files.deleteIfExists(localPath);
        } catch (IOException exception) {
            log.warn("Unable to delete local copy {}", localPath, exception);
        }
    }
}
