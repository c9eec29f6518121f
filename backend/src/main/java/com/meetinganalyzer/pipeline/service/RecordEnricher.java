package com.meetinganalyzer.pipeline.service;

import com.meetinganalyzer.analysis.model.CanonicalRecord;
import com.meetinganalyzer.analysis.model.CanonicalSchema;
import com.meetinganalyzer.analysis.model.FeatureCoverage;
import com.meetinganalyzer.analysis.service.FeatureCoverageCalculator;
import com.meetinganalyzer.common.util.FileNames;
import com.meetinganalyzer.config.AppProperties;
import com.meetinganalyzer.drive.model.SourceObject;
import com.meetinganalyzer.pipeline.model.WorkItem;
import com.meetinganalyzer.transcription.service.TranscriptionResult;
import org.springframework.stereotype.Component;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.Map;

@Component
public class RecordEnricher {

    private final FeatureCoverageCalculator featureCoverageCalculator;
    private final AppProperties appProperties;

    public RecordEnricher(FeatureCoverageCalculator featureCoverageCalculator, AppProperties appProperties) {
        this.featureCoverageCalculator = featureCoverageCalculator;
        this.appProperties = appProperties;
    }

    public CanonicalRecord enrich(CanonicalRecord analyzed, WorkItem item, TranscriptionResult transcription) {
        SourceObject source = item.source();
        Map<String, String> updates = new HashMap<>();

        String owner = item.ownerName();
        updates.put(CanonicalSchema.OWNER, owner);
        AppProperties.Owner details = owner == null ? null : appProperties.owners().get(owner);
        if (details != null) {
            putIfPresent(updates, CanonicalSchema.EMAIL_ID, details.email());
            putIfPresent(updates, CanonicalSchema.MANAGER, details.manager());
            putIfPresent(updates, CanonicalSchema.TEAM, details.team());
            if (details.manager() != null) {
                putIfPresent(updates, CanonicalSchema.MANAGER_EMAIL, appProperties.managerEmails().get(details.manager()));
            }
        }

        updates.put(CanonicalSchema.SOCIETY_NAME, FileNames.societyName(source.name()));
        updates.put(CanonicalSchema.MEETING_DURATION, transcription.durationMinutes() > 0
                ? Integer.toString(transcription.durationMinutes())
                : CanonicalSchema.NOT_AVAILABLE);

        FeatureCoverage coverage = featureCoverageCalculator.calculate(transcription.text());
        updates.put(CanonicalSchema.FEATURE_CHECKLIST_COVERAGE, coverage.summary());
        updates.put(CanonicalSchema.MISSED_OPPORTUNITIES, coverage.missed());

        updates.put(CanonicalSchema.MEDIA_LINK, source.viewLink());
        updates.put(CanonicalSchema.FILE_NAME, source.name());
        updates.put(CanonicalSchema.FILE_ID, source.id());

        if (analyzed.isNotAvailable(CanonicalSchema.DATE) && source.createdTime() != null) {
            updates.put(CanonicalSchema.DATE,
                    DateTimeFormatter.ISO_LOCAL_DATE.format(source.createdTime().atZone(ZoneOffset.UTC)));
        }
        return analyzed.withAll(updates);
    }

    private static void putIfPresent(Map<String, String> updates, String field, String value) {
        if (value != null && !value.isBlank()) {
            updates.put(field, value);
        }
    }
}
