package com.meetinganalyzer.pipeline.model;

public record RunSummary(
        int discovered,
        int processed,
        int failed,
        int skipped,
        int released,
        boolean haltedByQuota
) {

    public static RunSummary notStarted() {
        return new RunSummary(0, 0, 0, 0, 0, false);
    }
}
