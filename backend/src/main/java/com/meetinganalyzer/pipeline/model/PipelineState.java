package com.meetinganalyzer.pipeline.model;

import java.util.EnumSet;
import java.util.Set;

public enum PipelineState {
    DISCOVERED,
    RETRIEVING,
    TRANSCRIBING,
    ANALYZING,
    PERSISTING,
    PROCESSED,
    FAILED;

    public boolean isTerminal() {
        return this == PROCESSED || this == FAILED;
    }

    public boolean canTransitionTo(PipelineState next) {
        return allowedTransitions().contains(next);
    }

    public Set<PipelineState> allowedTransitions() {
        return switch (this) {
            case DISCOVERED -> EnumSet.of(RETRIEVING, FAILED);
            case RETRIEVING -> EnumSet.of(TRANSCRIBING, FAILED);
            case TRANSCRIBING -> EnumSet.of(ANALYZING, FAILED);
            case ANALYZING -> EnumSet.of(PERSISTING, FAILED);
            case PERSISTING -> EnumSet.of(PROCESSED, FAILED);
            case PROCESSED, FAILED -> EnumSet.noneOf(PipelineState.class);
        };
    }
}
