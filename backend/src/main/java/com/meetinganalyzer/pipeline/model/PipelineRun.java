package com.meetinganalyzer.pipeline.model;

import java.util.ArrayList;
import java.util.List;

public class PipelineRun {

    private final String objectId;
    private final List<PipelineState> history = new ArrayList<>();
    private PipelineState state = PipelineState.DISCOVERED;

    public PipelineRun(String objectId) {
        this.objectId = objectId;
        history.add(state);
    }

    public void advance(PipelineState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal transition " + state + " -> " + next + " for " + objectId);
        }
        state = next;
        history.add(next);
    }

    public void fail() {
        advance(PipelineState.FAILED);
    }

    public String getObjectId() {
        return objectId;
    }

    public PipelineState getState() {
        return state;
    }

    public List<PipelineState> getHistory() {
        return List.copyOf(history);
    }
}
