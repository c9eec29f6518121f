package com.meetinganalyzer.pipeline.service;

import com.meetinganalyzer.analysis.model.CanonicalRecord;

public interface ResultSink {

    void append(CanonicalRecord record);
}
