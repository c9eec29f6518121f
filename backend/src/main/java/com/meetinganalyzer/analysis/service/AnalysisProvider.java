package com.meetinganalyzer.analysis.service;

public interface AnalysisProvider {

    String name();

    boolean isConfigured();

    String generate(String prompt);
}
