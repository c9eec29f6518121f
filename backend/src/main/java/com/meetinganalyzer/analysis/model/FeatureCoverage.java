package com.meetinganalyzer.analysis.model;

public record FeatureCoverage(String summary, String missed) {
}
