package com.meetinganalyzer.analysis.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record ExtractionResult(Map<String, Object> fields) {

    private static final ExtractionResult NO_DATA = new ExtractionResult(Map.of());

    public ExtractionResult {
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static ExtractionResult noData() {
        return NO_DATA;
    }

    public boolean hasData() {
        return !fields.isEmpty();
    }
}
