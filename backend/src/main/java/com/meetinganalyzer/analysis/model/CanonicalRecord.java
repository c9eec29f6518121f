package com.meetinganalyzer.analysis.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public final class CanonicalRecord {

    private static final CanonicalRecord EMPTY = new CanonicalRecord(Collections.emptyMap());

    private final Map<String, String> values;

    private CanonicalRecord(Map<String, String> values) {
        this.values = values;
    }

    public static CanonicalRecord empty() {
        return EMPTY;
    }

    public static CanonicalRecord of(Map<String, String> partial) {
        for (String key : partial.keySet()) {
            if (!CanonicalSchema.isCanonical(key)) {
                throw new IllegalArgumentException("Not a canonical field: " + key);
            }
        }
        Map<String, String> ordered = new LinkedHashMap<>();
        for (String field : CanonicalSchema.FIELDS) {
            ordered.put(field, orNotAvailable(partial.get(field)));
        }
        return new CanonicalRecord(Collections.unmodifiableMap(ordered));
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public String get(String field) {
        return values.get(field);
    }

    public boolean isNotAvailable(String field) {
        return CanonicalSchema.NOT_AVAILABLE.equals(values.get(field));
    }

    public CanonicalRecord with(String field, String value) {
        return withAll(Map.of(field, orNotAvailable(value)));
    }

    public CanonicalRecord withAll(Map<String, String> updates) {
        if (isEmpty()) {
            throw new IllegalStateException("The empty record cannot be updated");
        }
        Map<String, String> merged = new LinkedHashMap<>(values);
        for (Map.Entry<String, String> update : updates.entrySet()) {
            if (!CanonicalSchema.isCanonical(update.getKey())) {
                throw new IllegalArgumentException("Not a canonical field: " + update.getKey());
            }
            merged.put(update.getKey(), orNotAvailable(update.getValue()));
        }
        return new CanonicalRecord(Collections.unmodifiableMap(merged));
    }

    public Map<String, String> asMap() {
        return values;
    }

    public List<String> toRow() {
        return new ArrayList<>(values.values());
    }

    private static String orNotAvailable(String value) {
        return value == null || value.isBlank() ? CanonicalSchema.NOT_AVAILABLE : value;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof CanonicalRecord that)) {
            return false;
        }
        return values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return isEmpty() ? "CanonicalRecord[empty]" : "CanonicalRecord" + values;
    }
}
