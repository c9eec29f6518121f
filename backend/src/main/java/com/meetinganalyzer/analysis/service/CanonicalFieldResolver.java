package com.meetinganalyzer.analysis.service;

import com.meetinganalyzer.analysis.model.CanonicalSchema;
import com.meetinganalyzer.analysis.model.FieldAliases;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public final class CanonicalFieldResolver {

    private static final Map<String, String> NORMALIZED_ALIASES = new HashMap<>();
    private static final Map<String, String> NORMALIZED_FIELDS = new HashMap<>();

    static {
        FieldAliases.ALIASES.forEach((alias, field) -> NORMALIZED_ALIASES.putIfAbsent(normalize(alias), field));
        for (String field : CanonicalSchema.FIELDS) {
            NORMALIZED_FIELDS.putIfAbsent(normalize(field), field);
        }
    }

    private CanonicalFieldResolver() {
    }

    public static Optional<String> resolve(String key) {
        if (key == null || key.isBlank()) {
            return Optional.empty();
        }
        if (CanonicalSchema.isCanonical(key)) {
            return Optional.of(key);
        }

        String lower = key.trim().toLowerCase(Locale.ROOT);
        String alias = FieldAliases.ALIASES.get(lower);
        if (alias != null) {
            return Optional.of(alias);
        }

        String normalized = normalize(key);
        alias = NORMALIZED_ALIASES.get(normalized);
        if (alias != null) {
            return Optional.of(alias);
        }
        return Optional.ofNullable(NORMALIZED_FIELDS.get(normalized));
    }

    static String normalize(String key) {
        return key.toLowerCase(Locale.ROOT).replace(" ", "").replace("_", "").trim();
    }
}
