package com.meetinganalyzer.analysis.service;

import com.meetinganalyzer.analysis.model.CanonicalRecord;
import com.meetinganalyzer.analysis.model.CanonicalSchema;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class ScoreCalculator {

    static final int MAX_SUB_SCORE = 10;
    private static final Pattern NUMBER = Pattern.compile("-?\\d+(?:\\.\\d+)?");

    private ScoreCalculator() {
    }

    public static OptionalInt parseScore(String raw) {
        if (raw == null) {
            return OptionalInt.empty();
        }
        String text = raw.trim();
        if (text.isEmpty() || CanonicalSchema.NOT_AVAILABLE.equalsIgnoreCase(text)) {
            return OptionalInt.empty();
        }
        int slash = text.indexOf('/');
        if (slash >= 0) {
            text = text.substring(0, slash);
        }
        Matcher matcher = NUMBER.matcher(text.replace("%", ""));
        if (!matcher.find()) {
            return OptionalInt.empty();
        }
        int rounded = new BigDecimal(matcher.group()).setScale(0, RoundingMode.HALF_UP).intValue();
        return OptionalInt.of(Math.max(0, Math.min(MAX_SUB_SCORE, rounded)));
    }

    public static CanonicalRecord apply(CanonicalRecord record) {
        if (record.isEmpty()) {
            return record;
        }
        Map<String, String> updates = new LinkedHashMap<>();
        int total = 0;
        for (String field : CanonicalSchema.SCORE_FIELDS) {
            OptionalInt score = parseScore(record.get(field));
            if (score.isEmpty()) {
                return record;
            }
            total += score.getAsInt();
            updates.put(field, Integer.toString(score.getAsInt()));
        }
        double percent = total * 100.0 / (CanonicalSchema.SCORE_FIELDS.size() * MAX_SUB_SCORE);
        updates.put(CanonicalSchema.TOTAL_SCORE, Integer.toString(total));
        updates.put(CanonicalSchema.PERCENT_SCORE, String.format(Locale.ROOT, "%.1f%%", percent));
        return record.withAll(updates);
    }
}
