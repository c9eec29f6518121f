package com.meetinganalyzer.analysis.service;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class FilenameDateExtractor {

    private static final Pattern EXTENSION = Pattern.compile("\\.[A-Za-z0-9]*[A-Za-z][A-Za-z0-9]*$");
    private static final Pattern YEAR_FIRST = Pattern.compile("(?<!\\d)(\\d{4})[-_/.](\\d{1,2})[-_/.](\\d{1,2})(?!\\d)");
    private static final Pattern DAY_FIRST = Pattern.compile("(?<!\\d)(\\d{1,2})[-_/.](\\d{1,2})[-_/.](\\d{4}|\\d{2})(?!\\d)");

    private FilenameDateExtractor() {
    }

    public static Optional<LocalDate> extract(String fileName) {
        if (fileName == null || fileName.isBlank()) {
            return Optional.empty();
        }
        String base = EXTENSION.matcher(fileName.trim()).replaceFirst("");

        for (Pattern pattern : List.of(YEAR_FIRST, DAY_FIRST)) {
            Matcher matcher = pattern.matcher(base);
            while (matcher.find()) {
                Optional<LocalDate> date = pattern == YEAR_FIRST
                        ? toDate(matcher.group(1), matcher.group(2), matcher.group(3))
                        : toDate(matcher.group(3), matcher.group(2), matcher.group(1));
                if (date.isPresent()) {
                    return date;
                }
            }
        }
        return Optional.empty();
    }

    private static Optional<LocalDate> toDate(String year, String month, String day) {
        int y = Integer.parseInt(year);
        if (year.length() == 2) {
            y += 2000;
        }
        try {
            return Optional.of(LocalDate.of(y, Integer.parseInt(month), Integer.parseInt(day)));
        } catch (DateTimeException exception) {
            return Optional.empty();
        }
    }
}
