package com.meetinganalyzer.analysis.service;

import org.springframework.web.client.RestClientResponseException;

import java.util.List;
import java.util.Locale;

public final class QuotaErrors {

    private static final List<String> KEYWORDS = List.of(
            "resourceexhausted",
            "resource exhausted",
            "resource_exhausted",
            "quota exceeded",
            "too many requests",
            "rate limit",
            "rate-limit"
    );

    private QuotaErrors() {
    }

    public static boolean isQuotaError(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < 10) {
            if (current instanceof RestClientResponseException response && response.getStatusCode().value() == 429) {
                return true;
            }
            if (mentionsQuota(current.getMessage())) {
                return true;
            }
            if (current instanceof RestClientResponseException response && mentionsQuota(response.getResponseBodyAsString())) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private static boolean mentionsQuota(String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        return KEYWORDS.stream().anyMatch(lower::contains);
    }
}
