package com.meetinganalyzer.ledger.model;

import java.util.Locale;

public enum LedgerStatus {
    PROCESSED("Processed"),
    FAILED("Failed"),
    RETRY_PENDING("Moved back for retry");

    private final String label;

    LedgerStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static LedgerStatus fromLabel(String label) {
        if (label == null) {
            return FAILED;
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        for (LedgerStatus status : values()) {
            if (status.label.toLowerCase(Locale.ROOT).equals(normalized)) {
                return status;
            }
        }
        return FAILED;
    }
}
