package com.meetinganalyzer.ledger.model;

import java.time.Instant;

public record LedgerEntry(
        String objectId,
        String objectName,
        LedgerStatus status,
        String errorText,
        Instant timestamp
) {

    public static final int MAX_ERROR_LENGTH = 500;

    public LedgerEntry {
        if (objectId == null || objectId.isBlank()) {
            throw new IllegalArgumentException("Ledger entries need an object id");
        }
        errorText = errorText == null ? "" : errorText;
        if (errorText.length() > MAX_ERROR_LENGTH) {
            errorText = errorText.substring(0, MAX_ERROR_LENGTH);
        }
    }

    public boolean isProcessed() {
        return status == LedgerStatus.PROCESSED;
    }
}
