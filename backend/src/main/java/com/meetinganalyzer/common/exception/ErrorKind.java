package com.meetinganalyzer.common.exception;

public enum ErrorKind {
    TRANSIENT_TRANSFER,
    RETRIEVAL_FAILED,
    EMPTY_TRANSCRIPT,
    UNPARSABLE_RESPONSE,
    PROVIDER_UNAVAILABLE,
    QUOTA_EXCEEDED,
    PERSISTENCE_FAILURE,
    LEDGER_WRITE_FAILURE,
    QUARANTINE_FAILURE;

    public boolean haltsRun() {
        return this == QUOTA_EXCEEDED;
    }
}
