package com.meetinganalyzer.ledger.service;

public interface ObjectClaimLock {

    boolean tryClaim(String objectId);

    void release(String objectId);
}
