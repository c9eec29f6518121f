package com.meetinganalyzer.ledger.service;

import com.meetinganalyzer.ledger.model.LedgerEntry;

import java.util.List;
import java.util.Optional;

public interface LedgerStore {

    List<LedgerEntry> readAll();

    Optional<LedgerEntry> find(String objectId);

    void upsert(LedgerEntry entry);
}
