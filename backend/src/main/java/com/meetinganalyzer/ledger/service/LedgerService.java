package com.meetinganalyzer.ledger.service;

import com.meetinganalyzer.common.exception.ErrorKind;
import com.meetinganalyzer.common.exception.PipelineException;
import com.meetinganalyzer.ledger.model.LedgerEntry;
import com.meetinganalyzer.ledger.model.LedgerStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Service
public class LedgerService {

    private static final Logger log = LoggerFactory.getLogger(LedgerService.class);

    private final LedgerStore ledgerStore;
    private final ObjectClaimLock claimLock;
    private final Clock clock;
    private final Map<String, LedgerEntry> entries = new ConcurrentHashMap<>();
    private volatile boolean loaded;

    public LedgerService(LedgerStore ledgerStore, ObjectClaimLock claimLock, Clock clock) {
        this.ledgerStore = ledgerStore;
        this.claimLock = claimLock;
        this.clock = clock;
    }

    public synchronized void refresh() {
        List<LedgerEntry> stored = ledgerStore.readAll();
        entries.clear();
        for (LedgerEntry entry : stored) {
            entries.put(entry.objectId(), entry);
        }
        loaded = true;
        log.info("Loaded {} ledger entries", entries.size());
    }

    public boolean isProcessed(String objectId) {
        if (!loaded) {
            refresh();
        }
        LedgerEntry entry = entries.get(objectId);
        return entry != null && entry.isProcessed();
    }

    public Optional<LedgerEntry> entry(String objectId) {
        return Optional.ofNullable(entries.get(objectId));
    }

    /**
     * Claims the object for this worker and re-reads its ledger row. Returns {@code false}
     * when another worker holds the claim or the object turned out to be processed already.
     */
    public boolean tryClaim(String objectId) {
        if (!claimLock.tryClaim(objectId)) {
            log.info("Object {} is claimed by another worker", objectId);
            return false;
        }
        try {
            Optional<LedgerEntry> current = ledgerStore.find(objectId);
            current.ifPresent(entry -> entries.put(objectId, entry));
            if (current.map(LedgerEntry::isProcessed).orElse(false)) {
                log.info("Object {} was processed elsewhere; skipping", objectId);
                claimLock.release(objectId);
                return false;
            }
            return true;
        } catch (RuntimeException exception) {
            claimLock.release(objectId);
            throw exception;
        }
    }

    public void release(String objectId) {
        claimLock.release(objectId);
    }

    public LedgerEntry recordOutcome(String objectId, LedgerStatus status, String errorText, String displayName) {
        LedgerEntry entry = new LedgerEntry(
                objectId,
                displayName == null || displayName.isBlank() ? "Unknown" : displayName,
                status,
                errorText,
                clock.instant()
        );
        try {
            ledgerStore.upsert(entry);
        } catch (RuntimeException exception) {
            throw new PipelineException(ErrorKind.LEDGER_WRITE_FAILURE,
                    "Ledger write failed for " + objectId + ": " + exception.getMessage(), exception);
        }
        entries.put(objectId, entry);
        log.info("Ledger: {} -> {}", entry.objectName(), status.label());
        return entry;
    }
}
