package com.meetinganalyzer.ledger.adapter;

import com.meetinganalyzer.config.AppProperties;
import com.meetinganalyzer.ledger.model.LedgerEntry;
import com.meetinganalyzer.ledger.model.LedgerStatus;
import com.meetinganalyzer.ledger.service.LedgerStore;
import com.meetinganalyzer.sheets.SheetsClient;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Component
public class SheetsLedgerStore implements LedgerStore {

    static final List<String> HEADERS = List.of("File ID", "File Name", "Status", "Error", "Timestamp");
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final SheetsClient sheetsClient;
    private final String tab;
    private volatile boolean tabReady;

    public SheetsLedgerStore(SheetsClient sheetsClient, AppProperties appProperties) {
        this.sheetsClient = sheetsClient;
        this.tab = appProperties.sheets().ledgerTab();
    }

    @Override
    public List<LedgerEntry> readAll() {
        ensureTab();
        List<List<String>> rows = sheetsClient.readRows(tab);
        List<LedgerEntry> entries = new ArrayList<>();
        for (int i = 1; i < rows.size(); i++) {
            toEntry(rows.get(i)).ifPresent(entries::add);
        }
        return entries;
    }

    @Override
    public Optional<LedgerEntry> find(String objectId) {
        LedgerEntry found = null;
        for (LedgerEntry entry : readAll()) {
            if (entry.objectId().equals(objectId)) {
                found = entry;
            }
        }
        return Optional.ofNullable(found);
    }

    @Override
    public synchronized void upsert(LedgerEntry entry) {
        ensureTab();
        List<String> row = toRow(entry);
        List<List<String>> rows = sheetsClient.readRows(tab);
        for (int i = 1; i < rows.size(); i++) {
            List<String> existing = rows.get(i);
            if (!existing.isEmpty() && entry.objectId().equals(existing.get(0).trim())) {
                sheetsClient.updateRow(tab, i + 1, row);
                return;
            }
        }
        sheetsClient.appendRow(tab, row);
    }

    private synchronized void ensureTab() {
        if (!tabReady) {
            sheetsClient.ensureTab(tab, HEADERS);
            tabReady = true;
        }
    }

    static List<String> toRow(LedgerEntry entry) {
        String timestamp = entry.timestamp() == null
                ? ""
                : TIMESTAMP.format(LocalDateTime.ofInstant(entry.timestamp(), ZoneOffset.UTC));
        return List.of(
                entry.objectId(),
                entry.objectName() == null ? "" : entry.objectName(),
                entry.status().label(),
                entry.errorText(),
                timestamp
        );
    }

    static Optional<LedgerEntry> toEntry(List<String> row) {
        String objectId = cell(row, 0);
        if (objectId.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(new LedgerEntry(
                objectId,
                cell(row, 1),
                LedgerStatus.fromLabel(cell(row, 2)),
                cell(row, 3),
                parseTimestamp(cell(row, 4))
        ));
    }

    private static String cell(List<String> row, int index) {
        return index < row.size() && row.get(index) != null ? row.get(index).trim() : "";
    }

    private static Instant parseTimestamp(String value) {
        if (value.isBlank()) {
            return null;
        }
        try {
            return LocalDateTime.parse(value, TIMESTAMP).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException exception) {
            return null;
        }
    }
}
