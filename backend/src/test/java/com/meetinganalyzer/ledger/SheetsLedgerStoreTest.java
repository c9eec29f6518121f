package com.meetinganalyzer.ledger;

import com.meetinganalyzer.TestProperties;
import com.meetinganalyzer.ledger.adapter.SheetsLedgerStore;
import com.meetinganalyzer.ledger.model.LedgerEntry;
import com.meetinganalyzer.ledger.model.LedgerStatus;
import com.meetinganalyzer.sheets.SheetsClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SheetsLedgerStoreTest {

    private static final List<String> HEADER = List.of("File ID", "File Name", "Status", "Error", "Timestamp");

    @Mock
    private SheetsClient sheetsClient;

    private SheetsLedgerStore store;

    @BeforeEach
    void setUp() {
        store = new SheetsLedgerStore(sheetsClient, TestProperties.defaults());
    }

    @Test
    void readsRowsAfterHeaderAndMapsUnknownStatusToFailed() {
        when(sheetsClient.readRows("Ledger")).thenReturn(List.of(
                HEADER,
                List.of("id-1", "a.mp3", "Processed", "", "2025-09-04 10:15:30"),
                List.of(),
                List.of("id-2", "b.mp3", "Exploded", "oops")
        ));

        List<LedgerEntry> entries = store.readAll();

        assertThat(entries).hasSize(2);
        assertThat(entries.get(0).status()).isEqualTo(LedgerStatus.PROCESSED);
        assertThat(entries.get(0).timestamp()).isEqualTo(Instant.parse("2025-09-04T10:15:30Z"));
        assertThat(entries.get(1).status()).isEqualTo(LedgerStatus.FAILED);
        assertThat(entries.get(1).timestamp()).isNull();
        verify(sheetsClient, times(1)).ensureTab("Ledger", HEADER);
    }

    @Test
    void upsertUpdatesExistingRowInPlace() {
        when(sheetsClient.readRows("Ledger")).thenReturn(List.of(
                HEADER,
                List.of("id-1", "a.mp3", "Failed", "[EMPTY_TRANSCRIPT] x", "2025-09-03 09:00:00"),
                List.of("id-2", "b.mp3", "Failed", "", "")
        ));

        store.upsert(new LedgerEntry("id-2", "b.mp3", LedgerStatus.PROCESSED, "",
                Instant.parse("2025-09-04T10:15:30Z")));

        verify(sheetsClient).updateRow("Ledger", 3,
                List.of("id-2", "b.mp3", "Processed", "", "2025-09-04 10:15:30"));
        verify(sheetsClient, never()).appendRow(any(), anyList());
    }

    @Test
    void upsertAppendsNewObject() {
        when(sheetsClient.readRows("Ledger")).thenReturn(List.of(HEADER));

        store.upsert(new LedgerEntry("id-9", "new.mp3", LedgerStatus.FAILED, "[RETRIEVAL_FAILED] gone",
                Instant.parse("2025-09-04T10:15:30Z")));

        verify(sheetsClient).appendRow(eq("Ledger"),
                eq(List.of("id-9", "new.mp3", "Failed", "[RETRIEVAL_FAILED] gone", "2025-09-04 10:15:30")));
        verify(sheetsClient, never()).updateRow(any(), anyInt(), anyList());
    }

    @Test
    void findReturnsLastMatchingRow() {
        when(sheetsClient.readRows("Ledger")).thenReturn(List.of(
                HEADER,
                List.of("id-1", "a.mp3", "Failed", "first"),
                List.of("id-1", "a.mp3", "Processed", "")
        ));

        assertThat(store.find("id-1")).get().extracting(LedgerEntry::status).isEqualTo(LedgerStatus.PROCESSED);
        assertThat(store.find("id-404")).isEmpty();
    }
}
