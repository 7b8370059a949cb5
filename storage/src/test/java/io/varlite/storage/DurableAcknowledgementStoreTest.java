// file: storage/src/test/java/io/varlite/storage/DurableAcknowledgementStoreTest.java
package io.varlite.storage;

import io.varlite.core.AcknowledgementRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DurableAcknowledgementStoreTest {

    @TempDir Path dir;

    private DurableAcknowledgementStore open(int snapshotEvery) {
        return DurableAcknowledgementStore.open(dir, 1L << 60, snapshotEvery);
    }

    @Test
    void upsert_replaces_reading_reason_and_timestamp() {
        try (var store = open(1000)) {
            Instant t1 = Instant.parse("2024-01-01T00:00:00Z");
            Instant t2 = Instant.parse("2024-01-02T00:00:00Z");
            store.upsert(new AcknowledgementRecord(7, "s1", 1, "seen", t1));
            store.upsert(new AcknowledgementRecord(7, "s1", 2, "checked apparatus", t2));

            AcknowledgementRecord ack = store.find(7, "s1");
            assertEquals(2, ack.readingIndex());
            assertEquals("checked apparatus", ack.reason());
            assertEquals(t2, ack.acknowledgedAt());
            assertEquals(1, store.size());
            assertNull(store.find(7, "s2"));
        }
    }

    @Test
    void acknowledgements_survive_restart_with_and_without_snapshot() {
        Instant t = Instant.parse("2024-03-05T10:15:30Z");
        try (var store = open(2)) {
            store.upsert(new AcknowledgementRecord(1, "s1", 1, "", t));
            store.upsert(new AcknowledgementRecord(2, "s1", 1, null, t)); // snapshot here
            store.upsert(new AcknowledgementRecord(3, "s2", 1, "r", t));  // WAL only
        }
        try (var store = open(2)) {
            assertEquals(3, store.size());
            assertEquals(List.of(1L, 2L), store.listForSession("s1").stream().map(AcknowledgementRecord::unitId).toList());
            assertEquals("", store.find(2, "s1").reason());
            assertEquals(t, store.find(3, "s2").acknowledgedAt());
        }
    }

    @Test
    void blank_session_is_rejected() {
        try (var store = open(1000)) {
            assertThrows(IllegalArgumentException.class,
                    () -> store.upsert(new AcknowledgementRecord(1, " ", 1, "", Instant.now())));
            assertEquals(0, store.size());
        }
    }
}
