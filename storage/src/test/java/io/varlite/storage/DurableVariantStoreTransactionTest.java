// file: storage/src/test/java/io/varlite/storage/DurableVariantStoreTransactionTest.java
package io.varlite.storage;

import io.varlite.core.Location;
import io.varlite.core.Scope;
import io.varlite.core.TextNormalizer;
import io.varlite.core.VariantUnit;
import io.varlite.core.classify.Assessment;
import io.varlite.core.classify.Classification;
import io.varlite.core.classify.Significance;
import io.varlite.core.error.ConflictException;
import io.varlite.core.error.IntegrityException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static io.varlite.storage.StoreFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class DurableVariantStoreTransactionTest {

    @TempDir Path dataDir;

    private DurableVariantStore open() {
        return DurableVariantStore.open(dataDir, 1L << 60, 1000);
    }

    @Test
    void second_transaction_on_the_same_location_fails_fast() {
        try (var store = open()) {
            try (UnitTransaction first = store.begin(JOHN_1_18)) {
                assertThrows(ConflictException.class, () -> store.begin(JOHN_1_18));
                assertThrows(ConflictException.class, () -> store.resetUnit(JOHN_1_18));
                // other locations are unaffected
                try (UnitTransaction other = store.begin(Location.of("John.1.19", 0))) {
                    assertFalse(other.exists());
                }
                first.createUnit("a", "a");
                first.commit();
            }
            // released on close
            try (UnitTransaction again = store.begin(JOHN_1_18)) {
                assertTrue(again.exists());
            }
        }
    }

    @Test
    void support_is_added_once_per_siglum_and_pack() {
        try (var store = open()) {
            seedJohn(store);
            try (UnitTransaction tx = store.begin(JOHN_1_18)) {
                assertFalse(tx.addSupportIfAbsent(1, support("WH", "wh-pack")));
                assertTrue(tx.addSupportIfAbsent(1, support("WH", "other-pack")));
                tx.commit();
            }
            VariantUnit unit = store.getUnit(JOHN_1_18);
            assertEquals(2, unit.reading(1).supportCount());
            assertEquals(1, unit.reading(1).witnessCount());
            assertEquals(2, unit.reading(1).packCount());
        }
    }

    @Test
    void commit_without_changes_keeps_the_version() {
        try (var store = open()) {
            VariantUnit seeded = seedJohn(store);
            try (UnitTransaction tx = store.begin(JOHN_1_18)) {
                assertFalse(tx.addSupportIfAbsent(1, support("WH", "wh-pack")));
                assertFalse(tx.assessIfAbsent(1, major()));
                assertFalse(tx.hasChanges());
                tx.commit();
            }
            assertEquals(seeded.version(), store.getUnit(JOHN_1_18).version());
        }
    }

    @Test
    void duplicate_canonical_key_is_an_integrity_violation() {
        try (var store = open()) {
            seedJohn(store);
            try (UnitTransaction tx = store.begin(JOHN_1_18)) {
                String key = TextNormalizer.normalize("μονογενὴς υἱός");
                assertThrows(IntegrityException.class, () -> tx.addReading("Μονογενης υιος.", key));
                assertThrows(IntegrityException.class, () -> tx.createUnit("again", "again"));
            }
        }
    }

    @Test
    void evaluative_summary_is_refused_and_nothing_is_applied() {
        try (var store = open()) {
            VariantUnit seeded = seedJohn(store);
            Assessment biased = new Assessment(Classification.ADDITION, Significance.SIGNIFICANT,
                    "substantive_difference", "This is the preferred reading");
            try (UnitTransaction tx = store.begin(JOHN_1_18)) {
                int idx = tx.addReading("μονογενὴς ὁ υἱός", TextNormalizer.normalize("μονογενὴς ὁ υἱός"));
                tx.assessIfAbsent(idx, biased);
                assertThrows(IntegrityException.class, tx::commit);
            }
            assertEquals(seeded, store.getUnit(JOHN_1_18));
        }
    }

    @Test
    void spine_is_never_assessed() {
        try (var store = open()) {
            seedJohn(store);
            try (UnitTransaction tx = store.begin(JOHN_1_18)) {
                assertThrows(IntegrityException.class, () -> tx.assessIfAbsent(0, major()));
                assertThrows(IntegrityException.class, () -> tx.addSupportIfAbsent(7, support("X", "p")));
            }
        }
    }

    @Test
    void version_increments_per_commit() {
        try (var store = open()) {
            assertEquals(1, seedJohn(store).version());
            try (UnitTransaction tx = store.begin(JOHN_1_18)) {
                tx.addSupportIfAbsent(1, support("Byz", "byz-pack"));
                assertEquals(2, tx.commit().version());
            }
        }
    }

    @Test
    void scope_query_returns_units_in_location_order() {
        try (var store = open()) {
            for (Location loc : List.of(Location.of("John.2.1", 0), Location.of("John.1.18", 1),
                    Location.of("John.1.9", 0), Location.of("John.1.18", 0), Location.of("Mark.1.1", 0))) {
                try (UnitTransaction tx = store.begin(loc)) {
                    tx.createUnit(loc.toString(), loc.toString());
                    tx.commit();
                }
            }
            List<String> ch1 = store.getUnitsForScope(Scope.parse("John.1")).stream()
                    .map(u -> u.location().toString()).toList();
            assertEquals(List.of("John.1.9@0", "John.1.18@0", "John.1.18@1"), ch1);
            assertEquals(4, store.getUnitsForScope(Scope.parse("John")).size());
            assertEquals(2, store.getUnitsForScope(Scope.parse("John.1.18")).size());
        }
    }
}
