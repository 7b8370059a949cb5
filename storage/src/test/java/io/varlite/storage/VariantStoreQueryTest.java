// file: storage/src/test/java/io/varlite/storage/VariantStoreQueryTest.java
package io.varlite.storage;

import io.varlite.core.Location;
import io.varlite.core.Scope;
import io.varlite.core.TextNormalizer;
import io.varlite.core.VariantUnit;
import io.varlite.core.VerseRef;
import io.varlite.core.classify.Assessment;
import io.varlite.core.classify.Classification;
import io.varlite.core.classify.Significance;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static io.varlite.storage.StoreFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class VariantStoreQueryTest {

    @TempDir Path dataDir;

    private static void commit(VariantStore store, String verseId, Significance significance) {
        try (UnitTransaction tx = store.begin(Location.of(verseId, 0))) {
            tx.createUnit("καὶ", "και");
            if (significance != null) {
                int idx = tx.addReading("δέ", TextNormalizer.normalize("δέ"));
                tx.addSupportIfAbsent(idx, support("WH", "wh"));
                tx.assessIfAbsent(idx, new Assessment(Classification.SUBSTITUTION, significance,
                        "substantive_difference", "Readings differ in wording"));
            }
            tx.commit();
        }
    }

    @Test
    void significance_filters_and_counts_follow_scope() {
        try (var store = DurableVariantStore.open(dataDir, 1L << 60, 1000)) {
            seedJohn(store);
            commit(store, "John.1.3", Significance.MINOR);
            commit(store, "John.1.4", Significance.SIGNIFICANT);
            commit(store, "John.1.5", null);
            commit(store, "John.2.1", Significance.MAJOR);

            Scope john1 = Scope.chapter("John", 1);
            assertEquals(List.of("John.1.4", "John.1.18"),
                    store.getSignificantUnits(john1, Significance.SIGNIFICANT).stream().map(VariantUnit::verseId).toList());
            assertEquals(1, store.getSignificantUnits(john1, Significance.MAJOR).size());
            assertEquals(4, store.countUnits(john1, null));
            assertEquals(1, store.countUnits(john1, Significance.MINOR));
            assertEquals(2, store.countUnits(Scope.book("John"), Significance.MAJOR));

            assertTrue(store.hasSignificantUnit(VerseRef.parse("John.1.18")));
            assertFalse(store.hasSignificantUnit(VerseRef.parse("John.1.3")));
            assertFalse(store.hasSignificantUnit(VerseRef.parse("John.1.5")));
            assertFalse(store.hasSignificantUnit(VerseRef.parse("John.1.6")));
        }
    }
}
