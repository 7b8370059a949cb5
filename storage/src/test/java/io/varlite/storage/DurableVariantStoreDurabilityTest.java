// file: storage/src/test/java/io/varlite/storage/DurableVariantStoreDurabilityTest.java
package io.varlite.storage;

import io.varlite.core.Location;
import io.varlite.core.Scope;
import io.varlite.core.VariantUnit;
import io.varlite.core.classify.Significance;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static io.varlite.storage.StoreFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class DurableVariantStoreDurabilityTest {

    @TempDir Path dataDir;

    private DurableVariantStore open(int snapshotEvery) {
        return DurableVariantStore.open(dataDir, 1L << 60, snapshotEvery);
    }

    private long count(Path dir, String suffix) throws IOException {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> p.getFileName().toString().endsWith(suffix)).count();
        }
    }

    @Test
    void committed_unit_survives_restart_from_wal_alone() {
        var store1 = open(1000);
        VariantUnit committed = seedJohn(store1);
        store1.close();

        var store2 = open(1000);
        VariantUnit recovered = store2.getUnit("John.1.18", 0);

        assertEquals(committed, recovered);
        assertEquals(1, recovered.version());
        assertEquals(Significance.MAJOR, recovered.significance());
        assertSame(recovered, store2.getUnitById(committed.id()));
        store2.close();
    }

    @Test
    void snapshot_plus_wal_tail_rebuilds_the_same_state() throws Exception {
        var store1 = open(2);
        VariantUnit john = seedJohn(store1);
        try (UnitTransaction tx = store1.begin(JOHN_1_18)) {
            tx.addSupportIfAbsent(1, support("Byz", "byz-pack"));
            tx.commit();
        } // second commit triggers snapshot + checkpoint
        try (UnitTransaction tx = store1.begin(Location.of("John.1.19", 0))) {
            tx.createUnit("καὶ αὕτη ἐστὶν", "και αυτη εστιν");
            tx.commit();
        } // third commit lives in the WAL only
        VariantUnit johnAfter = store1.getUnit(JOHN_1_18);
        store1.close();

        assertEquals(1, count(dataDir.resolve("snap"), ".json"));

        var store2 = open(2);
        assertEquals(2, store2.unitCount());
        assertEquals(johnAfter, store2.getUnit(JOHN_1_18));
        assertEquals(2, store2.getUnit(JOHN_1_18).reading(1).supportCount());
        assertEquals(john.id(), store2.getUnit(JOHN_1_18).id());
        assertNotNull(store2.getUnit("John.1.19", 0));
        store2.close();
    }

    @Test
    void unit_ids_are_never_reused_after_restart() {
        var store1 = open(1000);
        long first = seedJohn(store1).id();
        store1.close();

        var store2 = open(1000);
        try (UnitTransaction tx = store2.begin(Location.of("John.1.19", 0))) {
            tx.createUnit("x", "x");
            assertTrue(tx.commit().id() > first);
        }
        store2.close();
    }

    @Test
    void operator_reset_is_durable() {
        var store1 = open(1000);
        long id = seedJohn(store1).id();
        assertTrue(store1.resetUnit(JOHN_1_18));
        assertFalse(store1.resetUnit(JOHN_1_18));
        store1.close();

        var store2 = open(1000);
        assertNull(store2.getUnit(JOHN_1_18));
        assertNull(store2.getUnitById(id));
        assertTrue(store2.getUnitsForScope(Scope.parse("John")).isEmpty());
        store2.close();
    }
}
