// file: engine/src/test/java/io/varlite/engine/gate/GateResolverTest.java
package io.varlite.engine.gate;

import io.varlite.core.AcknowledgementRecord;
import io.varlite.core.VariantUnit;
import io.varlite.core.error.InputException;
import io.varlite.engine.AggregationEngine;
import io.varlite.engine.TestPacks;
import io.varlite.storage.DurableAcknowledgementStore;
import io.varlite.storage.DurableVariantStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GateResolverTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    @TempDir Path dataDir;

    private DurableVariantStore units;
    private DurableAcknowledgementStore acks;
    private TestPacks packs;
    private AggregationEngine engine;
    private GateResolver gate;

    @BeforeEach
    void setUp() {
        units = DurableVariantStore.open(dataDir.resolve("variants"), 1L << 60, 1000);
        acks = DurableAcknowledgementStore.open(dataDir.resolve("acks"), 1L << 60, 1000);
        packs = TestPacks.john();
        engine = new AggregationEngine(units, packs, packs);
        gate = new GateResolver(units, acks, Clock.fixed(NOW, ZoneOffset.UTC));
        engine.build("John.1", List.of("wh", "byz"));
    }

    @AfterEach
    void tearDown() {
        acks.close();
        units.close();
    }

    private VariantUnit john18() {
        return units.getUnit("John.1.18", 0);
    }

    @Test
    void pending_lists_the_merged_unit_once() {
        List<VariantUnit> pending = gate.pending("John.1", "s1");

        assertEquals(1, pending.size());
        assertEquals(john18().id(), pending.get(0).id());
        assertEquals(GateState.UNACKNOWLEDGED, gate.state(UnitRef.of(john18()), "s1"));
    }

    @Test
    void acknowledged_unit_leaves_pending_for_that_session_only() {
        AcknowledgementRecord ack = gate.acknowledge(UnitRef.of(john18()), 1, "s1", "compared both editions");

        assertEquals(NOW, ack.acknowledgedAt());
        assertEquals(1, ack.readingIndex());
        assertTrue(gate.pending("John.1", "s1").isEmpty());
        assertEquals(1, gate.pending("John.1", "s2").size());
        assertEquals(GateState.ACKNOWLEDGED, gate.state(UnitRef.at("John.1.18", 0), "s1"));
    }

    @Test
    void acknowledgement_survives_a_third_corroborating_pack() {
        gate.acknowledge(UnitRef.byId(john18().id()), 1, "s1", "");
        packs.reading("na28", "John.1.18", "μονογενὴς υἱός", "NA28", "na28");

        var r = engine.build("John.1", List.of("wh", "byz", "na28"));

        assertEquals(1, r.supportsAdded());
        assertEquals(3, john18().reading(1).supportCount());
        assertTrue(gate.pending("John.1", "s1").isEmpty());
        assertNotNull(gate.acknowledgement(UnitRef.of(john18()), "s1"));
    }

    @Test
    void reacknowledging_replaces_reading_and_reason() {
        gate.acknowledge(UnitRef.of(john18()), 1, "s1", "first look");
        gate.acknowledge(UnitRef.of(john18()), 0, "s1", "kept the base text");

        AcknowledgementRecord ack = gate.acknowledgement(UnitRef.of(john18()), "s1");
        assertEquals(0, ack.readingIndex());
        assertEquals("kept the base text", ack.reason());
        assertEquals(1, gate.acknowledgements("s1").size());
    }

    @Test
    void invalid_acknowledgements_write_nothing() {
        VariantUnit unit = john18();
        assertThrows(InputException.class, () -> gate.acknowledge(UnitRef.of(unit), 2, "s1", ""));
        assertThrows(InputException.class, () -> gate.acknowledge(UnitRef.of(unit), -1, "s1", ""));
        assertThrows(InputException.class, () -> gate.acknowledge(UnitRef.of(unit), 1, " ", ""));
        assertThrows(InputException.class, () -> gate.acknowledge(UnitRef.byId(9_999), 1, "s1", ""));
        assertThrows(InputException.class, () -> gate.acknowledge(UnitRef.at("John.1.19", 0), 0, "s1", ""));
        assertThrows(InputException.class,
                () -> gate.acknowledge(new UnitRef(unit.id(), units.getUnit("John.1.1", 0).location()), 0, "s1", ""));

        assertEquals(0, acks.size());
        assertEquals(1, gate.pending("John.1", "s1").size());
    }

    @Test
    void minor_and_unassessed_units_are_never_pending() {
        packs.reading("wh", "John.1.1", "ἐν ἀρχῇ ἦν λόγος", "WH", "edition");
        engine.build("John.1.1", List.of("wh"));

        VariantUnit minor = units.getUnit("John.1.1", 0);
        assertFalse(minor.requiresAcknowledgement());
        assertEquals(List.of(john18().id()), gate.pending("John", "s1").stream().map(VariantUnit::id).toList());
    }

    @Test
    void pending_rejects_bad_scope_and_blank_session() {
        assertThrows(InputException.class, () -> gate.pending("John.one", "s1"));
        assertThrows(InputException.class, () -> gate.pending("John.1", ""));
    }
}
