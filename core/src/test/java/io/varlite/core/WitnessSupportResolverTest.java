// file: core/src/test/java/io/varlite/core/WitnessSupportResolverTest.java
package io.varlite.core;

import io.varlite.core.error.InputException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WitnessSupportResolverTest {

    @Test
    void manuscript_labels_resolve_to_manuscript() {
        assertEquals(WitnessType.MANUSCRIPT, WitnessSupportResolver.resolve("papyrus"));
        assertEquals(WitnessType.MANUSCRIPT, WitnessSupportResolver.resolve("Uncial"));
        assertEquals(WitnessType.MANUSCRIPT, WitnessSupportResolver.resolve(" minuscule "));
    }

    @Test
    void named_editions_and_traditions_resolve() {
        assertEquals(WitnessType.EDITION, WitnessSupportResolver.resolve("edition"));
        assertEquals(WitnessType.EDITION, WitnessSupportResolver.resolve("Westcott-Hort"));
        assertEquals(WitnessType.EDITION, WitnessSupportResolver.resolve("westcott_hort"));
        assertEquals(WitnessType.TRADITION, WitnessSupportResolver.resolve("Byzantine"));
        assertEquals(WitnessType.TRADITION, WitnessSupportResolver.resolve("Majority  Text"));
    }

    @Test
    void unknown_or_missing_labels_resolve_to_other() {
        assertEquals(WitnessType.OTHER, WitnessSupportResolver.resolve("father"));
        assertEquals(WitnessType.OTHER, WitnessSupportResolver.resolve("something new"));
        assertEquals(WitnessType.OTHER, WitnessSupportResolver.resolve(""));
        assertEquals(WitnessType.OTHER, WitnessSupportResolver.resolve(null));
    }

    @Test
    void support_carries_pack_attribution_and_century() {
        var s = WitnessSupportResolver.support(" P66 ", "papyrus", "papyri-pack", CenturyRange.of(2));
        assertEquals("P66", s.siglum());
        assertEquals(WitnessType.MANUSCRIPT, s.type());
        assertEquals("papyri-pack", s.sourcePackId());
        assertEquals(2, s.century().earliest());
    }

    @Test
    void identity_is_siglum_and_pack_only() {
        var a = WitnessSupportResolver.support("B", "uncial", "pack-a", CenturyRange.of(4));
        var sameOtherType = WitnessSupportResolver.support("B", "codex", "pack-a", null);
        var otherPack = WitnessSupportResolver.support("B", "uncial", "pack-b", CenturyRange.of(4));

        assertTrue(a.sameAttestation(sameOtherType));
        assertFalse(a.sameAttestation(otherPack));
    }

    @Test
    void support_requires_siglum_and_pack() {
        assertThrows(InputException.class, () -> WitnessSupportResolver.support(" ", "papyrus", "p", null));
        assertThrows(InputException.class, () -> WitnessSupportResolver.support("P75", "papyrus", "", null));
        assertThrows(InputException.class, () -> new CenturyRange(5, 3));
    }
}
