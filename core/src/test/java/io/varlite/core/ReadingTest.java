// file: core/src/test/java/io/varlite/core/ReadingTest.java
package io.varlite.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ReadingTest {

    private static Reading supportedBy(String typeLabel, String... sigla) {
        Reading r = Reading.alternate(1, "μονογενὴς υἱός", TextNormalizer.normalize("μονογενὴς υἱός"));
        for (String siglum : sigla) {
            r = r.withSupport(WitnessSupportResolver.support(siglum, typeLabel, "pack-" + siglum, null));
        }
        return r;
    }

    @Test
    void papyri_are_manuscript_supports_with_a_papyrus_siglum() {
        assertTrue(supportedBy("papyrus", "P66").hasPapyri());
        assertTrue(supportedBy("papyrus", "𝔓75").hasPapyri());
        assertFalse(supportedBy("edition", "P66").hasPapyri());
        assertFalse(supportedBy("uncial", "B").hasPapyri());
    }

    @Test
    void primary_uncials_accept_letters_and_numbers() {
        assertTrue(supportedBy("uncial", "א").hasPrimaryUncials());
        assertTrue(supportedBy("codex", "03").hasPrimaryUncials());
        assertFalse(supportedBy("uncial", "W").hasPrimaryUncials());
        assertFalse(supportedBy("edition", "B").hasPrimaryUncials());
    }

    @Test
    void witness_summary_lists_five_distinct_sigla() {
        assertEquals("No witnesses recorded", supportedBy("edition").witnessSummary());
        assertEquals("WH, Byz", supportedBy("edition", "WH", "Byz").witnessSummary());

        Reading many = supportedBy("uncial", "P66", "א", "B", "A", "C", "D", "W")
                .withSupport(WitnessSupportResolver.support("B", "uncial", "other-pack", null));
        assertEquals("P66, א, B, A, C (+2 more)", many.witnessSummary());
    }
}
