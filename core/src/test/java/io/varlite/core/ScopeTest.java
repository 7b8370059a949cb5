// file: core/src/test/java/io/varlite/core/ScopeTest.java
package io.varlite.core;

import io.varlite.core.error.InputException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScopeTest {

    @Test
    void parses_book_chapter_and_verse_scopes() {
        assertEquals(Scope.book("John"), Scope.parse("John"));
        assertEquals(Scope.chapter("John", 1), Scope.parse("John.1"));
        assertEquals(Scope.verse(new VerseRef("1Cor", 13, 4)), Scope.parse("1Cor.13.4"));
    }

    @Test
    void rejects_malformed_scopes() {
        for (String bad : new String[]{null, "", "  ", "John.", "John.x", "John.0", "John.1.2.3", "Jo hn", "4John", "John.1.-2"}) {
            assertThrows(InputException.class, () -> Scope.parse(bad), "should reject: " + bad);
        }
    }

    @Test
    void containment_follows_granularity() {
        var v = VerseRef.parse("John.1.18");
        assertTrue(Scope.parse("John").contains(v));
        assertTrue(Scope.parse("John.1").contains(v));
        assertTrue(Scope.parse("John.1.18").contains(v));
        assertFalse(Scope.parse("John.2").contains(v));
        assertFalse(Scope.parse("John.1.17").contains(v));
        assertFalse(Scope.parse("Mark").contains(v));
    }

    @Test
    void verse_refs_sort_numerically() {
        List<VerseRef> refs = new ArrayList<>(List.of(
                VerseRef.parse("John.1.10"), VerseRef.parse("John.1.9"), VerseRef.parse("John.10.1"), VerseRef.parse("John.2.1")));
        Collections.sort(refs);
        assertEquals(List.of("John.1.9", "John.1.10", "John.2.1", "John.10.1"),
                refs.stream().map(VerseRef::id).toList());
    }

    @Test
    void location_rejects_negative_position() {
        assertThrows(InputException.class, () -> Location.of("John.1.1", -1));
        assertEquals("John.1.1@0", Location.of("John.1.1", 0).toString());
    }
}
