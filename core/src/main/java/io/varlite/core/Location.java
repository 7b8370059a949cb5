// file: core/src/main/java/io/varlite/core/Location.java
package io.varlite.core;

import io.varlite.core.error.InputException;

import java.util.Comparator;
import java.util.Objects;

/**
 * A single point of comparison: a verse plus a position within it.
 * Verse-level comparison uses position 0.
 */
public record Location(VerseRef verse, int position) implements Comparable<Location> {

    private static final Comparator<Location> ORDER = Comparator
            .comparing(Location::verse)
            .thenComparingInt(Location::position);

    public Location {
        Objects.requireNonNull(verse, "verse");
        if (position < 0) throw new InputException("Position must be >= 0, got " + position);
    }

    public static Location of(String verseId, int position) {
        return new Location(VerseRef.parse(verseId), position);
    }

    public String verseId() {
        return verse.id();
    }

    @Override
    public int compareTo(Location o) {
        return ORDER.compare(this, o);
    }

    @Override
    public String toString() {
        return verse.id() + "@" + position;
    }
}
