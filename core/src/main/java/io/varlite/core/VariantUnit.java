// file: core/src/main/java/io/varlite/core/VariantUnit.java
package io.varlite.core;

import io.varlite.core.classify.Assessment;
import io.varlite.core.classify.Classification;
import io.varlite.core.classify.Significance;
import io.varlite.core.error.IntegrityException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Merged record of every reading observed at one {@link Location}.
 * <p>
 * Immutable snapshot. The store replaces a unit's snapshot on every committed change
 * and bumps {@link #version()}; readings are only ever appended or extended.
 * <p>
 * Unit-level classification, significance and reason are those of the most
 * significant assessed alternate (lowest index on ties). A unit whose witnesses all
 * agree with the spine has no assessment and those accessors return null.
 */
public final class VariantUnit {
    private final long id;
    private final Location location;
    private final long version;
    private final List<Reading> readings;

    public VariantUnit(long id, Location location, long version, List<Reading> readings) {
        this.id = id;
        this.location = Objects.requireNonNull(location, "location");
        this.version = version;
        this.readings = List.copyOf(readings);
        checkInvariants();
    }

    /** A freshly created unit holding only the spine reading. */
    public static VariantUnit create(long id, Location location, String spineText, String spineKey) {
        return new VariantUnit(id, location, 0L, List.of(Reading.spine(spineText, spineKey)));
    }

    public long id() { return id; }

    public Location location() { return location; }

    public String verseId() { return location.verseId(); }

    public int position() { return location.position(); }

    public long version() { return version; }

    public List<Reading> readings() { return readings; }

    public Reading spine() { return readings.get(0); }

    public List<Reading> alternates() { return readings.subList(1, readings.size()); }

    public int readingCount() { return readings.size(); }

    public boolean hasReading(int index) {
        return index >= 0 && index < readings.size();
    }

    public Reading reading(int index) {
        if (!hasReading(index)) throw new IndexOutOfBoundsException("No reading " + index + " in unit " + location);
        return readings.get(index);
    }

    public Optional<Reading> findByCanonicalKey(String canonicalKey) {
        return readings.stream().filter(r -> r.canonicalKey().equals(canonicalKey)).findFirst();
    }

    /** Strongest assessment among alternates, or null when there is none. */
    public Assessment assessment() {
        Assessment strongest = null;
        for (Reading r : alternates()) {
            Assessment a = r.assessment();
            if (a != null && (strongest == null || a.significance().compareTo(strongest.significance()) > 0)) {
                strongest = a;
            }
        }
        return strongest;
    }

    public Classification classification() {
        Assessment a = assessment();
        return a == null ? null : a.classification();
    }

    public Significance significance() {
        Assessment a = assessment();
        return a == null ? null : a.significance();
    }

    public String reasonCode() {
        Assessment a = assessment();
        return a == null ? null : a.reasonCode();
    }

    public String reasonSummary() {
        Assessment a = assessment();
        return a == null ? null : a.reasonSummary();
    }

    public boolean requiresAcknowledgement() {
        Significance s = significance();
        return s != null && s.requiresAcknowledgement();
    }

    /** Copy with one reading replaced or appended, and the version bumped. */
    public VariantUnit withReading(Reading reading) {
        List<Reading> next = new ArrayList<>(readings);
        if (reading.index() < readings.size()) {
            next.set(reading.index(), reading);
        } else {
            next.add(reading);
        }
        return new VariantUnit(id, location, version, next);
    }

    public VariantUnit withVersion(long newVersion) {
        return new VariantUnit(id, location, newVersion, readings);
    }

    private void checkInvariants() {
        if (readings.isEmpty() || !readings.get(0).spine()) {
            throw new IntegrityException("Unit " + location + " must start with its spine reading");
        }
        Set<String> keys = new HashSet<>();
        for (int i = 0; i < readings.size(); i++) {
            Reading r = readings.get(i);
            if (r.index() != i) {
                throw new IntegrityException("Unit " + location + " has reading index " + r.index() + " at slot " + i);
            }
            if (!keys.add(r.canonicalKey())) {
                throw new IntegrityException("Unit " + location + " already has a reading with key '" + r.canonicalKey() + "'");
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VariantUnit u)) return false;
        return id == u.id && version == u.version && location.equals(u.location) && readings.equals(u.readings);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, location, version, readings);
    }

    @Override
    public String toString() {
        return "VariantUnit{id=" + id + ", location=" + location + ", version=" + version
                + ", readings=" + readings.size() + ", significance=" + significance() + "}";
    }
}
