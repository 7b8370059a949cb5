// file: storage/src/main/java/io/varlite/storage/UnitTransaction.java
package io.varlite.storage;

import io.varlite.core.Location;
import io.varlite.core.VariantUnit;
import io.varlite.core.WitnessSupport;
import io.varlite.core.classify.Assessment;

import java.util.OptionalInt;

/**
 * Staged, single-writer change to one variant unit.
 * <p>
 * Mutations are check-then-act: every primitive reports whether it changed anything,
 * so callers never rely on catching constraint violations. Nothing is durable or
 * visible to readers until {@link #commit()}. Closing without committing discards
 * the staged changes and releases the location.
 */
public interface UnitTransaction extends AutoCloseable {

    Location location();

    /** Working copy including staged changes, or null while the unit does not exist. */
    VariantUnit current();

    default boolean exists() {
        return current() != null;
    }

    /**
     * Create the unit with its spine reading at index 0.
     *
     * @throws io.varlite.core.error.IntegrityException if the unit already exists
     */
    VariantUnit createUnit(String spineText, String spineKey);

    /** Index of the reading with this canonical key (spine included), if any. */
    OptionalInt findReading(String canonicalKey);

    /**
     * Append a reading with the next sequential index.
     *
     * @return the new reading's index
     * @throws io.varlite.core.error.IntegrityException if the key is already present in the unit
     */
    int addReading(String surfaceText, String canonicalKey);

    /**
     * Attach a support unless the reading already has one for the same siglum and pack.
     *
     * @return true if the support was added
     */
    boolean addSupportIfAbsent(int readingIndex, WitnessSupport support);

    /**
     * Record the classification of an alternate reading.
     *
     * @return true if recorded; false if the reading was already assessed (never overwritten)
     */
    boolean assessIfAbsent(int readingIndex, Assessment assessment);

    boolean hasChanges();

    /**
     * Make the staged changes durable and visible as one atomic step.
     * A transaction without changes commits without writing anything.
     *
     * @return the committed unit (null if the unit was never created)
     * @throws io.varlite.core.error.ConflictException if the unit changed since {@code begin}
     * @throws io.varlite.core.error.IntegrityException if the change violates a store invariant
     */
    VariantUnit commit();

    /** Release the location; uncommitted changes are discarded. */
    @Override
    void close();
}
