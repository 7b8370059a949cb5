// file: storage/src/main/java/io/varlite/storage/VariantStore.java
package io.varlite.storage;

import io.varlite.core.Location;
import io.varlite.core.Scope;
import io.varlite.core.VariantUnit;
import io.varlite.core.VerseRef;
import io.varlite.core.classify.Significance;

import java.util.List;

/**
 * Durable store of variant units, their readings and witness supports.
 * <p>
 * Semantics:
 *  - Every change to a unit goes through a {@link UnitTransaction} and is applied
 *    atomically on commit: all of it is durable and visible, or none of it is.
 *  - Uniqueness invariants are hard constraints re-checked when a change is applied:
 *      * one unit per (verse, position),
 *      * canonical keys unique within a unit,
 *      * supports unique per (reading, siglum, source pack).
 *  - Units only grow; the one exception is {@link #resetUnit(Location)}.
 *  - Reads return immutable snapshots and never block on writers.
 */
public interface VariantStore extends AutoCloseable {

    /** Unit at a location, or null if none has been created. */
    VariantUnit getUnit(Location location);

    default VariantUnit getUnit(String verseId, int position) {
        return getUnit(Location.of(verseId, position));
    }

    /** Unit by store-assigned id, or null. */
    VariantUnit getUnitById(long unitId);

    /** All units whose verse lies in scope, ordered by verse then position. */
    List<VariantUnit> getUnitsForScope(Scope scope);

    /** Units in scope whose significance is at least {@code min}, in scope order. Unassessed units never match. */
    default List<VariantUnit> getSignificantUnits(Scope scope, Significance min) {
        return getUnitsForScope(scope).stream()
                .filter(u -> u.significance() != null && u.significance().compareTo(min) >= 0)
                .toList();
    }

    /**
     * Number of units in scope.
     *
     * @param significance only count units with exactly this significance; null counts every unit
     */
    default int countUnits(Scope scope, Significance significance) {
        return (int) getUnitsForScope(scope).stream()
                .filter(u -> significance == null || u.significance() == significance)
                .count();
    }

    /** True if some unit of the verse, at any position, is significant or major. */
    default boolean hasSignificantUnit(VerseRef verse) {
        return !getSignificantUnits(Scope.verse(verse), Significance.SIGNIFICANT).isEmpty();
    }

    /**
     * Open the single write transaction for a location.
     *
     * @throws io.varlite.core.error.ConflictException if another transaction currently holds the location
     */
    UnitTransaction begin(Location location);

    /**
     * Operator reset: delete the unit at a location with all of its readings and supports.
     *
     * @return true if a unit was deleted
     * @throws io.varlite.core.error.ConflictException if a transaction currently holds the location
     */
    boolean resetUnit(Location location);

    int unitCount();

    @Override
    void close();
}
