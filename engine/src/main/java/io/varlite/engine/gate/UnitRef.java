// file: engine/src/main/java/io/varlite/engine/gate/UnitRef.java
package io.varlite.engine.gate;

import io.varlite.core.Location;
import io.varlite.core.VariantUnit;
import io.varlite.core.error.InputException;

/**
 * Reference to a variant unit by id, by location, or both.
 * When both are given they must name the same unit.
 */
public record UnitRef(Long unitId, Location location) {

    public UnitRef {
        if (unitId == null && location == null) throw new InputException("A unit id or a location is required");
    }

    public static UnitRef byId(long unitId) {
        return new UnitRef(unitId, null);
    }

    public static UnitRef at(String verseId, int position) {
        return new UnitRef(null, Location.of(verseId, position));
    }

    public static UnitRef of(VariantUnit unit) {
        return new UnitRef(unit.id(), unit.location());
    }

    @Override
    public String toString() {
        if (unitId == null) return location.toString();
        if (location == null) return "#" + unitId;
        return "#" + unitId + "@" + location;
    }
}
