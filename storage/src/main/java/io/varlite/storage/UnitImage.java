// file: storage/src/main/java/io/varlite/storage/UnitImage.java
package io.varlite.storage;

import io.varlite.core.Location;
import io.varlite.core.Reading;
import io.varlite.core.VariantUnit;

import java.util.List;

/** Serialized form of a {@link VariantUnit} in WAL records and snapshots. */
public record UnitImage(long id, String verseId, int position, long version, List<Reading> readings) {

    public static UnitImage of(VariantUnit u) {
        return new UnitImage(u.id(), u.verseId(), u.position(), u.version(), u.readings());
    }

    public VariantUnit toUnit() {
        return new VariantUnit(id, Location.of(verseId, position), version, readings);
    }
}
