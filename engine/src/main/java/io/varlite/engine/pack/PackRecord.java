// file: engine/src/main/java/io/varlite/engine/pack/PackRecord.java
package io.varlite.engine.pack;

import io.varlite.core.Location;
import io.varlite.core.error.InputException;

/**
 * One reading contributed by a comparative pack for one location.
 *
 * @param position    position within the verse; negative when the pack's value did not parse
 * @param text        surface text of the reading; null marks a record without text
 * @param rawLocation location exactly as written in the pack
 */
public record PackRecord(
        String packId,
        String verseId,
        int position,
        String text,
        WitnessMetadata witness,
        String rawLocation
) {

    public PackRecord(String packId, String verseId, int position, String text, WitnessMetadata witness) {
        this(packId, verseId, position, text, witness, verseId + "@" + position);
    }

    /**
     * @throws InputException if verseId or position is invalid
     */
    public Location location() {
        if (position < 0) throw new InputException("Invalid position in pack location '" + rawLocation + "'");
        return Location.of(verseId, position);
    }
}
