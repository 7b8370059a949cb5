// file: engine/src/main/java/io/varlite/engine/pack/SpineSegment.java
package io.varlite.engine.pack;

import io.varlite.core.Location;

/** Base-text segment at one location; its text seeds reading 0 of the unit. */
public record SpineSegment(String verseId, int position, String text) {

    public Location location() {
        return Location.of(verseId, position);
    }
}
