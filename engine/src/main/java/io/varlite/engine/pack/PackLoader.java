// file: engine/src/main/java/io/varlite/engine/pack/PackLoader.java
package io.varlite.engine.pack;

import java.util.List;

/**
 * Source of installed comparative packs.
 * <p>
 * Implementations return records for one chapter in document order. A chapter the
 * pack does not cover yields an empty list.
 */
public interface PackLoader {

    boolean isInstalled(String packId);

    /**
     * @throws io.varlite.core.error.InputException if the pack is not installed or its data cannot be parsed
     */
    List<PackRecord> load(String packId, String book, int chapter);
}
