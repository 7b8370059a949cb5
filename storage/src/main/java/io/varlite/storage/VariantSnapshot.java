// file: storage/src/main/java/io/varlite/storage/VariantSnapshot.java
package io.varlite.storage;

import java.util.List;

/** Snapshot document of the variant store. */
public record VariantSnapshot(long lastSeq, long nextUnitId, List<UnitImage> units) {}
