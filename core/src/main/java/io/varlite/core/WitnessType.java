// file: core/src/main/java/io/varlite/core/WitnessType.java
package io.varlite.core;

/** Closed taxonomy of witness kinds. Free-form pack labels are mapped onto it by {@link WitnessSupportResolver}. */
public enum WitnessType {
    EDITION,
    MANUSCRIPT,
    TRADITION,
    OTHER
}
