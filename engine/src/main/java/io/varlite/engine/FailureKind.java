// file: engine/src/main/java/io/varlite/engine/FailureKind.java
package io.varlite.engine;

/** Why a record or location was not merged. */
public enum FailureKind {
    /** Record without a source pack id; only that record is rejected. */
    PROVENANCE,
    /** Blank siglum, missing text, invalid century range or unparseable location; the location is skipped. */
    MALFORMED,
    /** Record for a location the spine does not define. */
    NOT_IN_SPINE,
    /** Another transaction held the unit, or it changed underneath the build. */
    CONFLICT,
    /** A store invariant would have been broken; nothing was written for the location. */
    INTEGRITY
}
