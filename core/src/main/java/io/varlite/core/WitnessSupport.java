// file: core/src/main/java/io/varlite/core/WitnessSupport.java
package io.varlite.core;

import io.varlite.core.error.InputException;

import java.util.Objects;

/**
 * One attestation of a reading by one witness, as contributed by one source pack.
 * <p>
 * Identity within a reading is (siglum, sourcePackId): the same witness reported by
 * two packs yields two supports, while the same pack reporting it twice yields one.
 * Type and century range are descriptive and do not take part in identity.
 *
 * @param century optional; null when the pack does not date the witness
 */
public record WitnessSupport(String siglum, WitnessType type, String sourcePackId, CenturyRange century) {

    public WitnessSupport {
        Objects.requireNonNull(type, "type");
        if (siglum == null || siglum.isBlank()) throw new InputException("Witness siglum is required");
        if (sourcePackId == null || sourcePackId.isBlank()) throw new InputException("Source pack id is required");
    }

    /** True if both supports denote the same witness from the same pack. */
    public boolean sameAttestation(WitnessSupport other) {
        return siglum.equals(other.siglum) && sourcePackId.equals(other.sourcePackId);
    }
}
