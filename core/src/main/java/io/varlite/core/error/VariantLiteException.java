// file: core/src/main/java/io/varlite/core/error/VariantLiteException.java
package io.varlite.core.error;

/**
 * Root of the engine's unchecked error taxonomy.
 * <p>
 * Subtypes:
 *  - {@link InputException}: malformed scope/reference or gate argument; aborts the call.
 *  - {@link ProvenanceException}: pack record without attribution; rejects that record.
 *  - {@link ConflictException}: concurrent write on the same unit; caller may retry.
 *  - {@link IntegrityException}: a uniqueness invariant would be violated despite the pre-check.
 */
public class VariantLiteException extends RuntimeException {

    public VariantLiteException(String message) {
        super(message);
    }

    public VariantLiteException(String message, Throwable cause) {
        super(message, cause);
    }
}
