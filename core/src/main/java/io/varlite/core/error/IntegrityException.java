// file: core/src/main/java/io/varlite/core/error/IntegrityException.java
package io.varlite.core.error;

/**
 * A store invariant would have been violated by a mutation that passed its pre-checks.
 * This signals a bug in the caller; the offending mutation is aborted as a whole.
 */
public class IntegrityException extends VariantLiteException {

    public IntegrityException(String message) {
        super(message);
    }
}
