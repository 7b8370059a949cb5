// file: core/src/main/java/io/varlite/core/error/ConflictException.java
package io.varlite.core.error;

/**
 * Another writer holds, or has changed, the same variant unit.
 * Safe to retry: no partial change has been applied.
 */
public class ConflictException extends VariantLiteException {

    public ConflictException(String message) {
        super(message);
    }
}
