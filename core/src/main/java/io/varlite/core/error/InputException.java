// file: core/src/main/java/io/varlite/core/error/InputException.java
package io.varlite.core.error;

/** Malformed scope, reference or gate argument. Nothing has been written when this is thrown. */
public class InputException extends VariantLiteException {

    public InputException(String message) {
        super(message);
    }

    public InputException(String message, Throwable cause) {
        super(message, cause);
    }
}
