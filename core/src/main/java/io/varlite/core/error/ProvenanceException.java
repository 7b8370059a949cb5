// file: core/src/main/java/io/varlite/core/error/ProvenanceException.java
package io.varlite.core.error;

public class ProvenanceException extends VariantLiteException {

    public ProvenanceException(String verseId) {
        super("Pack record for " + verseId + " carries no pack id");
    }
}
