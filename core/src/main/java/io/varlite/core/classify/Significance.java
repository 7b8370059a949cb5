// file: core/src/main/java/io/varlite/core/classify/Significance.java
package io.varlite.core.classify;

/**
 * Deterministic severity label for an alternate reading.
 * Declaration order is ascending severity.
 */
public enum Significance {
    MINOR,
    SIGNIFICANT,
    MAJOR;

    /** Significant and major readings must be acknowledged by a session before downstream use. */
    public boolean requiresAcknowledgement() {
        return this != MINOR;
    }
}
