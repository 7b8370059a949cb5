// file: core/src/main/java/io/varlite/core/classify/Classification.java
package io.varlite.core.classify;

/** Structural kind of difference between an alternate reading and the base text. */
public enum Classification {
    SUBSTITUTION,
    OMISSION,
    ADDITION,
    WORD_ORDER
}
