// file: core/src/main/java/io/varlite/core/classify/Assessment.java
package io.varlite.core.classify;

import java.util.Objects;

/**
 * Outcome of classifying one alternate reading against the base text.
 *
 * @param reasonCode    stable machine code of the rule that fired, e.g. "theological_term"
 * @param reasonSummary descriptive, non-evaluative explanation; see {@link NeutralLanguage}
 */
public record Assessment(
        Classification classification,
        Significance significance,
        String reasonCode,
        String reasonSummary
) {
    public Assessment {
        Objects.requireNonNull(classification, "classification");
        Objects.requireNonNull(significance, "significance");
        Objects.requireNonNull(reasonCode, "reasonCode");
        Objects.requireNonNull(reasonSummary, "reasonSummary");
    }
}
