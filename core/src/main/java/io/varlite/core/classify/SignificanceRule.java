// file: core/src/main/java/io/varlite/core/classify/SignificanceRule.java
package io.varlite.core.classify;

import java.util.Optional;

/**
 * One step of the ordered significance rule list.
 * A rule either claims the comparison (returns an assessment) or passes it on.
 * Rules must be deterministic and must only produce descriptive summaries.
 */
@FunctionalInterface
public interface SignificanceRule {

    Optional<Assessment> evaluate(ReadingComparison comparison);
}
