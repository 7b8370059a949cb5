// file: core/src/main/java/io/varlite/core/classify/ReadingComparison.java
package io.varlite.core.classify;

import io.varlite.core.TextNormalizer;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Token-level view of a (base, alternate) pair, computed once and shared by all rules.
 * <p>
 * Both texts are reduced to canonical keys first, so rules never see accent,
 * case or punctuation differences.
 */
public final class ReadingComparison {

    private final List<String> baseTokens;
    private final List<String> altTokens;
    private final List<String> onlyInBase;
    private final List<String> onlyInAlt;

    public ReadingComparison(String baseText, String altText) {
        this.baseTokens = List.of(TextNormalizer.tokens(TextNormalizer.normalize(baseText)));
        this.altTokens = List.of(TextNormalizer.tokens(TextNormalizer.normalize(altText)));
        this.onlyInBase = multisetMinus(baseTokens, altTokens);
        this.onlyInAlt = multisetMinus(altTokens, baseTokens);
    }

    public List<String> baseTokens() { return baseTokens; }

    public List<String> altTokens() { return altTokens; }

    /** Tokens of the base text not matched in the alternate, counting repeats. */
    public List<String> onlyInBase() { return onlyInBase; }

    /** Tokens of the alternate not matched in the base text, counting repeats. */
    public List<String> onlyInAlt() { return onlyInAlt; }

    public boolean sameTokenMultiset() {
        return onlyInBase.isEmpty() && onlyInAlt.isEmpty();
    }

    public int lengthDelta() {
        return altTokens.size() - baseTokens.size();
    }

    /**
     * Structural classification:
     *  - same multiset -> word order,
     *  - alternate is a sub-multiset of base -> omission,
     *  - base is a sub-multiset of alternate -> addition,
     *  - otherwise substitution.
     */
    public Classification classification() {
        if (sameTokenMultiset()) return Classification.WORD_ORDER;
        if (onlyInAlt.isEmpty()) return Classification.OMISSION;
        if (onlyInBase.isEmpty()) return Classification.ADDITION;
        return Classification.SUBSTITUTION;
    }

    private static List<String> multisetMinus(List<String> left, List<String> right) {
        Map<String, Integer> remaining = new HashMap<>();
        for (String t : right) remaining.merge(t, 1, Integer::sum);

        List<String> out = new ArrayList<>();
        for (String t : left) {
            Integer n = remaining.get(t);
            if (n == null || n == 0) {
                out.add(t);
            } else {
                remaining.put(t, n - 1);
            }
        }
        return List.copyOf(out);
    }

    @Override
    public String toString() {
        return "ReadingComparison" + Arrays.asList(baseTokens, altTokens);
    }
}
