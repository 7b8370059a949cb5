// file: core/src/main/java/io/varlite/core/classify/NeutralLanguage.java
package io.varlite.core.classify;

import io.varlite.core.error.IntegrityException;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Guard for reason summaries: they describe differences and evidence
 * ("witness count", "earliest attestation") and never judge one reading
 * better than another. Summaries matching a banned phrase are refused.
 */
public final class NeutralLanguage {

    private static final List<Pattern> BANNED = List.of(
            "more likely (to be )?original",
            "likely original",
            "original reading",
            "preferred reading",
            "(is|be) preferred",
            "preferable",
            "better reading",
            "superior reading",
            "inferior reading",
            "correct reading",
            "authentic reading",
            "scribal error",
            "corruption",
            "corrupt(ed)? text"
    ).stream().map(p -> Pattern.compile("\\b" + p + "\\b", Pattern.CASE_INSENSITIVE)).toList();

    private NeutralLanguage() {
        // utility
    }

    /** Return the first banned phrase found in {@code summary}, if any. */
    public static Optional<String> findEvaluativePhrase(String summary) {
        if (summary == null) return Optional.empty();
        for (Pattern p : BANNED) {
            var m = p.matcher(summary);
            if (m.find()) return Optional.of(m.group());
        }
        return Optional.empty();
    }

    public static boolean isNeutral(String summary) {
        return findEvaluativePhrase(summary).isEmpty();
    }

    /**
     * @throws IntegrityException if the summary contains evaluative language
     */
    public static String requireNeutral(String summary) {
        findEvaluativePhrase(summary).ifPresent(phrase -> {
            throw new IntegrityException("Reason summary contains evaluative language '" + phrase + "': " + summary);
        });
        return summary;
    }
}
