// file: core/src/main/java/io/varlite/core/classify/SignificanceClassifier.java
package io.varlite.core.classify;

import io.varlite.core.TextNormalizer;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Rule-based, deterministic scoring of an alternate reading against the base text.
 * <p>
 * Default rules, evaluated top to bottom, first match wins:
 *  1) theological_term        -> MAJOR        a key term is present in one reading only
 *  2) word_order              -> MINOR        same words, different order
 *  3) function_words          -> MINOR        all differing words are articles/particles/prepositions
 *  4) length_change           -> SIGNIFICANT  word counts differ by 3 or more
 *  5) substantive_difference  -> SIGNIFICANT  anything else
 * <p>
 * Accent and punctuation differences never reach the classifier: such readings share
 * the base text's canonical key and are recorded as agreements.
 */
public final class SignificanceClassifier {

    /** Accent-free key forms of the theologically significant terms (God, Christ, Jesus, Lord, Spirit, Son, Father, ...). */
    static final Set<String> THEOLOGICAL_TERMS = keys(
            "θεός", "θεοῦ", "θεόν", "θεῷ", "θεέ",
            "Χριστός", "Χριστοῦ", "Χριστόν", "Χριστῷ",
            "Ἰησοῦς", "Ἰησοῦ", "Ἰησοῦν",
            "κύριος", "κυρίου", "κύριον", "κυρίῳ", "κύριε",
            "πνεῦμα", "πνεύματος", "πνεύματι",
            "υἱός", "υἱοῦ", "υἱόν", "υἱῷ", "υἱέ",
            "πατήρ", "πατρός", "πατέρα", "πατρί", "πάτερ",
            "μονογενής", "μονογενοῦς", "μονογενῆ",
            "ἁμαρτία", "ἁμαρτίας", "ἁμαρτίαι", "ἁμαρτιῶν",
            "πίστις", "πίστεως", "πίστει", "πίστιν"
    );

    /** Articles, conjunctions, particles and common prepositions. */
    static final Set<String> FUNCTION_WORDS = keys(
            "ὁ", "ἡ", "τό", "τοῦ", "τῆς", "τῷ", "τῇ", "τόν", "τήν",
            "οἱ", "αἱ", "τά", "τῶν", "τοῖς", "ταῖς", "τούς", "τάς",
            "καί", "δέ", "γάρ", "τε", "οὖν", "ἀλλά", "ἀλλ", "μέν", "ἄν", "ὅτι", "ἵνα", "ἤ",
            "οὐ", "οὐκ", "οὐχ", "μή", "δή", "γε",
            "ἐν", "εἰς", "ἐκ", "ἐξ", "ἀπό", "ἀπ", "πρός", "διά", "δι", "ἐπί", "ἐπ",
            "κατά", "κατ", "μετά", "μετ", "περί", "ὑπό", "ὑπ", "παρά", "παρ", "σύν"
    );

    private final List<SignificanceRule> rules;

    public SignificanceClassifier() {
        this(defaultRules());
    }

    /**
     * @param rules ordered rule list; must end with a rule that always matches
     */
    public SignificanceClassifier(List<SignificanceRule> rules) {
        if (rules == null || rules.isEmpty()) throw new IllegalArgumentException("rules must not be empty");
        this.rules = List.copyOf(rules);
    }

    public Assessment classify(String baseText, String altText) {
        var comparison = new ReadingComparison(baseText, altText);
        for (SignificanceRule rule : rules) {
            Optional<Assessment> hit = rule.evaluate(comparison);
            if (hit.isPresent()) return hit.get();
        }
        throw new IllegalStateException("No significance rule matched " + comparison);
    }

    public static List<SignificanceRule> defaultRules() {
        List<SignificanceRule> rules = new ArrayList<>();
        rules.add(SignificanceClassifier::theologicalTerm);
        rules.add(SignificanceClassifier::wordOrder);
        rules.add(SignificanceClassifier::functionWords);
        rules.add(SignificanceClassifier::lengthChange);
        rules.add(SignificanceClassifier::substantiveDifference);
        return List.copyOf(rules);
    }

    // ---------------- rules ----------------

    static Optional<Assessment> theologicalTerm(ReadingComparison c) {
        Set<String> base = Set.copyOf(c.baseTokens());
        Set<String> alt = Set.copyOf(c.altTokens());
        Set<String> differing = new LinkedHashSet<>();
        Stream.concat(c.baseTokens().stream(), c.altTokens().stream())
                .filter(THEOLOGICAL_TERMS::contains)
                .filter(t -> base.contains(t) != alt.contains(t))
                .forEach(differing::add);
        if (differing.isEmpty()) return Optional.empty();
        return Optional.of(new Assessment(
                c.classification(),
                Significance.MAJOR,
                "theological_term",
                "Key term present in only one reading: " + String.join(", ", differing)
        ));
    }

    static Optional<Assessment> wordOrder(ReadingComparison c) {
        if (!c.sameTokenMultiset()) return Optional.empty();
        return Optional.of(new Assessment(
                Classification.WORD_ORDER,
                Significance.MINOR,
                "word_order",
                "Same " + c.baseTokens().size() + " words in a different order"
        ));
    }

    static Optional<Assessment> functionWords(ReadingComparison c) {
        boolean onlyFunctionWords = Stream.concat(c.onlyInBase().stream(), c.onlyInAlt().stream())
                .allMatch(FUNCTION_WORDS::contains);
        if (!onlyFunctionWords) return Optional.empty();
        String words = Stream.concat(c.onlyInBase().stream(), c.onlyInAlt().stream())
                .distinct()
                .collect(Collectors.joining(", "));
        return Optional.of(new Assessment(
                c.classification(),
                Significance.MINOR,
                "function_words",
                "Differing words are articles, particles or prepositions only: " + words
        ));
    }

    static Optional<Assessment> lengthChange(ReadingComparison c) {
        if (Math.abs(c.lengthDelta()) < 3) return Optional.empty();
        return Optional.of(new Assessment(
                c.classification(),
                Significance.SIGNIFICANT,
                "length_change",
                "Alternate reading has " + c.altTokens().size() + " words; base text has " + c.baseTokens().size()
        ));
    }

    static Optional<Assessment> substantiveDifference(ReadingComparison c) {
        return Optional.of(new Assessment(
                c.classification(),
                Significance.SIGNIFICANT,
                "substantive_difference",
                "Wording differs: " + c.onlyInBase().size() + " word(s) only in base text, "
                        + c.onlyInAlt().size() + " only in alternate reading"
        ));
    }

    private static Set<String> keys(String... words) {
        return Stream.of(words)
                .map(TextNormalizer::normalize)
                .collect(Collectors.toUnmodifiableSet());
    }
}
