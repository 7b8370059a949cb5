// file: core/src/main/java/io/varlite/core/TextNormalizer.java
package io.varlite.core;

import java.text.Normalizer;

/**
 * Produces the canonical comparison key for a text span.
 * <p>
 * Steps, in order:
 *  1) Unicode canonical decomposition (NFD).
 *  2) Removal of combining marks (accents, breathings, diaeresis, iota subscript).
 *  3) Simple case folding per code point (final sigma folds to sigma).
 *  4) Whitespace runs collapse to a single space; leading/trailing space is trimmed.
 *  5) Punctuation characters are removed, then whitespace is collapsed once more
 *     so that the result is a fixed point of {@link #normalize(String)}.
 * <p>
 * Total and pure: any input, including null, yields a key. The empty key is a
 * legitimate omission reading.
 */
public final class TextNormalizer {

    private TextNormalizer() {
        // utility
    }

    public static String normalize(String text) {
        if (text == null || text.isEmpty()) return "";

        String decomposed = Normalizer.normalize(text, Normalizer.Form.NFD);

        StringBuilder folded = new StringBuilder(decomposed.length());
        decomposed.codePoints()
                .filter(cp -> !isCombiningMark(cp))
                .map(cp -> Character.toLowerCase(Character.toUpperCase(cp)))
                .forEach(folded::appendCodePoint);

        String collapsed = collapseWhitespace(folded);

        StringBuilder stripped = new StringBuilder(collapsed.length());
        collapsed.codePoints()
                .filter(cp -> !isPunctuation(cp))
                .forEach(stripped::appendCodePoint);

        return collapseWhitespace(stripped);
    }

    /** Split a canonical key into its word tokens. The empty key has no tokens. */
    public static String[] tokens(String canonicalKey) {
        if (canonicalKey == null || canonicalKey.isEmpty()) return new String[0];
        return canonicalKey.split(" ");
    }

    private static String collapseWhitespace(CharSequence s) {
        StringBuilder out = new StringBuilder(s.length());
        boolean pendingSpace = false;
        for (int i = 0; i < s.length(); ) {
            int cp = Character.codePointAt(s, i);
            i += Character.charCount(cp);
            if (isSpace(cp)) {
                pendingSpace = out.length() > 0;
                continue;
            }
            if (pendingSpace) {
                out.append(' ');
                pendingSpace = false;
            }
            out.appendCodePoint(cp);
        }
        return out.toString();
    }

    private static boolean isSpace(int cp) {
        return Character.isWhitespace(cp) || Character.isSpaceChar(cp);
    }

    private static boolean isCombiningMark(int cp) {
        int type = Character.getType(cp);
        return type == Character.NON_SPACING_MARK
                || type == Character.COMBINING_SPACING_MARK
                || type == Character.ENCLOSING_MARK;
    }

    private static boolean isPunctuation(int cp) {
        return switch (Character.getType(cp)) {
            case Character.CONNECTOR_PUNCTUATION,
                 Character.DASH_PUNCTUATION,
                 Character.START_PUNCTUATION,
                 Character.END_PUNCTUATION,
                 Character.INITIAL_QUOTE_PUNCTUATION,
                 Character.FINAL_QUOTE_PUNCTUATION,
                 Character.OTHER_PUNCTUATION -> true;
            default -> false;
        };
    }
}
