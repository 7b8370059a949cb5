// file: core/src/main/java/io/varlite/core/Scope.java
package io.varlite.core;

import io.varlite.core.error.InputException;

import java.util.Objects;

/**
 * A build or query scope: a whole book, a chapter, or a single verse.
 * <p>
 * Accepted forms: {@code John}, {@code John.1}, {@code John.1.18}.
 * A null chapter means the whole book; a null verse means the whole chapter.
 */
public record Scope(String book, Integer chapter, Integer verse) {

    public Scope {
        Objects.requireNonNull(book, "book");
        if (!VerseRef.BOOK.matcher(book).matches()) throw new InputException("Invalid book name: " + book);
        if (chapter == null && verse != null) throw new InputException("Verse scope requires a chapter");
        if (chapter != null && chapter < 1) throw new InputException("Chapter must be >= 1, got " + chapter);
        if (verse != null && verse < 1) throw new InputException("Verse must be >= 1, got " + verse);
    }

    public static Scope book(String book) {
        return new Scope(book, null, null);
    }

    public static Scope chapter(String book, int chapter) {
        return new Scope(book, chapter, null);
    }

    public static Scope verse(VerseRef ref) {
        return new Scope(ref.book(), ref.chapter(), ref.verse());
    }

    /**
     * Parse a scope reference.
     *
     * @throws InputException for null, blank or malformed references
     */
    public static Scope parse(String ref) {
        if (ref == null || ref.isBlank()) throw new InputException("Scope reference is required");
        String[] parts = ref.trim().split("\\.", -1);
        try {
            return switch (parts.length) {
                case 1 -> book(parts[0]);
                case 2 -> chapter(parts[0], parseNumber(parts[1], ref));
                case 3 -> verse(new VerseRef(parts[0], parseNumber(parts[1], ref), parseNumber(parts[2], ref)));
                default -> throw new InputException("Unparseable scope: '" + ref + "'");
            };
        } catch (InputException e) {
            throw new InputException("Unparseable scope: '" + ref + "'", e);
        }
    }

    public boolean contains(VerseRef ref) {
        if (!book.equals(ref.book())) return false;
        if (chapter != null && chapter != ref.chapter()) return false;
        return verse == null || verse == ref.verse();
    }

    @Override
    public String toString() {
        if (chapter == null) return book;
        if (verse == null) return book + "." + chapter;
        return book + "." + chapter + "." + verse;
    }

    private static int parseNumber(String s, String ref) {
        if (s.isEmpty() || s.length() > 4 || !s.chars().allMatch(Character::isDigit)) {
            throw new InputException("Unparseable scope: '" + ref + "'");
        }
        return Integer.parseInt(s);
    }
}
