// file: core/src/main/java/io/varlite/core/VerseRef.java
package io.varlite.core;

import io.varlite.core.error.InputException;

import java.util.Comparator;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reference to a single verse in "Book.Chapter.Verse" form, e.g. {@code John.1.18}.
 * <p>
 * Ordering is book (lexical), then chapter and verse (numeric), so that
 * {@code John.1.9} sorts before {@code John.1.10}.
 */
public record VerseRef(String book, int chapter, int verse) implements Comparable<VerseRef> {

    static final Pattern BOOK = Pattern.compile("[1-3]?[A-Za-z]+");
    private static final Pattern VERSE_ID = Pattern.compile("([1-3]?[A-Za-z]+)\\.(\\d{1,4})\\.(\\d{1,4})");

    private static final Comparator<VerseRef> ORDER = Comparator
            .comparing(VerseRef::book)
            .thenComparingInt(VerseRef::chapter)
            .thenComparingInt(VerseRef::verse);

    public VerseRef {
        Objects.requireNonNull(book, "book");
        if (!BOOK.matcher(book).matches()) throw new InputException("Invalid book name: " + book);
        if (chapter < 1) throw new InputException("Chapter must be >= 1, got " + chapter);
        if (verse < 1) throw new InputException("Verse must be >= 1, got " + verse);
    }

    /**
     * Parse a verse id.
     *
     * @throws InputException if the id is null or not of the form Book.Chapter.Verse
     */
    public static VerseRef parse(String verseId) {
        if (verseId == null) throw new InputException("Verse id is required");
        Matcher m = VERSE_ID.matcher(verseId.trim());
        if (!m.matches()) throw new InputException("Unparseable verse id: '" + verseId + "'");
        return new VerseRef(m.group(1), Integer.parseInt(m.group(2)), Integer.parseInt(m.group(3)));
    }

    public String id() {
        return book + "." + chapter + "." + verse;
    }

    @Override
    public int compareTo(VerseRef o) {
        return ORDER.compare(this, o);
    }

    @Override
    public String toString() {
        return id();
    }
}
