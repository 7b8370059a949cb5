// file: engine/src/main/java/io/varlite/engine/pack/ChapterFile.java
package io.varlite.engine.pack;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Reader for the chapter files shared by packs and the spine:
 * {@code <Book>/chapter_NN.tsv}, one line per reading.
 * <pre>
 *   # comment
 *   John.1.18	μονογενὴς θεός
 *   John.1.18@1	ὁ ὢν	P75	papyrus
 * </pre>
 * Columns: location ({@code verse_id} with optional {@code @position}), text,
 * optional siglum, optional witness type label. A line without a text column
 * keeps {@code text == null}; a position that is not a non-negative int is kept
 * as {@code -1} with the location text in {@code ref}.
 */
final class ChapterFile {
    private static final Pattern NAME = Pattern.compile("chapter_(\\d+)\\.tsv");

    record Line(int lineNo, String ref, String verseId, int position, String text, String siglum, String typeLabel) {}

    private ChapterFile() {
    }

    static Path path(Path bookDir, int chapter) {
        return bookDir.resolve(String.format("chapter_%02d.tsv", chapter));
    }

    /** Chapter numbers present under {@code bookDir}, ascending; empty if the directory is missing. */
    static List<Integer> chapters(Path bookDir) {
        if (!Files.isDirectory(bookDir)) return List.of();
        try (Stream<Path> files = Files.list(bookDir)) {
            return files
                    .map(p -> NAME.matcher(p.getFileName().toString()))
                    .filter(Matcher::matches)
                    .map(m -> Integer.parseInt(m.group(1)))
                    .sorted(Comparator.naturalOrder())
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list chapters in " + bookDir, e);
        }
    }

    /** Lines of a chapter file in document order; empty if the file does not exist. */
    static List<Line> read(Path file) {
        if (!Files.exists(file)) return List.of();
        List<String> raw;
        try {
            raw = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + file, e);
        }

        List<Line> out = new ArrayList<>();
        for (int i = 0; i < raw.size(); i++) {
            String line = raw.get(i);
            if (line.isBlank() || line.stripLeading().startsWith("#")) continue;
            String[] cols = line.split("\t", -1);
            String ref = cols[0].trim();
            int at = ref.indexOf('@');
            String verseId = at < 0 ? ref : ref.substring(0, at);
            int position = at < 0 ? 0 : parsePosition(ref.substring(at + 1));
            out.add(new Line(
                    i + 1,
                    ref,
                    verseId,
                    position,
                    cols.length > 1 ? cols[1] : null,
                    column(cols, 2),
                    column(cols, 3)
            ));
        }
        return out;
    }

    private static String column(String[] cols, int i) {
        if (cols.length <= i || cols[i].isBlank()) return null;
        return cols[i].trim();
    }

    private static int parsePosition(String s) {
        if (s.isEmpty() || s.length() > 9 || !s.chars().allMatch(c -> c >= '0' && c <= '9')) return -1;
        return Integer.parseInt(s);
    }
}
