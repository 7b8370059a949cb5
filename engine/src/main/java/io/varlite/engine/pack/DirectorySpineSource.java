// file: engine/src/main/java/io/varlite/engine/pack/DirectorySpineSource.java
package io.varlite.engine.pack;

import io.varlite.core.error.InputException;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/** Spine stored as {@code <root>/<Book>/chapter_NN.tsv} files of {@code verse_id TAB text} lines. */
public final class DirectorySpineSource implements SpineSource {
    private final Path root;

    public DirectorySpineSource(Path root) {
        this.root = Objects.requireNonNull(root, "root");
    }

    @Override
    public List<Integer> chapters(String book) {
        return ChapterFile.chapters(root.resolve(book));
    }

    @Override
    public List<SpineSegment> segments(String book, int chapter) {
        Path file = ChapterFile.path(root.resolve(book), chapter);
        return ChapterFile.read(file).stream()
                .map(line -> {
                    if (line.position() < 0) {
                        throw new InputException(file + ":" + line.lineNo() + ": invalid position in '" + line.ref() + "'");
                    }
                    if (line.text() == null) {
                        throw new InputException(file + ":" + line.lineNo() + ": spine line has no text");
                    }
                    return new SpineSegment(line.verseId(), line.position(), line.text());
                })
                .toList();
    }
}
