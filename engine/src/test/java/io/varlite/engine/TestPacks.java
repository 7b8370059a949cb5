// file: engine/src/test/java/io/varlite/engine/TestPacks.java
package io.varlite.engine;

import io.varlite.engine.pack.PackLoader;
import io.varlite.engine.pack.PackRecord;
import io.varlite.engine.pack.SpineSegment;
import io.varlite.engine.pack.SpineSource;
import io.varlite.engine.pack.WitnessMetadata;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** In-memory packs and spine for engine tests. */
public final class TestPacks implements PackLoader, SpineSource {
    private final Map<String, List<PackRecord>> packs = new LinkedHashMap<>();
    private final List<SpineSegment> spine = new ArrayList<>();

    public TestPacks spine(String verseId, String text) {
        spine.add(new SpineSegment(verseId, 0, text));
        return this;
    }

    public TestPacks reading(String packId, String verseId, String text, String siglum, String typeLabel) {
        return add(packId, new PackRecord(packId, verseId, 0, text, WitnessMetadata.of(siglum, typeLabel)));
    }

    /** Add a record as-is under {@code listedIn}, whatever pack id the record itself carries. */
    public TestPacks add(String listedIn, PackRecord record) {
        packs.computeIfAbsent(listedIn, k -> new ArrayList<>()).add(record);
        return this;
    }

    @Override
    public boolean isInstalled(String packId) {
        return packs.containsKey(packId);
    }

    @Override
    public List<PackRecord> load(String packId, String book, int chapter) {
        String prefix = book + "." + chapter + ".";
        return packs.getOrDefault(packId, List.of()).stream()
                .filter(r -> r.verseId() != null && r.verseId().startsWith(prefix))
                .toList();
    }

    @Override
    public List<Integer> chapters(String book) {
        return spine.stream()
                .map(s -> s.location().verse())
                .filter(v -> v.book().equals(book))
                .map(v -> v.chapter())
                .distinct()
                .sorted()
                .toList();
    }

    @Override
    public List<SpineSegment> segments(String book, int chapter) {
        return spine.stream()
                .filter(s -> s.location().verse().book().equals(book) && s.location().verse().chapter() == chapter)
                .toList();
    }

    /** John 1:1 and 1:18 with two editions that both read "only-begotten Son" at 1:18. */
    public static TestPacks john() {
        return new TestPacks()
                .spine("John.1.1", "Ἐν ἀρχῇ ἦν ὁ λόγος")
                .spine("John.1.18", "μονογενὴς θεός")
                .reading("wh", "John.1.1", "Ἐν ἀρχῇ ἦν ὁ λόγος", "WH", "edition")
                .reading("wh", "John.1.18", "μονογενὴς υἱός", "WH", "edition")
                .reading("byz", "John.1.1", "ἐν ἀρχῇ ἦν ὁ λόγος,", "Byz", "byzantine")
                .reading("byz", "John.1.18", "μονογενὴς υἱὸς", "Byz", "byzantine");
    }
}
