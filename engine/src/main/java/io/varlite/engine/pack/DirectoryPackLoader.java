// file: engine/src/main/java/io/varlite/engine/pack/DirectoryPackLoader.java
package io.varlite.engine.pack;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.varlite.core.error.InputException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Packs installed as directories under a root:
 * <pre>
 *   &lt;root&gt;/&lt;packId&gt;/manifest.json
 *   &lt;root&gt;/&lt;packId&gt;/&lt;Book&gt;/chapter_NN.tsv
 * </pre>
 * The manifest names the default witness of the pack; a chapter line may override
 * the siglum and the witness type in its third and fourth columns.
 */
public final class DirectoryPackLoader implements PackLoader {
    private static final String MANIFEST = "manifest.json";

    private final Path root;
    private final ObjectMapper mapper = new ObjectMapper();
    private final Map<String, PackManifest> manifests = new ConcurrentHashMap<>();

    public DirectoryPackLoader(Path root) {
        this.root = Objects.requireNonNull(root, "root");
    }

    @Override
    public boolean isInstalled(String packId) {
        return packId != null && !packId.isBlank()
                && !packId.contains("/") && !packId.contains("\\") && !packId.startsWith(".")
                && Files.isRegularFile(root.resolve(packId).resolve(MANIFEST));
    }

    @Override
    public List<PackRecord> load(String packId, String book, int chapter) {
        PackManifest manifest = manifest(packId);
        WitnessMetadata defaults = defaults(packId, manifest);
        Path file = ChapterFile.path(root.resolve(packId).resolve(book), chapter);

        return ChapterFile.read(file).stream()
                .map(line -> new PackRecord(
                        packId,
                        line.verseId(),
                        line.position(),
                        line.text(),
                        new WitnessMetadata(
                                line.siglum() != null ? line.siglum() : defaults.siglum(),
                                line.typeLabel() != null ? line.typeLabel() : defaults.typeLabel(),
                                defaults.earliestCentury(),
                                defaults.latestCentury()
                        ),
                        line.ref()))
                .toList();
    }

    /** Parsed manifest of an installed pack. */
    public PackManifest manifest(String packId) {
        if (!isInstalled(packId)) throw new InputException("Pack '" + packId + "' is not installed under " + root);
        return manifests.computeIfAbsent(packId, this::readManifest);
    }

    private PackManifest readManifest(String packId) {
        Path path = root.resolve(packId).resolve(MANIFEST);
        PackManifest m;
        try {
            m = mapper.readValue(path.toFile(), PackManifest.class);
        } catch (IOException e) {
            throw new InputException("Cannot read manifest " + path, e);
        }
        if (m.packId != null && !m.packId.isBlank() && !m.packId.equals(packId)) {
            throw new InputException("Manifest " + path + " declares pack id '" + m.packId + "'");
        }
        if (m.centuryRange != null && (m.centuryRange.isEmpty() || m.centuryRange.size() > 2)) {
            throw new InputException("Manifest " + path + " has a century range of " + m.centuryRange.size() + " values");
        }
        return m;
    }

    private static WitnessMetadata defaults(String packId, PackManifest m) {
        String siglum = m.siglum != null && !m.siglum.isBlank() ? m.siglum : packId;
        Integer earliest = m.centuryRange == null ? null : m.centuryRange.get(0);
        Integer latest = m.centuryRange == null ? null : m.centuryRange.get(m.centuryRange.size() - 1);
        return new WitnessMetadata(siglum, m.witnessType, earliest, latest);
    }
}
