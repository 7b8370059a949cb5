// file: engine/src/main/java/io/varlite/engine/config/EngineConfig.java
package io.varlite.engine.config;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Engine configuration.
 * <p>
 * Holds:
 *  - dataDir:        root of durable state ("variants/" and "acks/" live below it)
 *  - packRoot:       directory of installed packs, one subdirectory per pack id
 *  - spineDir:       directory of spine chapter files
 *  - walRotateBytes: WAL segment size threshold
 *  - snapshotEvery:  full snapshot after this many committed records
 *  - parallelism:    merge worker count; 1 merges on the calling thread
 */
public record EngineConfig(
        Path dataDir,
        Path packRoot,
        Path spineDir,
        long walRotateBytes,
        int snapshotEvery,
        int parallelism
) {
    public static final long DEFAULT_WAL_ROTATE_BYTES = 8L * 1024 * 1024;
    public static final int DEFAULT_SNAPSHOT_EVERY = 1000;
    public static final int DEFAULT_PARALLELISM = 1;

    public EngineConfig {
        Objects.requireNonNull(dataDir, "dataDir");
        Objects.requireNonNull(packRoot, "packRoot");
        Objects.requireNonNull(spineDir, "spineDir");
        if (walRotateBytes <= 0) throw new IllegalArgumentException("walRotateBytes must be > 0");
        if (snapshotEvery <= 0) throw new IllegalArgumentException("snapshotEvery must be > 0");
        if (parallelism <= 0) throw new IllegalArgumentException("parallelism must be > 0");
    }

    /** Defaults under one base directory: "data/", "packs/" and "spine/". */
    public static EngineConfig defaults(Path base) {
        return new EngineConfig(
                base.resolve("data"),
                base.resolve("packs"),
                base.resolve("spine"),
                DEFAULT_WAL_ROTATE_BYTES,
                DEFAULT_SNAPSHOT_EVERY,
                DEFAULT_PARALLELISM
        );
    }

    /**
     * Load from JSON. Relative paths resolve against the file's directory; missing
     * fields take the values of {@link #defaults(Path)} for that directory.
     */
    public static EngineConfig fromJsonFile(Path path) {
        ObjectMapper mapper = new ObjectMapper();
        try {
            JsonEngineConfig cfg = mapper.readValue(path.toFile(), JsonEngineConfig.class);
            Path base = path.toAbsolutePath().getParent();
            EngineConfig d = defaults(base);
            return new EngineConfig(
                    cfg.dataDir != null ? base.resolve(cfg.dataDir) : d.dataDir(),
                    cfg.packRoot != null ? base.resolve(cfg.packRoot) : d.packRoot(),
                    cfg.spineDir != null ? base.resolve(cfg.spineDir) : d.spineDir(),
                    cfg.walRotateBytes != null ? cfg.walRotateBytes : d.walRotateBytes(),
                    cfg.snapshotEvery != null ? cfg.snapshotEvery : d.snapshotEvery(),
                    cfg.parallelism != null ? cfg.parallelism : d.parallelism()
            );
        } catch (IOException e) {
            throw new RuntimeException("Failed to load EngineConfig from " + path, e);
        }
    }
}
