// file: storage/src/main/java/io/varlite/storage/FileSnapshotter.java
package io.varlite.storage;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardOpenOption.*;

/**
 * JSON snapshot files, one per snapshot: "snapshot-&lt;zero padded millis&gt;.json".
 * <p>
 * Atomicity:
 *  - the document is written and fsynced to "&lt;name&gt;.tmp",
 *  - then moved to "&lt;name&gt;" with ATOMIC_MOVE.
 * Only the two most recent snapshots are kept.
 */
public final class FileSnapshotter<T> implements Snapshotter<T> {
    private static final int KEEP = 2;

    private final Path dir;
    private final Class<T> type;
    private long lastStamp;

    public FileSnapshotter(Path dir, Class<T> type) {
        this.dir = dir;
        this.type = type;
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create snapshot directory " + dir, e);
        }
    }

    @Override
    public synchronized String writeSnapshot(T state) {
        // Millis can repeat under fast successive snapshots; names must stay strictly increasing.
        long stamp = Math.max(System.currentTimeMillis(), lastStamp + 1);
        lastStamp = stamp;
        String name = String.format("snapshot-%015d.json", stamp);
        Path tmp = dir.resolve(name + ".tmp");
        Path dst = dir.resolve(name);

        try (FileChannel out = FileChannel.open(tmp, CREATE, WRITE, TRUNCATE_EXISTING)) {
            ByteBuffer buf = ByteBuffer.wrap(RecordCodec.encode(state));
            while (buf.hasRemaining()) out.write(buf);
            out.force(true);
        } catch (IOException e) {
            throw new UncheckedIOException("Snapshot write failed: " + tmp, e);
        }

        try {
            Files.move(tmp, dst, ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("Snapshot publish failed: " + dst, e);
        }

        pruneOlderThan(KEEP);
        return name;
    }

    @Override
    public LoadedSnapshot<T> loadLatest() {
        List<Path> snaps = snapshots();
        if (snaps.isEmpty()) return null;
        Path latest = snaps.get(snaps.size() - 1);
        try {
            return new LoadedSnapshot<>(latest.getFileName().toString(),
                    RecordCodec.decode(Files.readAllBytes(latest), type));
        } catch (IOException e) {
            throw new UncheckedIOException("Snapshot read failed: " + latest, e);
        }
    }

    private List<Path> snapshots() {
        try (Stream<Path> files = Files.list(dir)) {
            return files
                    .filter(p -> {
                        String n = p.getFileName().toString();
                        return n.startsWith("snapshot-") && n.endsWith(".json");
                    })
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list snapshots in " + dir, e);
        }
    }

    private void pruneOlderThan(int keep) {
        List<Path> snaps = snapshots();
        for (int i = 0; i < snaps.size() - keep; i++) {
            try {
                Files.deleteIfExists(snaps.get(i));
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot delete old snapshot " + snaps.get(i), e);
            }
        }
    }
}
