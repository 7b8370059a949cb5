// file: storage/src/main/java/io/varlite/storage/DurableAcknowledgementStore.java
package io.varlite.storage;

import io.varlite.core.AcknowledgementRecord;

import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Acknowledgement store backed by its own WAL and snapshots.
 * <p>
 * Write path: validate, append+fsync an {@link AckLogRecord}, then publish to the
 * in-memory map. Reads go straight to the map.
 */
public class DurableAcknowledgementStore implements AcknowledgementStore {
    private static final Logger log = Logger.getLogger(DurableAcknowledgementStore.class.getName());

    private record Key(long unitId, String sessionId) {}

    private final Map<Key, AcknowledgementRecord> acks = new ConcurrentHashMap<>();
    private final Object writeLock = new Object();
    private long lastSeq; // guarded by writeLock

    private final Wal wal;
    private final Snapshotter<AckSnapshot> snaps;
    private final SnapshotPolicy snapPolicy;

    public DurableAcknowledgementStore(Wal wal, Snapshotter<AckSnapshot> snaps, SnapshotPolicy snapPolicy) {
        this.wal = Objects.requireNonNull(wal, "wal");
        this.snaps = Objects.requireNonNull(snaps, "snaps");
        this.snapPolicy = Objects.requireNonNull(snapPolicy, "snapPolicy");
        recover();
    }

    public static DurableAcknowledgementStore open(Path dir, long walRotateBytes, int snapshotEveryOps) {
        return new DurableAcknowledgementStore(
                new FileWal(dir.resolve("wal"), walRotateBytes),
                new FileSnapshotter<>(dir.resolve("snap"), AckSnapshot.class),
                new SnapshotPolicy(snapshotEveryOps)
        );
    }

    @Override
    public AcknowledgementRecord find(long unitId, String sessionId) {
        return acks.get(new Key(unitId, sessionId));
    }

    @Override
    public AcknowledgementRecord upsert(AcknowledgementRecord record) {
        Objects.requireNonNull(record, "record");
        if (record.sessionId().isBlank()) throw new IllegalArgumentException("sessionId must not be blank");
        synchronized (writeLock) {
            long seq = lastSeq + 1;
            wal.append(RecordCodec.frame(RecordCodec.encode(new AckLogRecord(seq, record))));
            lastSeq = seq;
            acks.put(new Key(record.unitId(), record.sessionId()), record);
            wal.rotateIfNeeded();
            if (snapPolicy.maybeSnapshot(this::snapshotState, snaps)) {
                wal.checkpoint();
            }
            return record;
        }
    }

    @Override
    public List<AcknowledgementRecord> listForSession(String sessionId) {
        return acks.values().stream()
                .filter(a -> a.sessionId().equals(sessionId))
                .sorted(Comparator.comparingLong(AcknowledgementRecord::unitId))
                .toList();
    }

    @Override
    public int size() {
        return acks.size();
    }

    @Override
    public void close() {
        wal.close();
    }

    private AckSnapshot snapshotState() {
        return new AckSnapshot(lastSeq, List.copyOf(acks.values()));
    }

    private void recover() {
        Snapshotter.LoadedSnapshot<AckSnapshot> loaded = snaps.loadLatest();
        if (loaded != null && loaded.data() != null) {
            loaded.data().acks().forEach(a -> acks.put(new Key(a.unitId(), a.sessionId()), a));
            lastSeq = loaded.data().lastSeq();
        }

        int replayed = 0;
        try (Wal.WalReader r = wal.openReader()) {
            for (byte[] payload; (payload = r.next()) != null; ) {
                AckLogRecord rec = RecordCodec.decode(payload, AckLogRecord.class);
                if (rec.seq() <= lastSeq) continue;
                acks.put(new Key(rec.ack().unitId(), rec.ack().sessionId()), rec.ack());
                lastSeq = rec.seq();
                replayed++;
            }
        } catch (RuntimeException e) {
            throw new IllegalStateException("Acknowledgement store recovery failed", e);
        }

        int replayedRecords = replayed;
        log.info(() -> String.format("Acknowledgement store recovered %d records (snapshot=%s, replayed=%d)",
                acks.size(), loaded == null ? "none" : loaded.id(), replayedRecords));
    }
}
