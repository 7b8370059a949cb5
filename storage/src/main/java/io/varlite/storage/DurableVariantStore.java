// file: storage/src/main/java/io/varlite/storage/DurableVariantStore.java
package io.varlite.storage;

import io.varlite.core.Location;
import io.varlite.core.Reading;
import io.varlite.core.Scope;
import io.varlite.core.VariantUnit;
import io.varlite.core.WitnessSupport;
import io.varlite.core.classify.Assessment;
import io.varlite.core.classify.NeutralLanguage;
import io.varlite.core.error.ConflictException;
import io.varlite.core.error.IntegrityException;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * Durable variant store.
 * <p>
 * Responsibilities:
 *  - Keep an in-memory, location-ordered table of immutable unit snapshots.
 *  - On commit of a {@link UnitTransaction}:
 *      1) Check the unit's version is the one the transaction started from.
 *      2) Re-validate the store invariants against the stored unit.
 *      3) Serialize the unit's after-image to a WAL record with the next sequence number.
 *      4) Append+fsync to the WAL.
 *      5) Publish the new snapshot of the unit to readers.
 *      6) Rotate the WAL segment and maybe write a full snapshot.
 * <p>
 *  - On startup:
 *      1) Load the latest snapshot (if any) into memory.
 *      2) Replay WAL records newer than the snapshot, in order.
 * <p>
 * Concurrency:
 *  - One transaction per location at a time; a second begin() fails fast with
 *    {@link ConflictException}. Transactions on different locations never wait on
 *    each other except for the short, serialized WAL append in commit.
 *  - Readers see committed snapshots only and never block.
 */
public class DurableVariantStore implements VariantStore {
    private static final Logger log = Logger.getLogger(DurableVariantStore.class.getName());

    private final ConcurrentSkipListMap<Location, VariantUnit> units = new ConcurrentSkipListMap<>();
    private final Map<Long, Location> locationsById = new ConcurrentHashMap<>();
    private final Map<Location, Tx> writers = new ConcurrentHashMap<>();
    private final AtomicLong nextUnitId = new AtomicLong(1);

    private final Object commitLock = new Object();
    private long lastSeq; // guarded by commitLock

    private final Wal wal;
    private final Snapshotter<VariantSnapshot> snaps;
    private final SnapshotPolicy snapPolicy;

    public DurableVariantStore(Wal wal, Snapshotter<VariantSnapshot> snaps, SnapshotPolicy snapPolicy) {
        this.wal = Objects.requireNonNull(wal, "wal");
        this.snaps = Objects.requireNonNull(snaps, "snaps");
        this.snapPolicy = Objects.requireNonNull(snapPolicy, "snapPolicy");
        recover();
    }

    /** Open (or create) a store under {@code dir} using "wal/" and "snap/" subdirectories. */
    public static DurableVariantStore open(Path dir, long walRotateBytes, int snapshotEveryOps) {
        return new DurableVariantStore(
                new FileWal(dir.resolve("wal"), walRotateBytes),
                new FileSnapshotter<>(dir.resolve("snap"), VariantSnapshot.class),
                new SnapshotPolicy(snapshotEveryOps)
        );
    }

    @Override
    public VariantUnit getUnit(Location location) {
        return units.get(location);
    }

    @Override
    public VariantUnit getUnitById(long unitId) {
        Location loc = locationsById.get(unitId);
        if (loc == null) return null;
        VariantUnit u = units.get(loc);
        return u != null && u.id() == unitId ? u : null;
    }

    @Override
    public List<VariantUnit> getUnitsForScope(Scope scope) {
        return units.values().stream()
                .filter(u -> scope.contains(u.location().verse()))
                .toList();
    }

    @Override
    public UnitTransaction begin(Location location) {
        Objects.requireNonNull(location, "location");
        Tx tx = new Tx(location);
        if (writers.putIfAbsent(location, tx) != null) {
            throw new ConflictException("Unit " + location + " is being written by another transaction");
        }
        // Read the base only once we own the location, so no commit can slip in between.
        tx.start(units.get(location));
        return tx;
    }

    @Override
    public boolean resetUnit(Location location) {
        synchronized (commitLock) {
            if (writers.containsKey(location)) {
                throw new ConflictException("Unit " + location + " is being written; reset refused");
            }
            VariantUnit stored = units.get(location);
            if (stored == null) return false;

            long seq = lastSeq + 1;
            wal.append(RecordCodec.frame(RecordCodec.encode(
                    UnitLogRecord.reset(seq, location.verseId(), location.position()))));
            lastSeq = seq;
            remove(location);
            afterWrite();
            log.info(() -> "Operator reset of unit " + stored.id() + " at " + location);
            return true;
        }
    }

    @Override
    public int unitCount() {
        return units.size();
    }

    @Override
    public void close() {
        wal.close();
    }

    // ---------------- commit path ----------------

    private VariantUnit commit(Tx tx) {
        synchronized (commitLock) {
            VariantUnit stored = units.get(tx.location);
            if (!sameVersion(stored, tx.base)) {
                throw new ConflictException("Unit " + tx.location + " changed since the transaction began");
            }

            VariantUnit next = tx.working.withVersion(stored == null ? 1 : stored.version() + 1);
            requireExtension(stored, next);

            long seq = lastSeq + 1;
            wal.append(RecordCodec.frame(RecordCodec.encode(UnitLogRecord.put(seq, UnitImage.of(next)))));
            lastSeq = seq;
            apply(next);
            afterWrite();
            return next;
        }
    }

    private void afterWrite() {
        wal.rotateIfNeeded();
        if (snapPolicy.maybeSnapshot(this::snapshotState, snaps)) {
            wal.checkpoint();
        }
    }

    private static boolean sameVersion(VariantUnit stored, VariantUnit base) {
        if (stored == null || base == null) return stored == base;
        return stored.id() == base.id() && stored.version() == base.version();
    }

    /**
     * Hard constraints between the stored unit and its proposed successor:
     * same identity, no reading removed or rewritten, no support removed,
     * no assessment changed, and only neutral reason summaries.
     */
    private void requireExtension(VariantUnit stored, VariantUnit next) {
        for (Reading r : next.alternates()) {
            if (r.assessment() != null) NeutralLanguage.requireNeutral(r.assessment().reasonSummary());
        }
        if (stored == null) {
            if (locationsById.containsKey(next.id())) {
                throw new IntegrityException("Unit id " + next.id() + " is already in use");
            }
            return;
        }
        if (stored.id() != next.id()) {
            throw new IntegrityException("Unit " + stored.location() + " cannot change id " + stored.id() + " -> " + next.id());
        }
        if (next.readingCount() < stored.readingCount()) {
            throw new IntegrityException("Unit " + stored.location() + " cannot lose readings");
        }
        for (Reading old : stored.readings()) {
            Reading now = next.reading(old.index());
            if (!old.canonicalKey().equals(now.canonicalKey()) || !old.surfaceText().equals(now.surfaceText())) {
                throw new IntegrityException("Reading " + old.index() + " of " + stored.location() + " cannot be rewritten");
            }
            if (now.supports().size() < old.supports().size()
                    || !now.supports().subList(0, old.supports().size()).equals(old.supports())) {
                throw new IntegrityException("Reading " + old.index() + " of " + stored.location() + " cannot lose supports");
            }
            if (old.assessment() != null && !old.assessment().equals(now.assessment())) {
                throw new IntegrityException("Reading " + old.index() + " of " + stored.location() + " is already assessed");
            }
        }
    }

    private void apply(VariantUnit unit) {
        VariantUnit prev = units.put(unit.location(), unit);
        if (prev != null && prev.id() != unit.id()) locationsById.remove(prev.id());
        locationsById.put(unit.id(), unit.location());
        nextUnitId.accumulateAndGet(unit.id() + 1, Math::max);
    }

    private void remove(Location location) {
        VariantUnit prev = units.remove(location);
        if (prev != null) locationsById.remove(prev.id());
    }

    private VariantSnapshot snapshotState() {
        return new VariantSnapshot(
                lastSeq,
                nextUnitId.get(),
                units.values().stream().map(UnitImage::of).toList()
        );
    }

    /**
     * Recovery procedure called from the constructor:
     *  1) Seed memory from the latest snapshot (if present).
     *  2) Replay WAL records with a sequence above the snapshot's, in order.
     */
    private void recover() {
        Snapshotter.LoadedSnapshot<VariantSnapshot> loaded = snaps.loadLatest();
        if (loaded != null && loaded.data() != null) {
            VariantSnapshot data = loaded.data();
            data.units().forEach(image -> apply(image.toUnit()));
            lastSeq = data.lastSeq();
            nextUnitId.accumulateAndGet(data.nextUnitId(), Math::max);
        }

        int replayed = 0;
        try (Wal.WalReader r = wal.openReader()) {
            for (byte[] payload; (payload = r.next()) != null; ) {
                UnitLogRecord rec = RecordCodec.decode(payload, UnitLogRecord.class);
                if (rec.seq() <= lastSeq) continue;
                switch (rec.op()) {
                    case PUT -> apply(rec.unit().toUnit());
                    case RESET -> remove(Location.of(rec.verseId(), rec.position()));
                }
                lastSeq = rec.seq();
                replayed++;
            }
        } catch (RuntimeException e) {
            throw new IllegalStateException("Variant store recovery failed", e);
        }

        int replayedRecords = replayed;
        log.info(() -> String.format("Variant store recovered %d units (snapshot=%s, replayed=%d, lastSeq=%d)",
                units.size(), loaded == null ? "none" : loaded.id(), replayedRecords, lastSeq));
    }

    // ---------------- transaction ----------------

    private final class Tx implements UnitTransaction {
        private final Location location;
        private VariantUnit base;
        private VariantUnit working;
        private boolean changed;
        private boolean done;

        Tx(Location location) {
            this.location = location;
        }

        void start(VariantUnit stored) {
            this.base = stored;
            this.working = stored;
        }

        @Override
        public Location location() {
            return location;
        }

        @Override
        public VariantUnit current() {
            return working;
        }

        @Override
        public VariantUnit createUnit(String spineText, String spineKey) {
            ensureOpen();
            if (working != null) throw new IntegrityException("Unit " + location + " already exists");
            working = VariantUnit.create(nextUnitId.getAndIncrement(), location, spineText, spineKey);
            changed = true;
            return working;
        }

        @Override
        public OptionalInt findReading(String canonicalKey) {
            if (working == null) return OptionalInt.empty();
            return working.findByCanonicalKey(canonicalKey)
                    .map(r -> OptionalInt.of(r.index()))
                    .orElseGet(OptionalInt::empty);
        }

        @Override
        public int addReading(String surfaceText, String canonicalKey) {
            ensureOpen();
            requireUnit();
            if (findReading(canonicalKey).isPresent()) {
                throw new IntegrityException("Unit " + location + " already has a reading with key '" + canonicalKey + "'");
            }
            int index = working.readingCount();
            working = working.withReading(Reading.alternate(index, surfaceText, canonicalKey));
            changed = true;
            return index;
        }

        @Override
        public boolean addSupportIfAbsent(int readingIndex, WitnessSupport support) {
            ensureOpen();
            Reading r = readingAt(readingIndex);
            if (r.hasSupport(support)) return false;
            working = working.withReading(r.withSupport(support));
            changed = true;
            return true;
        }

        @Override
        public boolean assessIfAbsent(int readingIndex, Assessment assessment) {
            ensureOpen();
            Reading r = readingAt(readingIndex);
            if (r.spine()) throw new IntegrityException("The spine reading of " + location + " is never assessed");
            if (r.assessment() != null) return false;
            working = working.withReading(r.withAssessment(assessment));
            changed = true;
            return true;
        }

        @Override
        public boolean hasChanges() {
            return changed;
        }

        @Override
        public VariantUnit commit() {
            ensureOpen();
            done = true;
            if (!changed) return working;
            return DurableVariantStore.this.commit(this);
        }

        @Override
        public void close() {
            done = true;
            writers.remove(location, this);
        }

        private Reading readingAt(int index) {
            requireUnit();
            if (!working.hasReading(index)) {
                throw new IntegrityException("Unit " + location + " has no reading " + index);
            }
            return working.reading(index);
        }

        private void requireUnit() {
            if (working == null) throw new IntegrityException("Unit " + location + " does not exist yet");
        }

        private void ensureOpen() {
            if (done) throw new IllegalStateException("Transaction on " + location + " is finished");
        }
    }
}
