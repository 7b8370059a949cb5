// file: storage/src/main/java/io/varlite/storage/SnapshotPolicy.java
package io.varlite.storage;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Snapshot policy that triggers a full snapshot after every N committed records.
 * Bounds worst-case recovery time by limiting WAL replay length.
 */
public final class SnapshotPolicy {
    private final int everyOps;
    private final AtomicInteger sinceLast = new AtomicInteger();

    public SnapshotPolicy(int everyOps) {
        if (everyOps <= 0) throw new IllegalArgumentException("everyOps must be > 0");
        this.everyOps = everyOps;
    }

    /**
     * Call after each durable write, while holding the store's write lock.
     *
     * @return true if a snapshot was written (the caller may then checkpoint its WAL)
     */
    public <T> boolean maybeSnapshot(Supplier<T> state, Snapshotter<T> snaps) {
        if (sinceLast.incrementAndGet() < everyOps) return false;
        snaps.writeSnapshot(state.get());
        sinceLast.set(0);
        return true;
    }
}
