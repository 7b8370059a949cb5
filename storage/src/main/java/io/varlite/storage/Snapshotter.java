// file: storage/src/main/java/io/varlite/storage/Snapshotter.java
package io.varlite.storage;

/**
 * Snapshot abstraction to bound recovery time.
 * <p>
 * A snapshot is a full image of a store's state plus the sequence number of the
 * last WAL record it includes. On restart the store loads the latest snapshot and
 * replays only WAL records with a higher sequence.
 *
 * @param <T> the store's snapshot document type
 */
public interface Snapshotter<T> {

    /**
     * Persist a full image atomically.
     *
     * @return snapshot identifier (file name)
     */
    String writeSnapshot(T state);

    /** Latest snapshot, or null if none has been written. */
    LoadedSnapshot<T> loadLatest();

    record LoadedSnapshot<T>(String id, T data) {}
}
