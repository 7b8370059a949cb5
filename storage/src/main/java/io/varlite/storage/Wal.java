// file: storage/src/main/java/io/varlite/storage/Wal.java
package io.varlite.storage;

/**
 * Write-ahead log of framed records, used by the durable stores for crash recovery.
 * <p>
 * Contract:
 *  - append() is atomic at record granularity: a partially written record is
 *    treated as absent during recovery (readers stop at the first corrupt or
 *    truncated frame of a segment).
 *  - append() forces the record to disk before returning.
 *  - checkpoint() is only called once a snapshot covers every appended record.
 */
public interface Wal extends AutoCloseable {

    /**
     * Append one framed record and fsync it.
     *
     * @param frame header+payload bytes from {@link RecordCodec#frame(byte[])}
     */
    void append(byte[] frame);

    /** Start a new segment once the current one has reached its size threshold. */
    void rotateIfNeeded();

    /**
     * Start a fresh segment and delete all earlier ones.
     * Callers must have persisted a snapshot that includes every record appended so far.
     */
    void checkpoint();

    /** Sequential reader over all segments, oldest first. */
    WalReader openReader();

    @Override
    void close();

    interface WalReader extends AutoCloseable {

        /**
         * @return next valid payload (without header), or null once every segment is exhausted
         */
        byte[] next();

        @Override
        void close();
    }
}
