// file: storage/src/main/java/io/varlite/storage/AcknowledgementStore.java
package io.varlite.storage;

import io.varlite.core.AcknowledgementRecord;

import java.util.List;

/**
 * Durable acknowledgement records, keyed by (unit id, session id).
 * Independent of the variant store: it has its own log and lock, so recording an
 * acknowledgement never waits on an aggregation build.
 */
public interface AcknowledgementStore extends AutoCloseable {

    /** Acknowledgement for a unit and session, or null when the unit is unacknowledged. */
    AcknowledgementRecord find(long unitId, String sessionId);

    /**
     * Insert or replace the record for (unitId, sessionId). Replacing updates the
     * reading index, reason and timestamp; a record is never removed.
     *
     * @return the stored record
     */
    AcknowledgementRecord upsert(AcknowledgementRecord record);

    /** All acknowledgements of a session ordered by unit id. */
    List<AcknowledgementRecord> listForSession(String sessionId);

    int size();

    @Override
    void close();
}
