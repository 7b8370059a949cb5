// file: core/src/main/java/io/varlite/core/AcknowledgementRecord.java
package io.varlite.core;

import java.time.Instant;
import java.util.Objects;

/**
 * A session's acknowledgement of one variant unit.
 * Unique on (unitId, sessionId); absence of a record means UNACKNOWLEDGED.
 *
 * @param readingIndex the reading the session chose to proceed with
 * @param reason       free-form note supplied by the session, may be empty
 */
public record AcknowledgementRecord(
        long unitId,
        String sessionId,
        int readingIndex,
        String reason,
        Instant acknowledgedAt
) {
    public AcknowledgementRecord {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(acknowledgedAt, "acknowledgedAt");
        reason = reason == null ? "" : reason;
    }
}
