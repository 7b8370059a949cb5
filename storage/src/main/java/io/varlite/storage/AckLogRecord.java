// file: storage/src/main/java/io/varlite/storage/AckLogRecord.java
package io.varlite.storage;

import io.varlite.core.AcknowledgementRecord;

/** WAL payload of the acknowledgement store: the full record after an upsert. */
public record AckLogRecord(long seq, AcknowledgementRecord ack) {}
