// file: storage/src/main/java/io/varlite/storage/AckSnapshot.java
package io.varlite.storage;

import io.varlite.core.AcknowledgementRecord;

import java.util.List;

/** Full image of the acknowledgement store up to and including {@code lastSeq}. */
public record AckSnapshot(long lastSeq, List<AcknowledgementRecord> acks) {}
