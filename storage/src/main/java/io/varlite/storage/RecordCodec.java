// file: storage/src/main/java/io/varlite/storage/RecordCodec.java
package io.varlite.storage;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.zip.CRC32;

/**
 * Framing for WAL records and JSON encoding of their payloads.
 * <p>
 * On-disk layout of one record:
 * <p>
 *   [HEADER (11 bytes, little-endian)]
 *     - magic   (2B)  = 0x7A11
 *     - version (1B)  = 1
 *     - length  (4B)  = payload length in bytes
 *     - crc32   (4B)  = CRC32(payload)
 * <p>
 *   [PAYLOAD (length bytes)]
 *     - UTF-8 JSON document of the store's log record type
 * <p>
 * Readers validate magic, version, length and CRC and treat the first
 * failing frame as the end of the segment.
 */
public final class RecordCodec {
    static final short MAGIC = (short) 0x7A11;
    static final byte VERSION = 1;
    static final int HEADER_BYTES = 2 + 1 + 4 + 4;

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private RecordCodec() {
        // utility
    }

    /** Shared mapper for WAL payloads and snapshots. */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /** Prefix a payload with its header. */
    public static byte[] frame(byte[] payload) {
        ByteBuffer b = ByteBuffer.allocate(HEADER_BYTES + payload.length).order(ByteOrder.LITTLE_ENDIAN);
        b.putShort(MAGIC).put(VERSION).putInt(payload.length).putInt(crc32(payload));
        b.put(payload);
        return b.array();
    }

    public static byte[] encode(Object record) {
        try {
            return MAPPER.writeValueAsBytes(record);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to encode " + record.getClass().getSimpleName(), e);
        }
    }

    public static <T> T decode(byte[] payload, Class<T> type) {
        try {
            return MAPPER.readValue(payload, type);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to decode " + type.getSimpleName(), e);
        }
    }

    static int crc32(byte[] bytes) {
        CRC32 crc = new CRC32();
        crc.update(bytes, 0, bytes.length);
        return (int) crc.getValue();
    }
}
