// file: storage/src/main/java/io/varlite/storage/FileWal.java
package io.varlite.storage;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Stream;

import static java.nio.file.StandardOpenOption.*;

/**
 * File-backed WAL that appends framed records to numbered segment files
 * ("00000001.log", "00000002.log", ...).
 * <p>
 * On construction it:
 *  - creates the directory if needed,
 *  - opens the newest segment (or creates the first one),
 *  - cuts off a torn tail left by a crash, so later appends stay readable.
 * <p>
 * append() writes the frame and calls force(true). rotateIfNeeded() moves to the
 * next segment once the current one has reached rotateBytes. The reader walks every
 * segment in order and stops reading a segment at its first invalid frame; a
 * corrupt frame in any segment but the newest is logged.
 */
public class FileWal implements Wal {
    private static final Logger log = Logger.getLogger(FileWal.class.getName());

    private final Path dir;
    private final long rotateBytes;
    private FileChannel ch;
    private Path current;
    private long writtenInSegment;

    public FileWal(Path dir, long rotateBytes) {
        if (rotateBytes <= 0) throw new IllegalArgumentException("rotateBytes must be > 0");
        this.dir = dir;
        this.rotateBytes = rotateBytes;
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create WAL directory " + dir, e);
        }
        openNewestOrCreate();
    }

    @Override
    public synchronized void append(byte[] frame) {
        try {
            ByteBuffer buf = ByteBuffer.wrap(frame);
            while (buf.hasRemaining()) ch.write(buf);
            ch.force(true);
            writtenInSegment += frame.length;
        } catch (IOException e) {
            throw new UncheckedIOException("WAL append failed on " + current, e);
        }
    }

    @Override
    public synchronized void rotateIfNeeded() {
        if (writtenInSegment < rotateBytes) return;
        openSegment(nextSegmentName());
    }

    @Override
    public synchronized void checkpoint() {
        Path keep = dir.resolve(nextSegmentName());
        openSegment(keep.getFileName().toString());
        for (Path seg : segments()) {
            if (seg.equals(keep)) continue;
            try {
                Files.deleteIfExists(seg);
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot delete WAL segment " + seg, e);
            }
        }
    }

    @Override
    public WalReader openReader() {
        return new Reader(segments());
    }

    @Override
    public synchronized void close() {
        try {
            if (ch != null && ch.isOpen()) ch.close();
        } catch (IOException e) {
            throw new UncheckedIOException("WAL close failed", e);
        }
    }

    private List<Path> segments() {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> p.getFileName().toString().endsWith(".log")).sorted().toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list WAL directory " + dir, e);
        }
    }

    private String nextSegmentName() {
        int index = Integer.parseInt(current.getFileName().toString().replace(".log", ""));
        return String.format("%08d.log", index + 1);
    }

    private void openSegment(String name) {
        try {
            if (ch != null && ch.isOpen()) ch.close();
            current = dir.resolve(name);
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            writtenInSegment = ch.size();
            ch.position(writtenInSegment);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot open WAL segment " + name, e);
        }
    }

    private void openNewestOrCreate() {
        List<Path> segs = segments();
        String name = segs.isEmpty() ? "00000001.log" : segs.get(segs.size() - 1).getFileName().toString();
        openSegment(name);
        try {
            long valid = validPrefixLength(ch);
            if (valid < ch.size()) {
                log.warning(() -> String.format("Truncating torn WAL tail of %s: %d -> %d bytes", current, writtenInSegment, valid));
                ch.truncate(valid);
                ch.force(true);
                writtenInSegment = valid;
                ch.position(valid);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot check WAL segment " + current, e);
        }
    }

    /** Length of the longest prefix of the channel made of valid frames. */
    private static long validPrefixLength(FileChannel ch) throws IOException {
        long pos = 0;
        for (byte[] payload; (payload = readFrame(ch, pos)) != null; ) {
            pos += RecordCodec.HEADER_BYTES + payload.length;
        }
        return pos;
    }

    /** Read the frame at {@code pos}, or null at EOF or on a truncated or corrupt frame. */
    private static byte[] readFrame(FileChannel ch, long pos) throws IOException {
        ByteBuffer hdr = ByteBuffer.allocate(RecordCodec.HEADER_BYTES).order(ByteOrder.LITTLE_ENDIAN);
        int read = ch.read(hdr, pos);
        if (read < RecordCodec.HEADER_BYTES) return null;
        hdr.flip();
        short magic = hdr.getShort();
        byte ver = hdr.get();
        int len = hdr.getInt();
        int crc = hdr.getInt();
        if (magic != RecordCodec.MAGIC || ver != RecordCodec.VERSION || len < 0) return null;
        if (pos + RecordCodec.HEADER_BYTES + len > ch.size()) return null;
        ByteBuffer payload = ByteBuffer.allocate(len);
        long at = pos + RecordCodec.HEADER_BYTES;
        while (payload.hasRemaining()) {
            int n = ch.read(payload, at + payload.position());
            if (n <= 0) return null;
        }
        byte[] bytes = payload.array();
        return RecordCodec.crc32(bytes) == crc ? bytes : null;
    }

    private static final class Reader implements WalReader {
        private final Iterator<Path> remaining;
        private FileChannel ch;
        private Path segment;
        private long pos;

        Reader(List<Path> segments) {
            this.remaining = new ArrayList<>(segments).iterator();
        }

        @Override
        public byte[] next() {
            try {
                while (true) {
                    if (ch == null) {
                        if (!remaining.hasNext()) return null;
                        segment = remaining.next();
                        ch = FileChannel.open(segment, READ);
                        pos = 0;
                    }
                    byte[] payload = readFrame(ch, pos);
                    if (payload != null) {
                        pos += RecordCodec.HEADER_BYTES + payload.length;
                        return payload;
                    }
                    if (pos < ch.size() && remaining.hasNext()) {
                        long at = pos, size = ch.size();
                        Path bad = segment;
                        log.warning(() -> String.format(
                                "Skipping corrupt WAL frame in %s at offset %d; %d bytes of the segment are not replayed",
                                bad, at, size - at));
                    }
                    ch.close();
                    ch = null;
                }
            } catch (IOException e) {
                throw new UncheckedIOException("WAL read failed", e);
            }
        }

        @Override
        public void close() {
            try {
                if (ch != null) ch.close();
            } catch (IOException e) {
                throw new UncheckedIOException("WAL reader close failed", e);
            }
        }
    }
}
