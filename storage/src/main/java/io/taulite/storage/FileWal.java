package io.taulite.storage;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Stream;

import static java.nio.file.StandardOpenOption.*;

/**
 * File-backed WAL that appends header+payload records to segment files
 * named "00000001.log", "00000002.log", ...
 * <p>
 * Properties:
 *  - On construction, it:
 *      - creates the directory if needed,
 *      - opens the newest segment (or creates the first one),
 *      - cuts off a torn tail left by a crash, so new records never land
 *        behind unreadable bytes.
 * <p>
 *  - append():
 *      - writes the bytes,
 *      - calls force(true) to fsync data and metadata,
 *      - tracks bytes written this segment.
 * <p>
 *  - Reader:
 *      - walks all segments in name order,
 *      - reads the 11-byte header, validates magic/version/length,
 *      - reads the payload and validates the CRC,
 *      - stops for good at the first truncated or corrupt record.
 */
public class FileWal implements Wal {
    private static final Logger LOG = Logger.getLogger(FileWal.class.getName());
    private static final String SUFFIX = ".log";

    private final Path dir;
    private final long rotateBytes;
    private FileChannel ch;
    private Path current;
    private long writtenInSegment = 0;

    public FileWal(Path dir, long rotateBytes) {
        if (rotateBytes <= 0) throw new IllegalArgumentException("rotateBytes must be > 0");
        this.dir = dir;
        this.rotateBytes = rotateBytes;
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot create WAL directory " + dir, e);
        }
        openNewestOrCreate();
    }

    @Override
    public synchronized void append(byte[] framedRecord) {
        try {
            ByteBuffer buf = ByteBuffer.wrap(framedRecord);
            while (buf.hasRemaining()) {
                ch.write(buf);
            }
            ch.force(true);
            writtenInSegment += framedRecord.length;
        } catch (IOException e) {
            throw new UncheckedIOException("WAL append failed on " + current, e);
        }
    }

    @Override
    public synchronized void rotateIfNeeded() {
        if (writtenInSegment < rotateBytes) return;
        openNextSegment();
    }

    @Override
    public synchronized void truncateBeforeNewSegment() {
        openNextSegment();
        try {
            for (Path seg : segments(dir)) {
                if (!seg.equals(current)) Files.deleteIfExists(seg);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("cannot delete old WAL segments in " + dir, e);
        }
    }

    @Override
    public WalReader openReader() {
        return new Reader(segments(dir));
    }

    @Override
    public synchronized void close() {
        if (ch == null) return;
        try {
            ch.close();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private void openNewestOrCreate() {
        List<Path> existing = segments(dir);
        current = existing.isEmpty() ? dir.resolve(segmentName(1)) : existing.get(existing.size() - 1);
        try {
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            long size = ch.size();
            long valid = validPrefix(ch);
            if (valid < size) {
                LOG.warning(() -> "Truncating torn WAL tail in " + current + ": " + (size - valid) + " bytes");
                ch.truncate(valid);
                ch.force(true);
            }
            writtenInSegment = valid;
            ch.position(valid);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot open WAL segment " + current, e);
        }
    }

    private void openNextSegment() {
        try {
            ch.close();
            current = dir.resolve(segmentName(indexOf(current) + 1));
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            writtenInSegment = 0;
        } catch (IOException e) {
            throw new UncheckedIOException("WAL rotation failed in " + dir, e);
        }
    }

    static List<Path> segments(Path dir) {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> p.getFileName().toString().endsWith(SUFFIX)).sorted().toList();
        } catch (IOException e) {
            throw new UncheckedIOException("cannot list WAL segments in " + dir, e);
        }
    }

    private static String segmentName(int index) {
        return String.format("%08d%s", index, SUFFIX);
    }

    private static int indexOf(Path segment) {
        String name = segment.getFileName().toString();
        return Integer.parseInt(name.substring(0, name.length() - SUFFIX.length()));
    }

    /** Byte length of the readable record prefix of a segment. */
    private static long validPrefix(FileChannel ch) throws IOException {
        long pos = 0;
        while (true) {
            byte[] payload = readRecord(ch, pos);
            if (payload == null) return pos;
            pos += WalRecordCodec.HEADER_BYTES + payload.length;
        }
    }

    /** Payload of the record at {@code pos}, or null if none is fully readable there. */
    private static byte[] readRecord(FileChannel ch, long pos) throws IOException {
        ByteBuffer hdr = ByteBuffer.allocate(WalRecordCodec.HEADER_BYTES).order(ByteOrder.LITTLE_ENDIAN);
        int read = ch.read(hdr, pos);
        if (read < WalRecordCodec.HEADER_BYTES) return null; // EOF or truncated header
        hdr.flip();
        short magic = hdr.getShort();
        byte ver = hdr.get();
        int len = hdr.getInt();
        int crc = hdr.getInt();
        if (magic != WalRecordCodec.MAGIC || ver != WalRecordCodec.VERSION || len < 0) return null;
        if (len > ch.size() - pos - WalRecordCodec.HEADER_BYTES) return null; // truncated payload
        ByteBuffer payload = ByteBuffer.allocate(len);
        while (payload.hasRemaining()) {
            if (ch.read(payload, pos + WalRecordCodec.HEADER_BYTES + payload.position()) < 0) return null;
        }
        byte[] bytes = payload.array();
        return WalRecordCodec.crc32(bytes) == crc ? bytes : null;
    }

    /** Sequential reader across all segments used during recovery. */
    private static final class Reader implements WalReader {
        private final Deque<Path> pending;
        private FileChannel ch;
        private long pos;
        private boolean stopped;

        Reader(List<Path> segments) {
            this.pending = new ArrayDeque<>(segments);
        }

        @Override
        public byte[] next() {
            try {
                while (!stopped) {
                    if (ch == null) {
                        Path seg = pending.poll();
                        if (seg == null) return null;
                        ch = FileChannel.open(seg, READ);
                        pos = 0;
                    }
                    byte[] payload = readRecord(ch, pos);
                    if (payload != null) {
                        pos += WalRecordCodec.HEADER_BYTES + payload.length;
                        return payload;
                    }
                    if (pos < ch.size()) {
                        // torn or corrupt record: nothing after it is trusted
                        stopped = true;
                    }
                    ch.close();
                    ch = null;
                }
                return null;
            } catch (IOException e) {
                throw new UncheckedIOException("WAL read failed", e);
            }
        }

        @Override
        public void close() {
            if (ch == null) return;
            try {
                ch.close();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
    }
}
