package io.taulite.core;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Binary layouts for core entities. All integers are big-endian and every
 * string or nested record carries a 4-byte length prefix.
 * <p>
 *   Delta:
 *     - id:            u32 len + UTF-8 bytes
 *     - payload:       u32 len + UTF-8 bytes (canonical decimal text)
 *     - validFromNs:   u64
 *     - validUntilNs:  u64
 * <p>
 *   Sequence:
 *     - id:            u32 len + UTF-8 bytes
 *     - name:          u32 len + UTF-8 bytes
 *     - count:         u32
 *         repeated count times: u32 len + Delta record
 * <p>
 *   Group:
 *     - id:            u32 len + UTF-8 bytes
 *     - count:         u32
 *         repeated count times: u32 len + Sequence record
 * <p>
 * Decoders check every length against the bytes that remain and raise
 * {@link TruncatedRecordException} instead of reading past the end. Errors
 * from nested decoders are never wrapped.
 */
final class RecordCodec {

    private static final int TIMESTAMPS_BYTES = 8 + 8;

    private RecordCodec() {
        // utility
    }

    // ----------------- Delta -----------------

    static byte[] encodeDelta(Delta d) {
        byte[] id = utf8(d.id());
        byte[] payload = utf8(d.valueAsText());
        ByteBuffer b = allocate(4 + id.length + 4 + payload.length + TIMESTAMPS_BYTES);
        writeBytes(b, id);
        writeBytes(b, payload);
        b.putLong(d.validFromNs());
        b.putLong(d.validUntilNs());
        return b.array();
    }

    static Delta decodeDelta(byte[] record) {
        ByteBuffer b = wrap(record);
        String id = readString(b, "delta id");
        String payload = readString(b, "delta payload");
        require(b, TIMESTAMPS_BYTES, "delta interval");
        long validFrom = b.getLong();
        long validUntil = b.getLong();
        requireConsumed(b, "delta");
        return Delta.restore(id, payload, validFrom, validUntil);
    }

    // ----------------- Sequence -----------------

    static byte[] encodeSequence(Sequence s) {
        byte[] id = utf8(s.id());
        byte[] name = utf8(s.name());
        List<byte[]> records = new ArrayList<>(s.size());
        int size = 4 + id.length + 4 + name.length + 4;
        for (Delta d : s.deltas()) {
            byte[] r = encodeDelta(d);
            records.add(r);
            size += 4 + r.length;
        }

        ByteBuffer b = allocate(size);
        writeBytes(b, id);
        writeBytes(b, name);
        b.putInt(records.size());
        for (byte[] r : records) {
            writeBytes(b, r);
        }
        return b.array();
    }

    static Sequence decodeSequence(byte[] record) {
        ByteBuffer b = wrap(record);
        String id = readString(b, "sequence id");
        String name = readString(b, "sequence name");
        int count = readCount(b, "sequence count");
        List<Delta> deltas = new ArrayList<>(Math.min(count, 1024));
        for (int i = 0; i < count; i++) {
            deltas.add(decodeDelta(readBytes(b, "delta record")));
        }
        requireConsumed(b, "sequence");
        return Sequence.restore(id, name, deltas);
    }

    // ----------------- Group -----------------

    static byte[] encodeGroup(Group g) {
        byte[] id = utf8(g.id());
        List<byte[]> records = new ArrayList<>(g.size());
        int size = 4 + id.length + 4;
        for (Sequence s : g.sequences()) {
            byte[] r = encodeSequence(s);
            records.add(r);
            size += 4 + r.length;
        }

        ByteBuffer b = allocate(size);
        writeBytes(b, id);
        b.putInt(records.size());
        for (byte[] r : records) {
            writeBytes(b, r);
        }
        return b.array();
    }

    static Group decodeGroup(byte[] record) {
        ByteBuffer b = wrap(record);
        String id = readString(b, "group id");
        int count = readCount(b, "group count");
        List<Sequence> sequences = new ArrayList<>(Math.min(count, 1024));
        for (int i = 0; i < count; i++) {
            sequences.add(decodeSequence(readBytes(b, "sequence record")));
        }
        requireConsumed(b, "group");
        return Group.restore(id, sequences);
    }

    // ----------------- helpers -----------------

    private static ByteBuffer allocate(int size) {
        return ByteBuffer.allocate(size).order(ByteOrder.BIG_ENDIAN);
    }

    private static ByteBuffer wrap(byte[] record) {
        if (record == null) throw new NullPointerException("record");
        return ByteBuffer.wrap(record).order(ByteOrder.BIG_ENDIAN);
    }

    private static byte[] utf8(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static void writeBytes(ByteBuffer b, byte[] data) {
        b.putInt(data.length).put(data);
    }

    private static void require(ByteBuffer b, int needed, String field) {
        if (b.remaining() < needed) {
            throw new TruncatedRecordException(field, needed, b.remaining());
        }
    }

    private static void requireConsumed(ByteBuffer b, String what) {
        if (b.hasRemaining()) {
            throw new ValidationException(ValidationException.Reason.TRAILING_BYTES,
                    what + " record has " + b.remaining() + " trailing bytes");
        }
    }

    private static int readCount(ByteBuffer b, String field) {
        require(b, 4, field);
        long count = Integer.toUnsignedLong(b.getInt());
        // every element needs at least its own length prefix
        if (count * 4 > b.remaining()) {
            throw new TruncatedRecordException(field, (int) Math.min(count * 4, Integer.MAX_VALUE), b.remaining());
        }
        return (int) count;
    }

    private static byte[] readBytes(ByteBuffer b, String field) {
        require(b, 4, field + " length");
        long len = Integer.toUnsignedLong(b.getInt());
        if (len > b.remaining()) {
            throw new TruncatedRecordException(field, (int) Math.min(len, Integer.MAX_VALUE), b.remaining());
        }
        byte[] out = new byte[(int) len];
        b.get(out);
        return out;
    }

    private static String readString(ByteBuffer b, String field) {
        return new String(readBytes(b, field), StandardCharsets.UTF_8);
    }
}
