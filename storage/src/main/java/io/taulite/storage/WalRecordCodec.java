package io.taulite.storage;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.zip.CRC32;

/**
 * Binary framing for WAL records.
 * <p>
 * Full on-disk layout:
 * <p>
 *   [HEADER (11 bytes, little-endian)]
 *     - magic   (2B)  = 0x7A01
 *     - version (1B)  = 1
 *     - length  (4B)  = payload length in bytes
 *     - crc32   (4B)  = CRC32(payload)
 * <p>
 *   [PAYLOAD (length bytes, little-endian)]
 *     - op:    byte (1 = put, 2 = delete)
 *     - key:   int32 len + UTF-8 bytes
 *     - value: int32 len + bytes (put only)
 */
final class WalRecordCodec {
    static final short MAGIC = (short) 0x7A01;
    static final byte VERSION = 1;
    static final int HEADER_BYTES = 2 + 1 + 4 + 4;

    private static final byte OP_PUT = 1;
    private static final byte OP_DELETE = 2;

    private WalRecordCodec() {
        // utility
    }

    /** One logged mutation. {@code value} is null for deletes. */
    record Mutation(String key, byte[] value) {
        static Mutation put(String key, byte[] value) {
            return new Mutation(key, value);
        }

        static Mutation delete(String key) {
            return new Mutation(key, null);
        }

        boolean isDelete() {
            return value == null;
        }
    }

    /** Encode a mutation into header+payload bytes ready for append. */
    static byte[] encode(Mutation m) {
        byte[] payload = encodePayload(m);
        ByteBuffer out = ByteBuffer.allocate(HEADER_BYTES + payload.length).order(ByteOrder.LITTLE_ENDIAN);
        out.putShort(MAGIC).put(VERSION).putInt(payload.length).putInt(crc32(payload));
        out.put(payload);
        return out.array();
    }

    /**
     * Decode a full payload (header already stripped and CRC-checked).
     *
     * @throws IllegalStateException if the payload does not describe a mutation
     */
    static Mutation decode(byte[] payload) {
        ByteBuffer b = ByteBuffer.wrap(payload).order(ByteOrder.LITTLE_ENDIAN);
        byte op = b.get();
        String key = new String(readBytes(b), StandardCharsets.UTF_8);
        return switch (op) {
            case OP_PUT -> Mutation.put(key, readBytes(b));
            case OP_DELETE -> Mutation.delete(key);
            default -> throw new IllegalStateException("unknown WAL op " + op);
        };
    }

    private static byte[] encodePayload(Mutation m) {
        byte[] key = m.key().getBytes(StandardCharsets.UTF_8);
        int size = 1 + 4 + key.length + (m.isDelete() ? 0 : 4 + m.value().length);
        ByteBuffer b = ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
        b.put(m.isDelete() ? OP_DELETE : OP_PUT);
        b.putInt(key.length).put(key);
        if (!m.isDelete()) {
            b.putInt(m.value().length).put(m.value());
        }
        return b.array();
    }

    static int crc32(byte[] bytes) {
        CRC32 crc = new CRC32();
        crc.update(bytes, 0, bytes.length);
        return (int) crc.getValue();
    }

    private static byte[] readBytes(ByteBuffer b) {
        int len = b.getInt();
        if (len < 0 || len > b.remaining()) {
            throw new IllegalStateException("WAL field length " + len + " exceeds payload");
        }
        byte[] out = new byte[len];
        b.get(out);
        return out;
    }
}
