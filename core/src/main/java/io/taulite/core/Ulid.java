package io.taulite.core;

import java.security.SecureRandom;

/**
 * Generator for ULIDs (Universally Unique Lexicographically Sortable Identifiers).
 * <p>
 * Layout (128 bits), rendered as 26 characters of Crockford base32:
 *  - 48-bit timestamp in milliseconds since the Unix epoch,
 *  - 80 bits of randomness.
 * <p>
 * Ids generated in a later millisecond sort after ids from an earlier one.
 * Ids generated within the same millisecond have no defined relative order.
 */
public final class Ulid {

    public static final int LENGTH = 26;

    private static final char[] ALPHABET = "0123456789ABCDEFGHJKMNPQRSTVWXYZ".toCharArray();
    private static final long TIMESTAMP_MASK = 0x0000_FFFF_FFFF_FFFFL;
    private static final SecureRandom RANDOM = new SecureRandom();

    private Ulid() {
        // utility
    }

    /** Generate a fresh id stamped with the current wall-clock time. */
    public static String next() {
        return next(System.currentTimeMillis());
    }

    /** Generate a fresh id stamped with {@code epochMillis} (lower 48 bits). */
    static String next(long epochMillis) {
        byte[] random = new byte[10];
        RANDOM.nextBytes(random);
        return encode(epochMillis & TIMESTAMP_MASK, random);
    }

    static String encode(long timestamp, byte[] random) {
        // 128-bit value as two longs: hi = timestamp(48) | random[0..2](16), lo = random[2..10](64)
        long hi = (timestamp << 16) | ((random[0] & 0xFFL) << 8) | (random[1] & 0xFFL);
        long lo = 0;
        for (int i = 2; i < 10; i++) {
            lo = (lo << 8) | (random[i] & 0xFFL);
        }

        char[] out = new char[LENGTH];
        for (int i = LENGTH - 1; i >= 0; i--) {
            out[i] = ALPHABET[(int) (lo & 0x1F)];
            // shift the 128-bit value right by 5
            lo = (lo >>> 5) | ((hi & 0x1F) << 59);
            hi >>>= 5;
        }
        return new String(out);
    }

    /** True if {@code s} has the shape of a ULID (length and alphabet). */
    public static boolean isWellFormed(String s) {
        if (s == null || s.length() != LENGTH) return false;
        // 26 * 5 = 130 bits; the leading char may only carry the top 3 bits
        if (s.charAt(0) > '7') return false;
        for (int i = 0; i < s.length(); i++) {
            if (indexOf(s.charAt(i)) < 0) return false;
        }
        return true;
    }

    private static int indexOf(char c) {
        for (int i = 0; i < ALPHABET.length; i++) {
            if (ALPHABET[i] == c) return i;
        }
        return -1;
    }
}
