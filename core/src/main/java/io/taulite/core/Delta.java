package io.taulite.core;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Immutable change of a value, valid over a half-open time interval.
 * <p>
 * Fields:
 *  - id:           26-char ULID, fresh for every created or copied delta.
 *  - value:        the change itself, always a finite double.
 *  - validFromNs:  first nanosecond (inclusive) at which the change applies.
 *  - validUntilNs: first nanosecond (exclusive) at which it no longer applies.
 * <p>
 * Timestamps are unsigned 64-bit values carried in a Java {@code long} and
 * always compared with {@link Long#compareUnsigned(long, long)}.
 * <p>
 * Invariants:
 *  - validFromNs &lt; validUntilNs (unsigned), so the interval is never empty.
 *  - isValid(validFromNs) is true and isValid(validUntilNs) is false.
 * <p>
 * Textual payloads ("+1.5", "-0.25", "3") are parsed once at creation; the
 * binary record carries the canonical text of {@link #value()}.
 */
public final class Delta {
    // decimal with optional sign, fraction and exponent (Double.toString output matches too)
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    private final String id;
    private final double value;
    private final long validFromNs;
    private final long validUntilNs;

    private Delta(String id, double value, long validFromNs, long validUntilNs) {
        this.id = id;
        this.value = value;
        this.validFromNs = validFromNs;
        this.validUntilNs = validUntilNs;
    }

    /**
     * Create a delta from a textual payload.
     *
     * @throws ValidationException EMPTY_PAYLOAD, INVALID_PAYLOAD or INVALID_INTERVAL
     */
    public static Delta create(String payload, long validFromNs, long validUntilNs) {
        double value = parsePayload(payload);
        return create(value, validFromNs, validUntilNs);
    }

    /**
     * Create a delta from a numeric payload.
     *
     * @throws ValidationException INVALID_PAYLOAD or INVALID_INTERVAL
     */
    public static Delta create(double value, long validFromNs, long validUntilNs) {
        checkValue(value);
        checkInterval(validFromNs, validUntilNs);
        return new Delta(Ulid.next(), value, validFromNs, validUntilNs);
    }

    /** Rebuild a delta with a known id (decoder path). */
    static Delta restore(String id, String payload, long validFromNs, long validUntilNs) {
        double value = parsePayload(payload);
        checkInterval(validFromNs, validUntilNs);
        return new Delta(Objects.requireNonNull(id, "id"), value, validFromNs, validUntilNs);
    }

    /** Same value and interval under a fresh id. */
    public Delta copy() {
        return new Delta(Ulid.next(), value, validFromNs, validUntilNs);
    }

    /**
     * Half-open containment test: validFromNs &lt;= t &lt; validUntilNs.
     */
    public boolean isValid(long timeNs) {
        if (Long.compareUnsigned(validFromNs, validUntilNs) >= 0) {
            throw new IllegalStateException("delta " + id + " has an empty interval");
        }
        return Long.compareUnsigned(validFromNs, timeNs) <= 0
                && Long.compareUnsigned(timeNs, validUntilNs) < 0;
    }

    /** True if this delta's interval intersects [fromNs, untilNs). */
    public boolean overlaps(long fromNs, long untilNs) {
        return Long.compareUnsigned(validFromNs, untilNs) < 0
                && Long.compareUnsigned(validUntilNs, fromNs) > 0;
    }

    public String id() { return id; }

    public double value() { return value; }

    public long validFromNs() { return validFromNs; }

    public long validUntilNs() { return validUntilNs; }

    /** Canonical payload text as written to the binary record. */
    public String valueAsText() {
        return Double.toString(value);
    }

    /** Encode as a self-describing binary record. */
    public byte[] serialize() {
        return RecordCodec.encodeDelta(this);
    }

    /**
     * Decode a record produced by {@link #serialize()}, keeping its id.
     *
     * @throws TruncatedRecordException if the record is shorter than its fields claim
     * @throws ValidationException      if the decoded payload or interval is invalid
     */
    public static Delta deserialize(byte[] record) {
        return RecordCodec.decodeDelta(record);
    }

    /** Unsigned conversion of a nanosecond timestamp to a double. */
    public static double toDouble(long unsignedNs) {
        if (unsignedNs >= 0) return (double) unsignedNs;
        // halve, keep the low bit so rounding matches a true unsigned conversion
        return ((double) ((unsignedNs >>> 1) | (unsignedNs & 1L))) * 2.0;
    }

    static double parsePayload(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new ValidationException(ValidationException.Reason.EMPTY_PAYLOAD, "payload must not be empty");
        }
        String text = payload.trim();
        if (!DECIMAL.matcher(text).matches()) {
            throw new ValidationException(ValidationException.Reason.INVALID_PAYLOAD,
                    "payload is not a decimal number: " + payload);
        }
        double parsed = Double.parseDouble(text);
        checkValue(parsed);
        return parsed;
    }

    private static void checkValue(double value) {
        if (!Double.isFinite(value)) {
            throw new ValidationException(ValidationException.Reason.INVALID_PAYLOAD,
                    "payload must be finite, got " + value);
        }
    }

    private static void checkInterval(long validFromNs, long validUntilNs) {
        if (Long.compareUnsigned(validUntilNs, validFromNs) <= 0) {
            throw new ValidationException(ValidationException.Reason.INVALID_INTERVAL,
                    "validUntilNs (%s) must be greater than validFromNs (%s)".formatted(
                            Long.toUnsignedString(validUntilNs), Long.toUnsignedString(validFromNs)));
        }
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Delta d)) return false;
        return id.equals(d.id)
                && Double.compare(value, d.value) == 0
                && validFromNs == d.validFromNs
                && validUntilNs == d.validUntilNs;
    }

    @Override public int hashCode() {
        return Objects.hash(id, value, validFromNs, validUntilNs);
    }

    @Override public String toString() {
        return "Delta{" + id + ", " + valueAsText() + " @ ["
                + Long.toUnsignedString(validFromNs) + ", " + Long.toUnsignedString(validUntilNs) + ")}";
    }
}
