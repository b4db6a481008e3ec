package io.taulite.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DeltaTest {

    @Test
    void interval_is_half_open() {
        var d = Delta.create("+1.0", 1000, 2000);

        assertTrue(d.isValid(1000));
        assertTrue(d.isValid(1999));
        assertFalse(d.isValid(2000));
        assertFalse(d.isValid(999));
    }

    @Test
    void reversed_or_empty_interval_is_rejected() {
        var reversed = assertThrows(ValidationException.class, () -> Delta.create("+1.0", 2000, 1000));
        assertEquals(ValidationException.Reason.INVALID_INTERVAL, reversed.reason());

        var empty = assertThrows(ValidationException.class, () -> Delta.create("+1.0", 1000, 1000));
        assertEquals(ValidationException.Reason.INVALID_INTERVAL, empty.reason());
    }

    @Test
    void timestamps_compare_unsigned() {
        // -1L is 2^64 - 1 as an unsigned timestamp
        var d = Delta.create(1.0, 1L << 63, -1L);
        assertTrue(d.isValid(-2L));
        assertFalse(d.isValid(5));
        assertEquals(18446744073709551615.0, Delta.toDouble(-1L));
    }

    @Test
    void payload_text_is_parsed_with_sign() {
        assertEquals(1.5, Delta.create("+1.5", 0, 1).value());
        assertEquals(-0.25, Delta.create("-0.25", 0, 1).value());
        assertEquals(3.0, Delta.create(" 3 ", 0, 1).value());
    }

    @Test
    void empty_and_garbage_payloads_are_rejected() {
        assertEquals(ValidationException.Reason.EMPTY_PAYLOAD,
                assertThrows(ValidationException.class, () -> Delta.create("", 0, 1)).reason());
        assertEquals(ValidationException.Reason.INVALID_PAYLOAD,
                assertThrows(ValidationException.class, () -> Delta.create("abc", 0, 1)).reason());
        assertEquals(ValidationException.Reason.INVALID_PAYLOAD,
                assertThrows(ValidationException.class, () -> Delta.create("NaN", 0, 1)).reason());
        assertEquals(ValidationException.Reason.INVALID_PAYLOAD,
                assertThrows(ValidationException.class, () -> Delta.create(Double.POSITIVE_INFINITY, 0, 1)).reason());
    }

    @Test
    void copy_keeps_value_and_interval_under_new_id() {
        var d = Delta.create("2.5", 10, 20);
        var c = d.copy();

        assertNotEquals(d.id(), c.id());
        assertEquals(d.value(), c.value());
        assertEquals(d.validFromNs(), c.validFromNs());
        assertEquals(d.validUntilNs(), c.validUntilNs());
    }

    @Test
    void serialized_record_decodes_to_equal_delta() {
        var d = Delta.create("-7.125", 1_000_000_000L, 2_000_000_000L);

        var back = Delta.deserialize(d.serialize());

        assertEquals(d, back);
        assertEquals(Ulid.LENGTH, back.id().length());
    }

    @Test
    void record_missing_timestamps_is_truncated() {
        byte[] full = Delta.create("1", 0, 1).serialize();
        byte[] cut = java.util.Arrays.copyOf(full, full.length - 3);

        var e = assertThrows(TruncatedRecordException.class, () -> Delta.deserialize(cut));
        assertEquals(16, e.needed());
        assertEquals(13, e.remaining());
    }

    @Test
    void overlap_uses_half_open_bounds() {
        var d = Delta.create(1.0, 10, 20);

        assertTrue(d.overlaps(0, 11));
        assertTrue(d.overlaps(19, 30));
        assertFalse(d.overlaps(20, 30));
        assertFalse(d.overlaps(0, 10));
    }
}
