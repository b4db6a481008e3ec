package io.taulite.core;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GroupTest {

    private static Sequence seq(String name, double v) {
        return Sequence.create(name, List.of(Delta.create(v, 0, 10)));
    }

    @Test
    void create_requires_sequences_and_copies_them() {
        assertEquals(ValidationException.Reason.EMPTY_SEQUENCES,
                assertThrows(ValidationException.class, () -> Group.create(List.of())).reason());

        var a = seq("a", 1);
        var g = Group.create(List.of(a));
        a.append(List.of(Delta.create(2.0, 10, 20)));

        assertEquals(1, g.get(0).size());
        assertNotEquals(a.id(), g.get(0).id());
    }

    @Test
    void append_preserves_order() {
        var g = Group.create(List.of(seq("a", 1)));
        g.append(List.of(seq("b", 2), seq("c", 3)));

        assertEquals(3, g.size());
        assertEquals(List.of("a", "b", "c"), g.sequences().stream().map(Sequence::name).toList());
        assertEquals(ValidationException.Reason.EMPTY_INPUT,
                assertThrows(ValidationException.class, () -> g.append(List.of())).reason());
    }

    @Test
    void serialized_record_decodes_to_equal_group() {
        var g = Group.create(List.of(seq("a", 1), seq("b", -2.5)));

        assertEquals(g, Group.deserialize(g.serialize()));
    }

    @Test
    void short_group_record_is_truncated() {
        byte[] record = Group.create(List.of(seq("a", 1))).serialize();
        byte[] cut = java.util.Arrays.copyOf(record, record.length - 20);

        assertThrows(TruncatedRecordException.class, () -> Group.deserialize(cut));
    }
}
