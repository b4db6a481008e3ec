package io.taulite.core.lens;

import io.taulite.core.Delta;
import io.taulite.core.Group;
import io.taulite.core.Sequence;
import io.taulite.core.ValidationException;
import io.taulite.core.expr.ExpressionException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class LensTest {

    private static Sequence seq(String name, double... values) {
        List<Delta> deltas = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            deltas.add(Delta.create(values[i], i * 100L, (i + 1) * 100L));
        }
        return Sequence.create(name, deltas);
    }

    private static List<Double> values(Sequence s) {
        return s.deltas().stream().map(Delta::value).toList();
    }

    @Test
    void create_validates_text_fields() {
        assertEquals(ValidationException.Reason.EMPTY_NAME,
                assertThrows(ValidationException.class, () -> Lens.create("", "d", "x")).reason());
        assertEquals(ValidationException.Reason.EMPTY_DESCRIPTION,
                assertThrows(ValidationException.class, () -> Lens.create("n", "", "x")).reason());
        assertEquals(ValidationException.Reason.EMPTY_EXPRESSION,
                assertThrows(ValidationException.class, () -> Lens.create("n", "d", " ")).reason());
    }

    @Test
    void single_input_is_mapped_per_index() {
        var lens = Lens.create("doubled", "x times two", "x * 2");
        lens.bindInput("x", seq("s", 1, 2, 3));

        var out = lens.apply();

        assertEquals("doubled", out.name());
        assertEquals(List.of(2.0, 4.0, 6.0), values(out));
        assertEquals(100L, out.get(1).validFromNs());
        assertEquals(200L, out.get(1).validUntilNs());
    }

    @Test
    void shorter_input_limits_output() {
        var lens = Lens.create("sum", "a plus b", "a + b");
        lens.bindInput("a", seq("a", 1, 2, 3));
        lens.bindInput("b", seq("b", 10, 20));

        assertEquals(List.of(11.0, 22.0), values(lens.apply()));
    }

    @Test
    void output_interval_follows_first_bound_input() {
        var a = Sequence.create("a", List.of(Delta.create(1.0, 5, 6)));
        var b = Sequence.create("b", List.of(Delta.create(2.0, 50, 60)));
        var lens = Lens.create("l", "d", "a + b");
        lens.bindInput("b", b);
        lens.bindInput("a", a);

        var out = lens.apply();

        assertEquals(50L, out.get(0).validFromNs());
        assertEquals(60L, out.get(0).validUntilNs());
    }

    @Test
    void reserved_variables_read_interval_bounds() {
        var s = Sequence.create("s", List.of(Delta.create(99.0, 1000, 3000)));
        var lens = Lens.create("t", "start and end", "et - vt + vt * 0");
        lens.bindInput("vt", s);
        lens.bindInput("et", s);

        assertEquals(List.of(2000.0), values(lens.apply()));

        var start = Lens.create("start", "d", "vt");
        start.bindInput("vt", s);
        assertEquals(List.of(1000.0), values(start.apply()));
    }

    @Test
    void rebinding_keeps_original_position() {
        var lens = Lens.create("l", "d", "a - b");
        lens.bindInput("a", seq("a", 1));
        lens.bindInput("b", seq("b", 2));
        lens.bindInput("a", seq("a2", 5));

        assertEquals(List.of("a", "b"), List.copyOf(lens.inputNames()));
        assertEquals(List.of(3.0), values(lens.apply()));
    }

    @Test
    void appends_after_binding_are_visible() {
        var s = seq("s", 1);
        var lens = Lens.create("l", "d", "x");
        lens.bindInput("x", s);
        s.append(List.of(Delta.create(2.0, 100, 200)));

        assertEquals(List.of(1.0, 2.0), values(lens.apply()));
    }

    @Test
    void apply_without_inputs_fails() {
        var e = assertThrows(LensException.class, () -> Lens.create("l", "d", "1").apply());
        assertEquals(LensException.Reason.NO_INPUTS, e.reason());
    }

    @Test
    void unresolvable_handle_fails_with_missing_input() {
        var lens = Lens.create("l", "d", "x");
        lens.bindInput("x", Optional::empty);

        var e = assertThrows(LensException.class, lens::apply);
        assertEquals(LensException.Reason.MISSING_INPUT, e.reason());
    }

    @Test
    void expression_errors_surface_from_apply() {
        var broken = Lens.create("l", "d", "x +");
        broken.bindInput("x", seq("s", 1));
        assertEquals(ExpressionException.Kind.UNEXPECTED_TOKEN,
                assertThrows(ExpressionException.class, broken::apply).kind());

        var divides = Lens.create("l", "d", "1 / x");
        divides.bindInput("x", seq("s", 0));
        assertEquals(ExpressionException.Kind.DIVISION_BY_ZERO,
                assertThrows(ExpressionException.class, divides::apply).kind());
    }

    @Test
    void group_apply_substitutes_each_member_for_first_input() {
        var offset = seq("offset", 100);
        var lens = Lens.create("shift", "d", "x + k");
        lens.bindInput("x", seq("placeholder", 0));
        lens.bindInput("k", offset);

        var group = Group.create(List.of(seq("a", 1, 2), seq("b", 5)));
        Group out = lens.applyToGroup(group);

        assertEquals(2, out.size());
        assertEquals("shift/a", out.get(0).name());
        assertEquals("shift/b", out.get(1).name());
        assertEquals(List.of(101.0), values(out.get(0)));
        assertEquals(List.of(105.0), values(out.get(1)));
        assertNotEquals(group.id(), out.id());
    }

    @Test
    void compose_takes_inputs_of_one_and_expression_of_other() {
        var s = seq("s", 1, 2);
        var first = Lens.create("first", "d", "x + 1");
        first.bindInput("x", s);
        var second = Lens.create("second", "d", "x * 10");

        var composed = Lens.compose("both", first, second);

        assertEquals("compose(first, second)", composed.description());
        assertEquals("x * 10", composed.expression());
        assertSame(first.inputs().get("x"), composed.inputs().get("x"));
        assertEquals(List.of(10.0, 20.0), values(composed.apply()));
    }

    @Test
    void group_apply_rederives_lagged_input_from_member() {
        var lens = BuiltinTransform.RETURNS.toLens("r", SequenceHandle.of(seq("source", 1, 1)));

        Group out = lens.applyToGroup(Group.create(List.of(seq("m", 100, 110))));

        assertEquals(List.of(0.0, 0.1), values(out.get(0)));
    }

    @Test
    void group_apply_reads_interval_bounds_of_member() {
        var lens = BuiltinTransform.INTERVAL_SECONDS.toLens("secs", SequenceHandle.of(seq("source", 1)));
        var member = Sequence.create("m", List.of(Delta.create(3.0, 0L, 5_000_000_000L)));

        Group out = lens.applyToGroup(Group.create(List.of(member)));

        assertEquals(List.of(5.0), values(out.get(0)));
        assertEquals(5_000_000_000L, out.get(0).get(0).validUntilNs());
    }

    @Test
    void lagged_handle_shares_origin_of_its_source() {
        SequenceHandle source = SequenceHandle.of(seq("s", 1, 2));
        SequenceHandle lagged = SequenceHandle.lagged(source);

        assertSame(source, lagged.origin());
        assertEquals(List.of(7.0, 7.0, 8.0), values(lagged.deriveFrom(seq("other", 7, 8, 9))));
        assertEquals(List.of(1.0, 1.0), values(lagged.resolve().orElseThrow()));
    }
}
