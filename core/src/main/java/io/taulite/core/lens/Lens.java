package io.taulite.core.lens;

import io.taulite.core.Delta;
import io.taulite.core.Group;
import io.taulite.core.Sequence;
import io.taulite.core.Ulid;
import io.taulite.core.ValidationException;
import io.taulite.core.expr.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Named derivation of a new {@link Sequence} from bound input sequences.
 * <p>
 * Responsibilities:
 *  - Keep the expression source and an ordered variable -> handle mapping.
 *  - Align inputs by index and evaluate the expression once per index.
 * <p>
 * Alignment rules:
 *  - Output length is bounded by the longest input; an index that any input
 *    does not reach is skipped.
 *  - Variables {@code vt} and {@code et} read the bound delta's validFromNs and
 *    validUntilNs instead of its value.
 *  - Each output delta takes its interval from the first bound input.
 * <p>
 * Invariants:
 *  - name, description and expression are non-empty.
 *  - Binding order is insertion order; re-binding a variable keeps its slot.
 * <p>
 * Not thread safe; callers serialize binding and applying.
 */
public final class Lens {
    public static final String VALID_FROM_VARIABLE = "vt";
    public static final String VALID_UNTIL_VARIABLE = "et";

    private final String id;
    private final String name;
    private final String description;
    private final String expression;
    private final LinkedHashMap<String, SequenceHandle> inputs = new LinkedHashMap<>();

    private Lens(String name, String description, String expression) {
        this.id = Ulid.next();
        this.name = name;
        this.description = description;
        this.expression = expression;
    }

    /**
     * The expression is stored as text; syntax errors surface from {@link #apply()}.
     *
     * @throws ValidationException EMPTY_NAME, EMPTY_DESCRIPTION or EMPTY_EXPRESSION
     */
    public static Lens create(String name, String description, String expression) {
        requireText(name, ValidationException.Reason.EMPTY_NAME, "lens name");
        requireText(description, ValidationException.Reason.EMPTY_DESCRIPTION, "lens description");
        requireText(expression, ValidationException.Reason.EMPTY_EXPRESSION, "lens expression");
        return new Lens(name, description, expression);
    }

    /**
     * New lens reading the inputs of {@code inputsFrom} through the expression
     * of {@code expressionFrom}. Handles are shared, not copied.
     */
    public static Lens compose(String name, Lens inputsFrom, Lens expressionFrom) {
        Objects.requireNonNull(inputsFrom, "inputsFrom");
        Objects.requireNonNull(expressionFrom, "expressionFrom");
        Lens composed = create(name,
                "compose(" + inputsFrom.name + ", " + expressionFrom.name + ")",
                expressionFrom.expression);
        composed.inputs.putAll(inputsFrom.inputs);
        return composed;
    }

    public void bindInput(String variable, Sequence sequence) {
        bindInput(variable, SequenceHandle.of(sequence));
    }

    /**
     * @throws ValidationException EMPTY_VARIABLE if {@code variable} is blank
     */
    public void bindInput(String variable, SequenceHandle handle) {
        requireText(variable, ValidationException.Reason.EMPTY_VARIABLE, "variable name");
        inputs.put(variable, Objects.requireNonNull(handle, "handle"));
    }

    /**
     * Evaluate over all bound inputs.
     *
     * @throws LensException                             NO_INPUTS or MISSING_INPUT
     * @throws io.taulite.core.expr.ExpressionException on any expression failure
     */
    public Sequence apply() {
        Map<String, Sequence> resolved = resolveInputs();
        return evaluate(name, resolved);
    }

    /**
     * Apply once per group member. Every binding that shares the first bound
     * input's origin is re-derived from the member, so {@code vt}, {@code et}
     * and lagged views follow it too; other bindings keep their own input.
     * Output sequences are named {@code lensName/memberName}.
     */
    public Group applyToGroup(Group group) {
        Objects.requireNonNull(group, "group");
        Map<String, Sequence> resolved = resolveInputs();
        SequenceHandle primary = inputs.values().iterator().next().origin();

        List<Sequence> outputs = new ArrayList<>(group.size());
        for (Sequence member : group.sequences()) {
            Map<String, Sequence> substituted = new LinkedHashMap<>(resolved);
            for (Map.Entry<String, SequenceHandle> e : inputs.entrySet()) {
                if (e.getValue().origin() == primary) {
                    substituted.put(e.getKey(), e.getValue().deriveFrom(member));
                }
            }
            outputs.add(evaluate(name + "/" + member.name(), substituted));
        }
        return Group.create(outputs);
    }

    private Map<String, Sequence> resolveInputs() {
        if (inputs.isEmpty()) {
            throw new LensException(LensException.Reason.NO_INPUTS, "lens '" + name + "' has no bound inputs");
        }
        Map<String, Sequence> resolved = new LinkedHashMap<>();
        for (Map.Entry<String, SequenceHandle> e : inputs.entrySet()) {
            Sequence s = e.getValue().resolve().orElseThrow(() -> new LensException(
                    LensException.Reason.MISSING_INPUT,
                    "input '" + e.getKey() + "' of lens '" + name + "' no longer exists"));
            resolved.put(e.getKey(), s);
        }
        return resolved;
    }

    private Sequence evaluate(String outputName, Map<String, Sequence> resolved) {
        Expression compiled = Expression.compile(expression);

        int length = 0;
        for (Sequence s : resolved.values()) {
            length = Math.max(length, s.size());
        }
        Sequence primary = resolved.values().iterator().next();

        List<Delta> out = new ArrayList<>(length);
        Map<String, Double> bindings = new HashMap<>();
        for (int i = 0; i < length; i++) {
            if (!bindAt(i, resolved, bindings)) continue;
            double value = compiled.evaluate(bindings);
            Delta anchor = primary.get(i);
            out.add(Delta.create(value, anchor.validFromNs(), anchor.validUntilNs()));
        }
        // index 0 exists in every non-empty input, so out is never empty
        return Sequence.create(outputName, out);
    }

    /** Fill {@code bindings} for index i; false if some input is too short. */
    private static boolean bindAt(int i, Map<String, Sequence> resolved, Map<String, Double> bindings) {
        bindings.clear();
        for (Map.Entry<String, Sequence> e : resolved.entrySet()) {
            Sequence s = e.getValue();
            if (i >= s.size()) return false;
            Delta d = s.get(i);
            double v = switch (e.getKey()) {
                case VALID_FROM_VARIABLE -> Delta.toDouble(d.validFromNs());
                case VALID_UNTIL_VARIABLE -> Delta.toDouble(d.validUntilNs());
                default -> d.value();
            };
            bindings.put(e.getKey(), v);
        }
        return true;
    }

    private static void requireText(String s, ValidationException.Reason reason, String what) {
        if (s == null || s.isBlank()) {
            throw new ValidationException(reason, what + " must not be empty");
        }
    }

    public String id() { return id; }

    public String name() { return name; }

    public String description() { return description; }

    public String expression() { return expression; }

    /** Bound variable names in binding order. */
    public Set<String> inputNames() {
        return Collections.unmodifiableSet(inputs.keySet());
    }

    public Map<String, SequenceHandle> inputs() {
        return Collections.unmodifiableMap(inputs);
    }

    @Override public String toString() {
        return "Lens{" + name + ", expr=" + expression + ", inputs=" + inputs.keySet() + "}";
    }
}
