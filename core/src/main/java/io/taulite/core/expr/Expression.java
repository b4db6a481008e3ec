package io.taulite.core.expr;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Compiled arithmetic expression over named variables.
 * <p>
 * Responsibilities:
 *  - Tokenize the source once and check its syntax.
 *  - Evaluate against a variable mapping as many times as needed.
 * <p>
 * Invariants:
 *  - Instances are immutable; {@link #evaluate(Map)} builds a fresh parser
 *    cursor per call, so one compiled expression may be shared across threads.
 *  - Every successful evaluation returns a finite double.
 */
public final class Expression {
    private final String source;
    private final List<Token> tokens;
    private final Set<String> variables;

    private Expression(String source, List<Token> tokens) {
        this.source = source;
        this.tokens = tokens;
        this.variables = collectVariables(tokens);
    }

    /**
     * Tokenize and syntax-check {@code source}.
     *
     * @throws ExpressionException INVALID_CHARACTER or UNEXPECTED_TOKEN
     */
    public static Expression compile(String source) {
        Objects.requireNonNull(source, "source");
        List<Token> tokens = Tokenizer.tokenize(source);
        new Parser(tokens, null).run();
        return new Expression(source, tokens);
    }

    /** One-shot convenience: compile and evaluate. */
    public static double evaluate(String source, Map<String, Double> bindings) {
        return compile(source).evaluate(bindings);
    }

    /**
     * Evaluate with the given bindings.
     *
     * @throws ExpressionException   UNDEFINED_VARIABLE, DIVISION_BY_ZERO or DOMAIN_ERROR
     * @throws IllegalStateException if any step of the arithmetic overflowed to a non-finite value
     */
    public double evaluate(Map<String, Double> bindings) {
        Objects.requireNonNull(bindings, "bindings");
        double result = new Parser(tokens, bindings).run();
        if (!Double.isFinite(result)) {
            throw new IllegalStateException("expression '" + source + "' produced non-finite result " + result);
        }
        return result;
    }

    public double evaluate(List<Variable> variables) {
        Map<String, Double> bindings = new HashMap<>();
        for (Variable v : variables) {
            bindings.put(v.name(), v.value());
        }
        return evaluate(bindings);
    }

    /** Variable names referenced by the expression, in order of first use. Function names excluded. */
    public Set<String> variables() {
        return variables;
    }

    public String source() {
        return source;
    }

    private static Set<String> collectVariables(List<Token> tokens) {
        Set<String> names = new LinkedHashSet<>();
        for (int i = 0; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (!t.is(TokenType.IDENTIFIER)) continue;
            boolean call = i + 1 < tokens.size() && tokens.get(i + 1).is(TokenType.LPAREN);
            if (!call) names.add(t.text());
        }
        return Collections.unmodifiableSet(names);
    }

    @Override public String toString() {
        return "Expression{" + source + "}";
    }
}
