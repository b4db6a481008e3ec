package io.taulite.core.expr;

/**
 * Recoverable failure while tokenizing, parsing or evaluating an expression.
 * <p>
 * Reported per evaluation; an expression failing never affects stored data.
 */
public class ExpressionException extends IllegalArgumentException {

    public enum Kind {
        /** A character outside the language (not whitespace, digit, letter, operator, parenthesis or '.'). */
        INVALID_CHARACTER,
        /** A variable with no binding in the supplied mapping. */
        UNDEFINED_VARIABLE,
        /** A divisor that evaluated to exactly zero. */
        DIVISION_BY_ZERO,
        /** A token where the grammar does not allow it (missing ')', trailing input, operator as operand). */
        UNEXPECTED_TOKEN,
        /** A built-in function applied outside its domain, e.g. ln(0). */
        DOMAIN_ERROR
    }

    private final Kind kind;
    private final int position;

    public ExpressionException(Kind kind, int position, String message) {
        super(message + " (at " + position + ")");
        this.kind = kind;
        this.position = position;
    }

    public Kind kind() {
        return kind;
    }

    /** Character offset in the source text, or -1 when not tied to a position. */
    public int position() {
        return position;
    }
}
