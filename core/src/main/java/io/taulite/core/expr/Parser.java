package io.taulite.core.expr;

import java.util.List;
import java.util.Map;

/**
 * Recursive-descent parser and evaluator over a token list.
 * <p>
 * One instance per evaluation: the cursor is the only mutable state and it
 * never outlives {@link #run()}. With {@code bindings == null} the parser only
 * checks syntax; arithmetic, variable lookup and domain checks are skipped.
 *
 * <pre>
 *   expression := term (('+'|'-') term)*
 *   term       := factor (('*'|'/') factor)*
 *   factor     := number | variable | function '(' expression ')' | '(' expression ')'
 * </pre>
 */
final class Parser {
    private final List<Token> tokens;
    private final Map<String, Double> bindings;
    private int position;

    Parser(List<Token> tokens, Map<String, Double> bindings) {
        this.tokens = tokens;
        this.bindings = bindings;
    }

    double run() {
        position = 0;
        double result = expression();
        if (!current().is(TokenType.EOF)) {
            throw unexpected(current(), "trailing input");
        }
        return result;
    }

    private double expression() {
        double result = term();
        while (current().is(TokenType.PLUS) || current().is(TokenType.MINUS)) {
            Token op = advance();
            double right = term();
            result = finite(op.is(TokenType.PLUS) ? result + right : result - right, op);
        }
        return result;
    }

    private double term() {
        double result = factor();
        while (current().is(TokenType.MULTIPLY) || current().is(TokenType.DIVIDE)) {
            Token op = advance();
            double right = factor();
            if (op.is(TokenType.MULTIPLY)) {
                result = finite(result * right, op);
            } else {
                if (checking()) continue;
                if (right == 0.0) {
                    throw new ExpressionException(ExpressionException.Kind.DIVISION_BY_ZERO, op.position(),
                            "division by zero");
                }
                result = finite(result / right, op);
            }
        }
        return result;
    }

    private double factor() {
        Token token = current();
        switch (token.type()) {
            case NUMBER -> {
                advance();
                return token.number();
            }
            case IDENTIFIER -> {
                advance();
                if (current().is(TokenType.LPAREN)) {
                    var fn = BuiltinFunction.fromSymbol(token.text())
                            .orElseThrow(() -> unexpected(current(), "'" + token.text() + "' is not a function"));
                    double arg = parenthesized();
                    return checking() ? 0.0 : finite(fn.apply(arg, token.position()), token);
                }
                return lookup(token);
            }
            case LPAREN -> {
                return parenthesized();
            }
            default -> throw unexpected(token, "expected a number, variable or '('");
        }
    }

    private double parenthesized() {
        advance(); // '('
        double inner = expression();
        if (!current().is(TokenType.RPAREN)) {
            throw unexpected(current(), "expected ')'");
        }
        advance();
        return inner;
    }

    private double lookup(Token variable) {
        if (checking()) return 0.0;
        Double value = bindings.get(variable.text());
        if (value == null) {
            throw new ExpressionException(ExpressionException.Kind.UNDEFINED_VARIABLE, variable.position(),
                    "undefined variable '" + variable.text() + "'");
        }
        return value;
    }

    /** An overflow must not be absorbed by a later operation, e.g. {@code 1 / (huge * huge)}. */
    private static double finite(double value, Token at) {
        if (!Double.isFinite(value)) {
            throw new IllegalStateException("arithmetic overflow at " + at.position() + " ('" + at.text() + "')");
        }
        return value;
    }

    private boolean checking() {
        return bindings == null;
    }

    private Token current() {
        return position < tokens.size() ? tokens.get(position) : tokens.get(tokens.size() - 1);
    }

    private Token advance() {
        Token t = current();
        if (position < tokens.size()) position++;
        return t;
    }

    private static ExpressionException unexpected(Token token, String what) {
        String found = token.is(TokenType.EOF) ? "end of input" : "'" + token.text() + "'";
        return new ExpressionException(ExpressionException.Kind.UNEXPECTED_TOKEN, token.position(),
                what + ", found " + found);
    }
}
