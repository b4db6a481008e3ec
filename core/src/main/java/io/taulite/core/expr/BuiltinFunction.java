package io.taulite.core.expr;

import java.util.Optional;

/**
 * Unary functions callable from expressions as {@code name(expr)}.
 * An identifier only denotes a function when it is directly followed by '('.
 */
public enum BuiltinFunction {
    LN("ln") {
        @Override double apply(double x, int position) {
            if (x <= 0.0) throw domain("ln", x, position);
            return Math.log(x);
        }
    },
    EXP("exp") {
        @Override double apply(double x, int position) {
            return Math.exp(x);
        }
    },
    ABS("abs") {
        @Override double apply(double x, int position) {
            return Math.abs(x);
        }
    },
    SQRT("sqrt") {
        @Override double apply(double x, int position) {
            if (x < 0.0) throw domain("sqrt", x, position);
            return Math.sqrt(x);
        }
    };

    private final String symbol;

    BuiltinFunction(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    abstract double apply(double x, int position);

    public static Optional<BuiltinFunction> fromSymbol(String symbol) {
        for (BuiltinFunction f : values()) {
            if (f.symbol.equals(symbol)) return Optional.of(f);
        }
        return Optional.empty();
    }

    private static ExpressionException domain(String fn, double x, int position) {
        return new ExpressionException(ExpressionException.Kind.DOMAIN_ERROR, position,
                fn + " is undefined for " + x);
    }
}
