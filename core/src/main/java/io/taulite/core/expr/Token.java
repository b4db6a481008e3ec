package io.taulite.core.expr;

/**
 * Lexical token. {@code number} is only meaningful for NUMBER tokens,
 * {@code text} holds the source slice.
 */
record Token(TokenType type, String text, double number, int position) {

    static Token of(TokenType type, String text, int position) {
        return new Token(type, text, 0.0, position);
    }

    static Token number(String text, double value, int position) {
        return new Token(TokenType.NUMBER, text, value, position);
    }

    boolean is(TokenType t) {
        return type == t;
    }
}
