package io.taulite.core.expr;

enum TokenType {
    NUMBER, IDENTIFIER, PLUS, MINUS, MULTIPLY, DIVIDE, LPAREN, RPAREN, EOF
}
