package io.taulite.core.expr;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits expression source into tokens.
 * <p>
 * Lexical rules:
 *  - whitespace separates tokens and is otherwise ignored,
 *  - numbers are digits with an optional fractional part ("2", "2.5", ".5"),
 *  - identifiers are an ASCII letter followed by ASCII letters or digits,
 *  - a '+' or '-' immediately followed by a digit or '.' is folded into the
 *    number when an operand is expected (start, after an operator, after '('),
 *  - anything else is INVALID_CHARACTER.
 * The result always ends with an EOF token.
 */
final class Tokenizer {

    private static final Pattern NUMBER = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)");

    private Tokenizer() {
        // utility
    }

    static List<Token> tokenize(String source) {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        int n = source.length();
        while (i < n) {
            char c = source.charAt(i);

            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }

            if ((c == '+' || c == '-') && operandExpected(tokens) && i + 1 < n && startsNumber(source.charAt(i + 1))) {
                i = readNumber(source, i, i + 1, tokens);
                continue;
            }

            switch (c) {
                case '+' -> tokens.add(Token.of(TokenType.PLUS, "+", i++));
                case '-' -> tokens.add(Token.of(TokenType.MINUS, "-", i++));
                case '*' -> tokens.add(Token.of(TokenType.MULTIPLY, "*", i++));
                case '/' -> tokens.add(Token.of(TokenType.DIVIDE, "/", i++));
                case '(' -> tokens.add(Token.of(TokenType.LPAREN, "(", i++));
                case ')' -> tokens.add(Token.of(TokenType.RPAREN, ")", i++));
                default -> {
                    if (startsNumber(c)) {
                        i = readNumber(source, i, i, tokens);
                    } else if (isAsciiLetter(c)) {
                        int start = i;
                        while (i < n && (isAsciiLetter(source.charAt(i)) || isDigit(source.charAt(i)))) {
                            i++;
                        }
                        tokens.add(Token.of(TokenType.IDENTIFIER, source.substring(start, i), start));
                    } else {
                        throw new ExpressionException(ExpressionException.Kind.INVALID_CHARACTER, i,
                                "invalid character '" + c + "'");
                    }
                }
            }
        }
        tokens.add(Token.of(TokenType.EOF, "", n));
        return List.copyOf(tokens);
    }

    /** Scan digits and dots from {@code digitsFrom}; the literal text starts at {@code start}. */
    private static int readNumber(String source, int start, int digitsFrom, List<Token> out) {
        int i = digitsFrom;
        while (i < source.length() && startsNumber(source.charAt(i))) {
            i++;
        }
        String text = source.substring(start, i);
        if (!NUMBER.matcher(text).matches()) {
            throw new ExpressionException(ExpressionException.Kind.UNEXPECTED_TOKEN, start,
                    "malformed number '" + text + "'");
        }
        double value = Double.parseDouble(text);
        if (!Double.isFinite(value)) {
            throw new ExpressionException(ExpressionException.Kind.UNEXPECTED_TOKEN, start,
                    "number out of range '" + text + "'");
        }
        out.add(Token.number(text, value, start));
        return i;
    }

    private static boolean operandExpected(List<Token> tokens) {
        if (tokens.isEmpty()) return true;
        TokenType last = tokens.get(tokens.size() - 1).type();
        return last == TokenType.PLUS || last == TokenType.MINUS
                || last == TokenType.MULTIPLY || last == TokenType.DIVIDE
                || last == TokenType.LPAREN;
    }

    private static boolean startsNumber(char c) {
        return isDigit(c) || c == '.';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }
}
