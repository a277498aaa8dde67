package com.jmau.template;

import com.jmau.value.Value;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.math.BigInteger;

/**
 * Splits the source of one expression or tag span into tokens. Signs are never part of a number
 * token; the parser decides whether a {@code -} is an operator or the sign of a literal.
 */
public final class ExpressionLexer {

    public enum TokenType {
        NUMBER,
        STRING,
        ATOM,
        IDENTIFIER,
        OPERATOR,
        END
    }

    public record Token(TokenType type, String text, Value value, int start, int end) {
        public boolean is(TokenType expected, String expectedText) {
            return type == expected && text.equals(expectedText);
        }

        public boolean isOperator(String operator) {
            return is(TokenType.OPERATOR, operator);
        }

        public boolean isKeyword(String keyword) {
            return is(TokenType.IDENTIFIER, keyword);
        }
    }

    private static final String[] OPERATORS = {
        "==", "!=", "<=", ">=", "&&", "||",
        "<", ">", "+", "-", "*", "/", "%", "(", ")", "[", "]", ",", ".", "|", "="
    };

    private final String source;
    private int pos;

    private ExpressionLexer(String source) {
        this.source = source;
    }

    public static ImmutableList<Token> tokenize(String source) {
        return new ExpressionLexer(source).run();
    }

    private ImmutableList<Token> run() {
        MutableList<Token> tokens = Lists.mutable.empty();
        while (true) {
            skipWhitespace();
            if (pos >= source.length()) {
                tokens.add(new Token(TokenType.END, "", null, pos, pos));
                return tokens.toImmutable();
            }
            tokens.add(next());
        }
    }

    private Token next() {
        char c = source.charAt(pos);
        if (isDigit(c)) {
            return number();
        }
        if (c == '"' || c == '\'') {
            return string(c);
        }
        if (c == '$' && pos + 1 < source.length() && isIdentifierStart(source.charAt(pos + 1))) {
            int start = pos++;
            return identifier(start);
        }
        if (isIdentifierStart(c)) {
            return identifier(pos);
        }
        if (c == ':' && pos + 1 < source.length() && isIdentifierStart(source.charAt(pos + 1))) {
            int start = pos++;
            Token name = identifier(pos);
            return new Token(TokenType.ATOM, ":" + name.text(), Value.atom(name.text()), start, name.end());
        }
        for (String operator : OPERATORS) {
            if (source.startsWith(operator, pos)) {
                int start = pos;
                pos += operator.length();
                return new Token(TokenType.OPERATOR, operator, null, start, pos);
            }
        }
        throw new TemplateSyntaxException("Unexpected character '" + c + "'", pos);
    }

    private Token identifier(int start) {
        while (pos < source.length() && isIdentifierPart(source.charAt(pos))) {
            pos++;
        }
        String text = source.substring(start, pos);
        return new Token(TokenType.IDENTIFIER, text, null, start, pos);
    }

    private Token number() {
        int start = pos;
        if (source.charAt(pos) == '0' && pos + 1 < source.length() && isDigit(source.charAt(pos + 1))) {
            throw new TemplateSyntaxException("Leading zeros are not allowed in numbers", pos);
        }
        consumeDigits();
        boolean floating = false;
        if (pos + 1 < source.length() && source.charAt(pos) == '.' && isDigit(source.charAt(pos + 1))) {
            floating = true;
            pos++;
            consumeDigits();
        }
        if (pos < source.length() && (source.charAt(pos) == 'e' || source.charAt(pos) == 'E')) {
            int exponent = pos + 1;
            if (exponent < source.length() && (source.charAt(exponent) == '+' || source.charAt(exponent) == '-')) {
                exponent++;
            }
            if (exponent < source.length() && isDigit(source.charAt(exponent))) {
                floating = true;
                pos = exponent;
                consumeDigits();
            }
        }
        String text = source.substring(start, pos);
        if (pos < source.length() && isIdentifierPart(source.charAt(pos))) {
            throw new TemplateSyntaxException("Malformed number '" + text + source.charAt(pos) + "'", start);
        }
        if (floating) {
            return new Token(TokenType.NUMBER, text, Value.of(Double.parseDouble(text)), start, pos);
        }
        // beyond the long range the value stays null; only the parser knows whether a sign
        // brings the magnitude back in range
        BigInteger magnitude = new BigInteger(text);
        Value value = magnitude.bitLength() < 64 ? Value.of(magnitude.longValue()) : null;
        return new Token(TokenType.NUMBER, text, value, start, pos);
    }

    private Token string(char quote) {
        int start = pos++;
        StringBuilder sb = new StringBuilder();
        while (pos < source.length()) {
            char c = source.charAt(pos++);
            if (c == quote) {
                return new Token(TokenType.STRING, source.substring(start, pos), Value.of(sb.toString()), start, pos);
            }
            if (c != '\\') {
                sb.append(c);
                continue;
            }
            if (pos >= source.length()) {
                break;
            }
            char escaped = source.charAt(pos++);
            switch (escaped) {
                case '"' -> sb.append('"');
                case '\'' -> sb.append('\'');
                case '\\' -> sb.append('\\');
                case '/' -> sb.append('/');
                case 'b' -> sb.append('\b');
                case 'f' -> sb.append('\f');
                case 'n' -> sb.append('\n');
                case 'r' -> sb.append('\r');
                case 't' -> sb.append('\t');
                case 'u' -> sb.append(unicodeEscape());
                default -> throw new TemplateSyntaxException("Invalid escape sequence \\" + escaped, pos - 2);
            }
        }
        throw new TemplateSyntaxException("Unterminated string literal", start);
    }

    private char unicodeEscape() {
        if (pos + 4 > source.length()) {
            throw new TemplateSyntaxException("Incomplete unicode escape", pos - 2);
        }
        String hex = source.substring(pos, pos + 4);
        for (int i = 0; i < hex.length(); i++) {
            if (Character.digit(hex.charAt(i), 16) < 0) {
                throw new TemplateSyntaxException("Invalid unicode escape \\u" + hex, pos - 2);
            }
        }
        pos += 4;
        return (char) Integer.parseInt(hex, 16);
    }

    private void consumeDigits() {
        while (pos < source.length() && isDigit(source.charAt(pos))) {
            pos++;
        }
    }

    private void skipWhitespace() {
        while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
    }

    static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }
}
