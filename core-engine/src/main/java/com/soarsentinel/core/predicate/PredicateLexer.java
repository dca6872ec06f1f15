package com.soarsentinel.core.predicate;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits predicate source into {@link Token}s.
 *
 * <p>
 * String literals may use single or double quotes and support the escapes
 * {@code \'}, {@code \"} and {@code \\}. Numbers are decimal, optionally
 * negative, and are held as {@link BigDecimal}.
 * </p>
 */
final class PredicateLexer {

    private final String source;
    private int pos;

    PredicateLexer(String source) {
        this.source = source;
    }

    List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (pos >= source.length()) {
                tokens.add(new Token(TokenType.EOF, "", null, pos));
                return tokens;
            }
            tokens.add(next());
        }
    }

    private Token next() {
        int start = pos;
        char c = source.charAt(pos);
        switch (c) {
            case '.' -> {
                pos++;
                return new Token(TokenType.DOT, ".", null, start);
            }
            case '(' -> {
                pos++;
                return new Token(TokenType.LPAREN, "(", null, start);
            }
            case ')' -> {
                pos++;
                return new Token(TokenType.RPAREN, ")", null, start);
            }
            case '\'', '"' -> {
                return string(c);
            }
            default -> {
                // operators, literals and identifiers below
            }
        }
        if (matches("==")) {
            return operator(TokenType.EQ, "==", start);
        }
        if (matches("!=")) {
            return operator(TokenType.NEQ, "!=", start);
        }
        if (matches("&&")) {
            return operator(TokenType.AND, "&&", start);
        }
        if (matches("||")) {
            return operator(TokenType.OR, "||", start);
        }
        if (matches("??")) {
            return operator(TokenType.COALESCE, "??", start);
        }
        if (c == '!') {
            pos++;
            return new Token(TokenType.NOT, "!", null, start);
        }
        if (Character.isDigit(c) || (c == '-' && pos + 1 < source.length()
                && Character.isDigit(source.charAt(pos + 1)))) {
            return number();
        }
        if (Character.isLetter(c) || c == '_') {
            return identifier();
        }
        throw new PredicateSyntaxException("Unexpected character '" + c + "'", source, start);
    }

    private Token string(char quote) {
        int start = pos;
        pos++;
        StringBuilder sb = new StringBuilder();
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '\\' && pos + 1 < source.length()) {
                char escaped = source.charAt(pos + 1);
                if (escaped == '\'' || escaped == '"' || escaped == '\\') {
                    sb.append(escaped);
                    pos += 2;
                    continue;
                }
                throw new PredicateSyntaxException("Unsupported escape '\\" + escaped + "'", source, pos);
            }
            if (c == quote) {
                pos++;
                return new Token(TokenType.STRING, source.substring(start, pos), sb.toString(), start);
            }
            sb.append(c);
            pos++;
        }
        throw new PredicateSyntaxException("Unterminated string literal", source, start);
    }

    private Token number() {
        int start = pos;
        if (source.charAt(pos) == '-') {
            pos++;
        }
        while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
            pos++;
        }
        // a dot followed by a digit is a fraction; otherwise it is left for the parser
        if (pos + 1 < source.length() && source.charAt(pos) == '.' && Character.isDigit(source.charAt(pos + 1))) {
            pos++;
            while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                pos++;
            }
        }
        String text = source.substring(start, pos);
        return new Token(TokenType.NUMBER, text, new BigDecimal(text), start);
    }

    private Token identifier() {
        int start = pos;
        while (pos < source.length()
                && (Character.isLetterOrDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
            pos++;
        }
        String text = source.substring(start, pos);
        return switch (text) {
            case "true" -> new Token(TokenType.TRUE, text, Boolean.TRUE, start);
            case "false" -> new Token(TokenType.FALSE, text, Boolean.FALSE, start);
            case "null" -> new Token(TokenType.NULL, text, null, start);
            default -> new Token(TokenType.IDENT, text, null, start);
        };
    }

    private Token operator(TokenType type, String text, int start) {
        pos += text.length();
        return new Token(type, text, null, start);
    }

    private boolean matches(String op) {
        return source.startsWith(op, pos);
    }

    private void skipWhitespace() {
        while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
    }
}
