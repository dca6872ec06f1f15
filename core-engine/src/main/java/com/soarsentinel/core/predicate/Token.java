package com.soarsentinel.core.predicate;

/**
 * Lexical token with its literal value (for strings and numbers) and source
 * offset.
 */
final class Token {

    private final TokenType type;
    private final String text;
    private final Object value;
    private final int position;

    Token(TokenType type, String text, Object value, int position) {
        this.type = type;
        this.text = text;
        this.value = value;
        this.position = position;
    }

    TokenType type() {
        return type;
    }

    String text() {
        return text;
    }

    Object value() {
        return value;
    }

    int position() {
        return position;
    }

    boolean is(TokenType candidate) {
        return type == candidate;
    }

    @Override
    public String toString() {
        return type == TokenType.EOF ? "end of input" : "'" + text + "'";
    }
}
