package com.soarsentinel.core.predicate;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser producing an {@link Expression} tree.
 *
 * <pre>
 * expr     := or
 * or       := and ( "||" and )*
 * and      := unary ( "&amp;&amp;" unary )*
 * unary    := "!" unary | compare
 * compare  := coalesce ( ( "==" | "!=" ) coalesce )?
 * coalesce := primary ( "??" primary )*
 * primary  := literal | path ( "." "contains" "(" coalesce ")" )? | "(" expr ")"
 * path     := IDENT ( "." IDENT )*
 * </pre>
 */
final class PredicateParser {

    static final int MAX_LENGTH = 2048;
    static final int MAX_DEPTH = 32;

    private static final String CONTAINS = "contains";

    private final String source;
    private final List<Token> tokens;
    private int index;
    private int depth;

    private PredicateParser(String source, List<Token> tokens) {
        this.source = source;
        this.tokens = tokens;
    }

    static Expression parse(String source) {
        if (source == null || source.isBlank()) {
            throw new PredicateSyntaxException("Predicate is empty", String.valueOf(source), 0);
        }
        if (source.length() > MAX_LENGTH) {
            throw new PredicateSyntaxException(
                    "Predicate exceeds " + MAX_LENGTH + " characters", source, MAX_LENGTH);
        }
        PredicateParser parser = new PredicateParser(source, new PredicateLexer(source).tokenize());
        Expression expression = parser.or();
        parser.expect(TokenType.EOF, "end of input");
        return expression;
    }

    private Expression or() {
        Expression left = and();
        while (accept(TokenType.OR)) {
            left = new Expression.Or(left, and());
        }
        return left;
    }

    private Expression and() {
        Expression left = unary();
        while (accept(TokenType.AND)) {
            left = new Expression.And(left, unary());
        }
        return left;
    }

    private Expression unary() {
        if (peek().is(TokenType.NOT)) {
            Token not = advance();
            enter(not);
            try {
                return new Expression.Not(unary());
            } finally {
                depth--;
            }
        }
        return compare();
    }

    private Expression compare() {
        Expression left = coalesce();
        if (accept(TokenType.EQ)) {
            return new Expression.Comparison(left, coalesce(), false);
        }
        if (accept(TokenType.NEQ)) {
            return new Expression.Comparison(left, coalesce(), true);
        }
        return left;
    }

    private Expression coalesce() {
        Expression left = primary();
        while (accept(TokenType.COALESCE)) {
            left = new Expression.Coalesce(left, primary());
        }
        return left;
    }

    private Expression primary() {
        Token token = peek();
        switch (token.type()) {
            case STRING, NUMBER, TRUE, FALSE, NULL -> {
                advance();
                return new Expression.Literal(token.value());
            }
            case LPAREN -> {
                advance();
                enter(token);
                try {
                    Expression inner = or();
                    expect(TokenType.RPAREN, "')'");
                    return inner;
                } finally {
                    depth--;
                }
            }
            case IDENT -> {
                return pathOrContains();
            }
            default -> throw error("Expected a field, literal or '(' but found " + token, token);
        }
    }

    private Expression pathOrContains() {
        List<String> segments = new ArrayList<>();
        segments.add(advance().text());
        while (peek().is(TokenType.DOT)) {
            Token dot = advance();
            Token segment = peek();
            if (segment.is(TokenType.IDENT)) {
                advance();
                if (CONTAINS.equals(segment.text()) && peek().is(TokenType.LPAREN)) {
                    Token open = advance();
                    enter(open);
                    try {
                        Expression element = coalesce();
                        expect(TokenType.RPAREN, "')'");
                        return new Expression.Contains(new Expression.FieldRef(segments), element);
                    } finally {
                        depth--;
                    }
                }
                segments.add(segment.text());
            } else if (segment.is(TokenType.NUMBER) && isIndex(segment)) {
                // list index such as hosts.0
                advance();
                segments.add(segment.text());
            } else {
                throw error("Expected a field name after '.'", dot);
            }
        }
        return new Expression.FieldRef(segments);
    }

    private static boolean isIndex(Token token) {
        return token.text().chars().allMatch(Character::isDigit);
    }

    // ---------------------------------------------------------------
    // Token helpers
    // ---------------------------------------------------------------

    private void enter(Token token) {
        if (++depth > MAX_DEPTH) {
            throw error("Predicate nesting exceeds " + MAX_DEPTH + " levels", token);
        }
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token advance() {
        Token token = tokens.get(index);
        if (!token.is(TokenType.EOF)) {
            index++;
        }
        return token;
    }

    private boolean accept(TokenType type) {
        if (peek().is(type)) {
            advance();
            return true;
        }
        return false;
    }

    private void expect(TokenType type, String description) {
        Token token = peek();
        if (!token.is(type)) {
            throw error("Expected " + description + " but found " + token, token);
        }
        advance();
    }

    private PredicateSyntaxException error(String message, Token token) {
        return new PredicateSyntaxException(message, source, token.position());
    }
}
