package com.soarsentinel.core.predicate;

enum TokenType {
    IDENT,
    STRING,
    NUMBER,
    TRUE,
    FALSE,
    NULL,
    DOT,
    LPAREN,
    RPAREN,
    EQ,
    NEQ,
    AND,
    OR,
    NOT,
    COALESCE,
    EOF
}
