package com.numu.script.parser;

public enum TokenType {
    // Single-character tokens.
    PLUS, MINUS, STAR, SLASH, PERCENT, CARET,
    EQUAL, LESS, GREATER, BANG,
    LEFT_PAREN, RIGHT_PAREN, LEFT_BRACKET, RIGHT_BRACKET, LEFT_BRACE, RIGHT_BRACE,
    COMMA, DOT, COLON, SEMICOLON,

    // Two-character operators.
    EQUAL_EQUAL, BANG_EQUAL, LESS_EQUAL, GREATER_EQUAL, ARROW, STAR_STAR, AND_AND, OR_OR,

    // Literals.
    IDENTIFIER, STRING, NUMBER,

    // Keywords.
    LET, FN, IF, ELSE, FOR, WHILE, RETURN, TRUE, FALSE, INF, NAN, PI, E,

    EOF
}
