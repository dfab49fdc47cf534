package com.elara.pine.parser;

public enum TokenType {
    // Single-character tokens
    LEFT_PAREN, RIGHT_PAREN, LEFT_BRACE, RIGHT_BRACE, LEFT_BRACKET, RIGHT_BRACKET,
    COMMA, DOT, COLON, QUESTION,
    PLUS, MINUS, STAR, SLASH, PERCENT,

    // One or two character tokens
    PLUS_EQUAL, MINUS_EQUAL, STAR_EQUAL, SLASH_EQUAL, PERCENT_EQUAL,
    EQUAL, EQUAL_EQUAL, BANG_EQUAL, COLON_EQUAL, ARROW,
    LESS, LESS_EQUAL, GREATER, GREATER_EQUAL,

    // Logical operators ('and' / '&&', 'or' / '||', 'not' / '!')
    AND, OR, NOT,

    // Literals
    IDENTIFIER, STRING, NUMBER,

    // Keywords
    IF, ELSE, FOR, WHILE, SWITCH, BREAK, CONTINUE, VAR, VARIP, EXPORT, IMPORT,

    // Layout
    COMMENT, NEWLINE, INDENT, DEDENT, EOF
}
