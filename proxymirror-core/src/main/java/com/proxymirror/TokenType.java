package com.proxymirror;

public enum TokenType {
    // Trivia
    WHITE_SPACE,
    LINE_COMMENT,
    BLOCK_COMMENT,

    IDENTIFIER,
    KEYWORD,

    // Literals
    STRING,
    CHAR,
    NUMBER,

    // Punctuation with structural meaning
    LBRACE,
    RBRACE,
    LPAREN,
    RPAREN,
    LBRACKET,
    RBRACKET,
    LT,
    GT,
    COMMA,
    DOT,
    SEMICOLON,
    COLON,
    COLONCOLON,
    QUEST,
    SAFE_ACCESS,    // ?.
    ELVIS,          // ?:
    EQ,
    ARROW,          // ->
    AT,

    // Any other operator
    OPERATOR,

    EOF;

    public boolean isTrivia() {
        return this == WHITE_SPACE || this == LINE_COMMENT || this == BLOCK_COMMENT;
    }
}
