package com.proxymirror;

/**
 * A lexed token. {@code start} is the character offset, {@code line} and
 * {@code column} are 1-based.
 */
public record Token(
    TokenType type,
    String text,
    int start,
    int line,
    int column
) {
    public int end() {
        return start + text.length();
    }

    public boolean is(TokenType type, String text) {
        return this.type == type && this.text.equals(text);
    }

    public boolean isKeyword(String keyword) {
        return is(TokenType.KEYWORD, keyword);
    }

    /**
     * True for identifiers spelled {@code word}; soft keywords lex as identifiers.
     */
    public boolean isSoftKeyword(String word) {
        return is(TokenType.IDENTIFIER, word);
    }

    @Override
    public String toString() {
        return type + "('" + text + "') at " + line + ":" + column;
    }
}
