package com.proxymirror;

/**
 * Thrown by the parser when it finds a token other than the construct it needs.
 */
public class ExpectedTokenException extends ParseException {

    private final transient Token actual;

    public ExpectedTokenException(String expected, Token actual) {
        super("Expected " + expected + " but found " + describe(actual), actual.line(), actual.column());
        this.actual = actual;
    }

    public Token getActual() {
        return actual;
    }

    private static String describe(Token token) {
        return token.type() == TokenType.EOF ? "end of file" : "'" + token.text() + "'";
    }
}
