package com.proxymirror;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Splits source text into tokens, keeping whitespace and comments so the parser can
 * build a tree that reproduces the input exactly.
 */
public class Lexer {

    private static final Set<String> KEYWORDS = Set.of(
        "package", "import", "class", "interface", "object", "fun", "val", "var", "typealias",
        "this", "super", "null", "true", "false", "is", "in", "as",
        "if", "else", "when", "try", "catch", "finally", "for", "while", "do",
        "return", "throw", "break", "continue"
    );

    // Longest first
    private static final String[] OPERATORS = {
        "===", "!==", "..<",
        "?.", "?:", "::", "->", "=>", "..", "==", "!=", "<=", ">=", "&&", "||",
        "++", "--", "+=", "-=", "*=", "/=", "%=", "!!"
    };

    private final String source;
    private int pos = 0;
    private int line = 1;
    private int column = 1;

    public Lexer(String source) {
        this.source = source;
    }

    public static List<Token> tokenize(String source) {
        return new Lexer(source).tokenize();
    }

    /**
     * Returns every token of the source, terminated by a single {@link TokenType#EOF}.
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (pos < source.length()) {
            tokens.add(nextToken());
        }
        tokens.add(new Token(TokenType.EOF, "", pos, line, column));
        return tokens;
    }

    private Token nextToken() {
        int start = pos;
        int startLine = line;
        int startColumn = column;
        char c = source.charAt(pos);
        TokenType type;

        if (isWhitespace(c)) {
            while (pos < source.length() && isWhitespace(source.charAt(pos))) {
                advance();
            }
            type = TokenType.WHITE_SPACE;
        } else if (source.startsWith("//", pos)) {
            while (pos < source.length() && source.charAt(pos) != '\n') {
                advance();
            }
            type = TokenType.LINE_COMMENT;
        } else if (source.startsWith("/*", pos)) {
            blockComment(startLine, startColumn);
            type = TokenType.BLOCK_COMMENT;
        } else if (c == '`') {
            quotedIdentifier(startLine, startColumn);
            type = TokenType.IDENTIFIER;
        } else if (isIdentifierStart(c)) {
            while (pos < source.length() && isIdentifierPart(source.charAt(pos))) {
                advance();
            }
            type = KEYWORDS.contains(source.substring(start, pos)) ? TokenType.KEYWORD : TokenType.IDENTIFIER;
        } else if (Character.isDigit(c)) {
            number();
            type = TokenType.NUMBER;
        } else if (c == '"') {
            string(startLine, startColumn);
            type = TokenType.STRING;
        } else if (c == '\'') {
            charLiteral(startLine, startColumn);
            type = TokenType.CHAR;
        } else {
            type = operator(startLine, startColumn);
        }

        return new Token(type, source.substring(start, pos), start, startLine, startColumn);
    }

    private void blockComment(int startLine, int startColumn) {
        advance();
        advance();
        // Block comments nest
        int depth = 1;
        while (depth > 0) {
            if (pos >= source.length()) {
                throw new ParseException("Unterminated comment", startLine, startColumn);
            }
            if (source.startsWith("/*", pos)) {
                advance();
                advance();
                depth++;
            } else if (source.startsWith("*/", pos)) {
                advance();
                advance();
                depth--;
            } else {
                advance();
            }
        }
    }

    private void quotedIdentifier(int startLine, int startColumn) {
        advance();
        while (pos < source.length() && source.charAt(pos) != '`' && source.charAt(pos) != '\n') {
            advance();
        }
        if (pos >= source.length() || source.charAt(pos) != '`') {
            throw new ParseException("Unterminated quoted identifier", startLine, startColumn);
        }
        advance();
    }

    private void number() {
        boolean hex = source.startsWith("0x", pos) || source.startsWith("0X", pos);
        boolean seenDot = false;
        char previous = 0;
        while (pos < source.length()) {
            char ch = source.charAt(pos);
            if (Character.isLetterOrDigit(ch) || ch == '_') {
                advance();
            } else if (ch == '.' && !hex && !seenDot
                    && pos + 1 < source.length() && Character.isDigit(source.charAt(pos + 1))) {
                seenDot = true;
                advance();
            } else if ((ch == '+' || ch == '-') && !hex && (previous == 'e' || previous == 'E')) {
                advance();
            } else {
                break;
            }
            previous = ch;
        }
    }

    private void string(int startLine, int startColumn) {
        if (source.startsWith("\"\"\"", pos)) {
            rawString(startLine, startColumn);
            return;
        }
        advance();
        while (true) {
            if (pos >= source.length() || source.charAt(pos) == '\n') {
                throw new ParseException("Unterminated string literal", startLine, startColumn);
            }
            char ch = source.charAt(pos);
            if (ch == '\\') {
                advance();
                if (pos < source.length() && source.charAt(pos) != '\n') {
                    advance();
                }
            } else if (ch == '"') {
                advance();
                return;
            } else if (source.startsWith("${", pos)) {
                advance();
                advance();
                template(startLine, startColumn);
            } else {
                advance();
            }
        }
    }

    private void rawString(int startLine, int startColumn) {
        advance();
        advance();
        advance();
        while (true) {
            if (pos >= source.length()) {
                throw new ParseException("Unterminated raw string literal", startLine, startColumn);
            }
            if (source.startsWith("\"\"\"", pos)) {
                advance();
                advance();
                advance();
                // """a"""" ends with the last three quotes
                while (pos < source.length() && source.charAt(pos) == '"') {
                    advance();
                }
                return;
            }
            if (source.startsWith("${", pos)) {
                advance();
                advance();
                template(startLine, startColumn);
            } else {
                advance();
            }
        }
    }

    /**
     * Skips the body of a {@code ${...}} template entry, positioned after the opening brace.
     */
    private void template(int startLine, int startColumn) {
        int depth = 1;
        while (depth > 0) {
            if (pos >= source.length()) {
                throw new ParseException("Unterminated string template", startLine, startColumn);
            }
            char ch = source.charAt(pos);
            if (ch == '"') {
                string(line, column);
                continue;
            }
            if (ch == '\'') {
                charLiteral(line, column);
                continue;
            }
            if (ch == '{') {
                depth++;
            } else if (ch == '}') {
                depth--;
            }
            advance();
        }
    }

    private void charLiteral(int startLine, int startColumn) {
        advance();
        while (true) {
            if (pos >= source.length() || source.charAt(pos) == '\n') {
                throw new ParseException("Unterminated character literal", startLine, startColumn);
            }
            char ch = source.charAt(pos);
            advance();
            if (ch == '\\') {
                if (pos < source.length() && source.charAt(pos) != '\n') {
                    advance();
                }
            } else if (ch == '\'') {
                return;
            }
        }
    }

    private TokenType operator(int startLine, int startColumn) {
        for (String op : OPERATORS) {
            if (source.startsWith(op, pos)) {
                for (int i = 0; i < op.length(); i++) {
                    advance();
                }
                return switch (op) {
                    case "?." -> TokenType.SAFE_ACCESS;
                    case "?:" -> TokenType.ELVIS;
                    case "::" -> TokenType.COLONCOLON;
                    case "->" -> TokenType.ARROW;
                    default -> TokenType.OPERATOR;
                };
            }
        }

        char c = source.charAt(pos);
        TokenType type = switch (c) {
            case '{' -> TokenType.LBRACE;
            case '}' -> TokenType.RBRACE;
            case '(' -> TokenType.LPAREN;
            case ')' -> TokenType.RPAREN;
            case '[' -> TokenType.LBRACKET;
            case ']' -> TokenType.RBRACKET;
            case '<' -> TokenType.LT;
            case '>' -> TokenType.GT;
            case ',' -> TokenType.COMMA;
            case '.' -> TokenType.DOT;
            case ';' -> TokenType.SEMICOLON;
            case ':' -> TokenType.COLON;
            case '?' -> TokenType.QUEST;
            case '=' -> TokenType.EQ;
            case '@' -> TokenType.AT;
            case '+', '-', '*', '/', '%', '!', '&', '|', '^', '~', '#', '$' -> TokenType.OPERATOR;
            default -> throw new ParseException("Unexpected character '" + c + "'", startLine, startColumn);
        };
        advance();
        return type;
    }

    private void advance() {
        char ch = source.charAt(pos++);
        if (ch == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
    }

    private static boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f';
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
