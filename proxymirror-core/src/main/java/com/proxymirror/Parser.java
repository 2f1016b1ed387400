package com.proxymirror;

import com.proxymirror.ast.*;

import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser producing a lossless syntax tree.
 *
 * <p>Declarations (package, imports, classes, objects, properties, functions,
 * constructors) are parsed structurally. Expression and statement interiors are kept
 * as flat token runs, except object literals, which are parsed into
 * {@link ObjectLiteralExpression} nodes.</p>
 *
 * <p>Whitespace and comments between the tokens of a node belong to that node;
 * whitespace before a node's first token belongs to the enclosing node.</p>
 */
public class Parser {

    private static final Set<String> MODIFIERS = Set.of(
        "public", "private", "protected", "internal",
        "override", "open", "final", "abstract", "sealed",
        "data", "enum", "inner", "value", "annotation", "companion",
        "lateinit", "const", "inline", "suspend", "tailrec", "operator", "infix", "external",
        "vararg", "noinline", "crossinline", "reified", "expect", "actual"
    );

    private static final Set<String> DECLARATION_KEYWORDS = Set.of(
        "class", "interface", "object", "fun", "val", "var", "typealias"
    );

    // Keywords that keep an expression going when they start the next line
    private static final Set<String> CONTINUATION_KEYWORDS = Set.of("else", "catch", "finally");

    // Keywords after which an expression always continues on the next line
    private static final Set<String> OPEN_KEYWORDS = Set.of("else", "in", "is", "as");

    private static final Set<String> POSTFIX_OPERATORS = Set.of("++", "--", "!!");

    private final List<Token> tokens;
    private int current = 0;
    private Token previous = null;

    private Parser(String source) {
        this.tokens = Lexer.tokenize(source);
    }

    public static SourceFile parse(String source) {
        return new Parser(source).parseFile();
    }

    /**
     * Parses a single declaration and returns it detached from any tree.
     *
     * @throws ParseException if the text is not exactly one declaration
     */
    public static SyntaxNode parseDeclaration(String source) {
        Parser parser = new Parser(source.strip());
        if (parser.declarationKeywordIndex() < 0) {
            throw new ExpectedTokenException("declaration", parser.peek());
        }
        CompositeElement holder = CompositeElement.create(NodeKind.FILE);
        parser.parseDeclaration(holder);
        Token rest = parser.peek();
        if (rest.type() != TokenType.EOF) {
            throw new ExpectedTokenException("end of declaration", rest);
        }
        SyntaxNode declaration = holder.firstChild();
        holder.removeChild(declaration);
        return declaration;
    }

    // ========================================================================
    // File level
    // ========================================================================

    private SourceFile parseFile() {
        SourceFile file = (SourceFile) CompositeElement.create(NodeKind.FILE);
        while (peek().type() != TokenType.EOF) {
            parseTopLevel(file);
        }
        trivia(file);
        return file;
    }

    private void parseTopLevel(CompositeElement parent) {
        Token next = peek();
        if (next.isKeyword("package")) {
            parsePackageDirective(parent);
        } else if (next.isKeyword("import")) {
            parseImportList(parent);
        } else if (next.type() == TokenType.SEMICOLON) {
            take(parent);
        } else if (declarationKeywordIndex() >= 0) {
            parseDeclaration(parent);
        } else {
            parseStatement(parent);
        }
    }

    private void parsePackageDirective(CompositeElement parent) {
        CompositeElement directive = begin(parent, NodeKind.PACKAGE_DIRECTIVE);
        take(directive, NodeKind.KEYWORD);
        expect(directive, TokenType.IDENTIFIER, NodeKind.IDENTIFIER, "package name");
        while (peek().type() == TokenType.DOT && !newlineBeforeNext()) {
            take(directive);
            expect(directive, TokenType.IDENTIFIER, NodeKind.IDENTIFIER, "package name");
        }
    }

    private void parseImportList(CompositeElement parent) {
        CompositeElement list = begin(parent, NodeKind.IMPORT_LIST);
        do {
            parseImport(list);
        } while (peek().isKeyword("import"));
    }

    private void parseImport(CompositeElement list) {
        CompositeElement directive = begin(list, NodeKind.IMPORT_DIRECTIVE);
        take(directive, NodeKind.KEYWORD);
        expect(directive, TokenType.IDENTIFIER, NodeKind.IDENTIFIER, "import path");
        while (peek().type() == TokenType.DOT && !newlineBeforeNext()) {
            take(directive);
            if (peek().is(TokenType.OPERATOR, "*")) {
                take(directive);
                return;
            }
            expect(directive, TokenType.IDENTIFIER, NodeKind.IDENTIFIER, "import path");
        }
        if (peek().isKeyword("as") && !newlineBeforeNext()) {
            take(directive, NodeKind.KEYWORD);
            expect(directive, TokenType.IDENTIFIER, NodeKind.IDENTIFIER, "import alias");
        }
    }

    // ========================================================================
    // Declarations
    // ========================================================================

    /**
     * Looks past modifiers and annotations for the keyword that starts a declaration.
     *
     * @return the token index of that keyword, or -1 if the upcoming tokens do not
     *         start a declaration
     */
    private int declarationKeywordIndex() {
        int i = significantIndex(current);
        while (true) {
            Token token = tokens.get(i);
            if (token.type() == TokenType.AT) {
                i = skipAnnotation(i);
                if (i < 0) {
                    return -1;
                }
                continue;
            }
            if (token.type() == TokenType.KEYWORD && DECLARATION_KEYWORDS.contains(token.text())) {
                return i;
            }
            if (token.type() == TokenType.IDENTIFIER) {
                TokenType following = tokens.get(significantIndex(i + 1)).type();
                if (token.text().equals("constructor") && following == TokenType.LPAREN) {
                    return i;
                }
                if (token.text().equals("init") && following == TokenType.LBRACE) {
                    return i;
                }
                if (MODIFIERS.contains(token.text())) {
                    i = significantIndex(i + 1);
                    continue;
                }
            }
            return -1;
        }
    }

    private void parseDeclaration(CompositeElement parent) {
        int keywordIndex = declarationKeywordIndex();
        Token keyword = tokens.get(keywordIndex);
        NodeKind kind = switch (keyword.text()) {
            case "class", "interface" -> NodeKind.CLASS;
            case "object" -> NodeKind.OBJECT_DECLARATION;
            case "fun" -> NodeKind.FUNCTION;
            case "val", "var" -> NodeKind.PROPERTY;
            case "typealias" -> NodeKind.TYPEALIAS;
            case "constructor" -> NodeKind.SECONDARY_CONSTRUCTOR;
            case "init" -> NodeKind.CLASS_INITIALIZER;
            default -> throw new ExpectedTokenException("declaration", keyword);
        };

        CompositeElement declaration = begin(parent, kind);
        if (significantIndex(current) < keywordIndex) {
            parseModifierList(declaration, keywordIndex);
        }

        switch (kind) {
            case CLASS -> parseClassRest(declaration);
            case OBJECT_DECLARATION -> parseObjectRest(declaration);
            case FUNCTION -> parseFunctionRest(declaration);
            case PROPERTY -> parsePropertyRest(declaration);
            case TYPEALIAS -> parseTypeAliasRest(declaration);
            case SECONDARY_CONSTRUCTOR -> parseSecondaryConstructorRest(declaration);
            case CLASS_INITIALIZER -> parseInitializerRest(declaration);
            default -> throw new IllegalStateException("Unhandled declaration kind " + kind);
        }
    }

    private void parseModifierList(CompositeElement declaration, int keywordIndex) {
        CompositeElement modifiers = begin(declaration, NodeKind.MODIFIER_LIST);
        while (significantIndex(current) < keywordIndex) {
            if (peek().type() == TokenType.AT) {
                parseAnnotation(modifiers);
            } else {
                take(modifiers, NodeKind.KEYWORD);
            }
        }
    }

    private void parseAnnotation(CompositeElement parent) {
        CompositeElement annotation = begin(parent, NodeKind.ANNOTATION_ENTRY);
        take(annotation);
        expect(annotation, TokenType.IDENTIFIER, NodeKind.IDENTIFIER, "annotation name");
        // Use-site target, as in @field:Inject
        if (tokens.get(current).type() == TokenType.COLON && tokens.get(current + 1).type() == TokenType.IDENTIFIER) {
            take(annotation);
            take(annotation, NodeKind.IDENTIFIER);
        }
        while (tokens.get(current).type() == TokenType.DOT && tokens.get(current + 1).type() == TokenType.IDENTIFIER) {
            take(annotation);
            take(annotation, NodeKind.IDENTIFIER);
        }
        if (tokens.get(current).type() == TokenType.LPAREN) {
            takeBalanced(annotation);
        }
    }

    /**
     * Mirrors {@link #parseAnnotation} without consuming anything.
     *
     * @return index of the first significant token after the annotation, or -1
     */
    private int skipAnnotation(int at) {
        int i = at + 1;
        if (tokens.get(i).type() != TokenType.IDENTIFIER) {
            return -1;
        }
        i++;
        if (tokens.get(i).type() == TokenType.COLON && tokens.get(i + 1).type() == TokenType.IDENTIFIER) {
            i += 2;
        }
        while (tokens.get(i).type() == TokenType.DOT && tokens.get(i + 1).type() == TokenType.IDENTIFIER) {
            i += 2;
        }
        if (tokens.get(i).type() == TokenType.LPAREN) {
            i = matchingClose(i);
            if (i < 0) {
                return -1;
            }
            i++;
        }
        return significantIndex(i);
    }

    private void parseClassRest(CompositeElement declaration) {
        take(declaration, NodeKind.KEYWORD);
        if (peek().type() == TokenType.IDENTIFIER) {
            take(declaration, NodeKind.IDENTIFIER);
        }
        if (peek().type() == TokenType.LT) {
            takeAngles(begin(declaration, NodeKind.TYPE_PARAMETER_LIST));
        }
        if (peek().type() == TokenType.LPAREN) {
            takeBalanced(begin(declaration, NodeKind.PRIMARY_CONSTRUCTOR));
        } else if (primaryConstructorAhead()) {
            CompositeElement constructor = begin(declaration, NodeKind.PRIMARY_CONSTRUCTOR);
            CompositeElement modifiers = null;
            while (!peek().isSoftKeyword("constructor")) {
                if (modifiers == null) {
                    modifiers = begin(constructor, NodeKind.MODIFIER_LIST);
                }
                if (peek().type() == TokenType.AT) {
                    parseAnnotation(modifiers);
                } else {
                    take(modifiers, NodeKind.KEYWORD);
                }
            }
            take(constructor, NodeKind.KEYWORD);
            if (peek().type() == TokenType.LPAREN) {
                takeBalanced(constructor);
            }
        }
        if (peek().type() == TokenType.COLON) {
            take(declaration);
            parseSuperTypeList(declaration);
        }
        if (peek().type() == TokenType.LBRACE) {
            parseClassBody(declaration);
        }
    }

    private boolean primaryConstructorAhead() {
        int i = significantIndex(current);
        while (true) {
            Token token = tokens.get(i);
            if (token.isSoftKeyword("constructor")) {
                return true;
            }
            if (token.type() == TokenType.AT) {
                i = skipAnnotation(i);
                if (i < 0) {
                    return false;
                }
            } else if (token.type() == TokenType.IDENTIFIER && MODIFIERS.contains(token.text())) {
                i = significantIndex(i + 1);
            } else {
                return false;
            }
        }
    }

    private void parseObjectRest(CompositeElement declaration) {
        take(declaration, NodeKind.KEYWORD);
        if (peek().type() == TokenType.IDENTIFIER) {
            take(declaration, NodeKind.IDENTIFIER);
        }
        if (peek().type() == TokenType.COLON) {
            take(declaration);
            parseSuperTypeList(declaration);
        }
        if (peek().type() == TokenType.LBRACE) {
            parseClassBody(declaration);
        }
    }

    private void parseSuperTypeList(CompositeElement declaration) {
        CompositeElement list = begin(declaration, NodeKind.SUPER_TYPE_LIST);
        while (true) {
            parseTypeTokens(list);
            if (peek().type() == TokenType.LPAREN && !hasTriviaBeforeNext()) {
                takeBalanced(list);
            }
            if (peek().isSoftKeyword("by")) {
                take(list, NodeKind.KEYWORD);
                parseExpressionUnits(list, false, true);
            }
            if (peek().type() != TokenType.COMMA) {
                return;
            }
            take(list);
        }
    }

    private ClassBody parseClassBody(CompositeElement owner) {
        ClassBody body = (ClassBody) begin(owner, NodeKind.CLASS_BODY);
        expect(body, TokenType.LBRACE, NodeKind.LBRACE, "'{'");
        while (true) {
            Token next = peek();
            switch (next.type()) {
                case RBRACE -> {
                    take(body, NodeKind.RBRACE);
                    return body;
                }
                case EOF -> throw new ExpectedTokenException("'}'", next);
                case SEMICOLON, COMMA -> take(body);
                default -> {
                    if (declarationKeywordIndex() >= 0) {
                        parseDeclaration(body);
                    } else {
                        parseStatement(body);
                    }
                }
            }
        }
    }

    private void parsePropertyRest(CompositeElement property) {
        take(property, NodeKind.KEYWORD);
        if (peek().type() == TokenType.LT) {
            takeAngles(begin(property, NodeKind.TYPE_PARAMETER_LIST));
        }
        if (peek().type() == TokenType.LPAREN) {
            // Destructuring declaration
            takeBalanced(begin(property, NodeKind.EXPRESSION));
        } else {
            parseReceiverAndName(property, "property name");
        }
        if (peek().type() == TokenType.COLON) {
            take(property);
            parseTypeTokens(begin(property, NodeKind.TYPE_REFERENCE));
        }
        if (peek().type() == TokenType.EQ) {
            take(property);
            parseExpression(property);
        } else if (peek().isSoftKeyword("by")) {
            CompositeElement delegate = begin(property, NodeKind.PROPERTY_DELEGATE);
            take(delegate, NodeKind.KEYWORD);
            parseExpression(delegate);
        }
        while (accessorAhead()) {
            parseAccessor(property);
        }
    }

    /**
     * Parses {@code Receiver.name} or {@code name}. The receiver becomes a type
     * reference so that the only identifier directly under the declaration is its name.
     */
    private void parseReceiverAndName(CompositeElement declaration, String what) {
        int receiverDot = receiverDotIndex();
        if (receiverDot >= 0) {
            CompositeElement receiver = begin(declaration, NodeKind.TYPE_REFERENCE);
            while (significantIndex(current) < receiverDot) {
                if (peek().type() == TokenType.LT) {
                    takeAngles(receiver);
                } else {
                    take(receiver);
                }
            }
            take(declaration);
        }
        expect(declaration, TokenType.IDENTIFIER, NodeKind.IDENTIFIER, what);
    }

    /**
     * Index of the dot separating a receiver type from the declared name, or -1.
     */
    private int receiverDotIndex() {
        int i = significantIndex(current);
        int lastDot = -1;
        while (tokens.get(i).type() == TokenType.IDENTIFIER) {
            i = significantIndex(i + 1);
            if (tokens.get(i).type() == TokenType.LT) {
                int close = closingAngle(i);
                if (close < 0) {
                    return -1;
                }
                i = significantIndex(close + 1);
            }
            if (tokens.get(i).type() == TokenType.QUEST) {
                i = significantIndex(i + 1);
            }
            if (tokens.get(i).type() != TokenType.DOT) {
                break;
            }
            lastDot = i;
            i = significantIndex(i + 1);
        }
        if (lastDot >= 0 && tokens.get(significantIndex(lastDot + 1)).type() == TokenType.IDENTIFIER) {
            return lastDot;
        }
        return -1;
    }

    private int closingAngle(int open) {
        int depth = 0;
        for (int i = open; i < tokens.size(); i++) {
            switch (tokens.get(i).type()) {
                case LT -> depth++;
                case GT -> {
                    depth--;
                    if (depth == 0) {
                        return i;
                    }
                }
                case EOF, LBRACE, RBRACE, SEMICOLON -> {
                    return -1;
                }
                default -> {
                }
            }
        }
        return -1;
    }

    private boolean accessorAhead() {
        int i = significantIndex(current);
        boolean modified = false;
        while (true) {
            Token token = tokens.get(i);
            if (token.isSoftKeyword("get") || token.isSoftKeyword("set")) {
                return modified || tokens.get(significantIndex(i + 1)).type() == TokenType.LPAREN;
            }
            if (token.type() == TokenType.AT) {
                i = skipAnnotation(i);
                if (i < 0) {
                    return false;
                }
            } else if (token.type() == TokenType.IDENTIFIER && MODIFIERS.contains(token.text())) {
                i = significantIndex(i + 1);
            } else {
                return false;
            }
            modified = true;
        }
    }

    private void parseAccessor(CompositeElement property) {
        CompositeElement accessor = begin(property, NodeKind.PROPERTY_ACCESSOR);
        if (!peek().isSoftKeyword("get") && !peek().isSoftKeyword("set")) {
            CompositeElement modifiers = begin(accessor, NodeKind.MODIFIER_LIST);
            while (!peek().isSoftKeyword("get") && !peek().isSoftKeyword("set")) {
                if (peek().type() == TokenType.AT) {
                    parseAnnotation(modifiers);
                } else {
                    take(modifiers, NodeKind.KEYWORD);
                }
            }
        }
        take(accessor, NodeKind.KEYWORD);
        if (peek().type() == TokenType.LPAREN && !newlineBeforeNext()) {
            takeBalanced(accessor);
        } else {
            return;
        }
        if (peek().type() == TokenType.COLON) {
            take(accessor);
            parseTypeTokens(begin(accessor, NodeKind.TYPE_REFERENCE));
        }
        if (peek().type() == TokenType.EQ) {
            take(accessor);
            parseExpression(accessor);
        } else if (peek().type() == TokenType.LBRACE) {
            parseBlock(accessor);
        }
    }

    private void parseFunctionRest(CompositeElement function) {
        take(function, NodeKind.KEYWORD);
        if (peek().type() == TokenType.LT) {
            takeAngles(begin(function, NodeKind.TYPE_PARAMETER_LIST));
        }
        parseReceiverAndName(function, "function name");
        if (peek().type() != TokenType.LPAREN) {
            throw new ExpectedTokenException("'('", peek());
        }
        takeBalanced(begin(function, NodeKind.VALUE_PARAMETER_LIST));
        if (peek().type() == TokenType.COLON) {
            take(function);
            parseTypeTokens(begin(function, NodeKind.TYPE_REFERENCE));
        }
        if (peek().type() == TokenType.EQ) {
            take(function);
            parseExpression(function);
        } else if (peek().type() == TokenType.LBRACE) {
            parseBlock(function);
        }
    }

    private void parseSecondaryConstructorRest(CompositeElement constructor) {
        take(constructor, NodeKind.KEYWORD);
        takeBalanced(begin(constructor, NodeKind.VALUE_PARAMETER_LIST));
        if (peek().type() == TokenType.COLON) {
            take(constructor);
            if (!peek().isKeyword("this") && !peek().isKeyword("super")) {
                throw new ExpectedTokenException("'this' or 'super'", peek());
            }
            take(constructor, NodeKind.KEYWORD);
            if (peek().type() == TokenType.LPAREN) {
                takeBalanced(constructor);
            }
        }
        if (peek().type() == TokenType.LBRACE) {
            parseBlock(constructor);
        }
    }

    private void parseInitializerRest(CompositeElement initializer) {
        take(initializer, NodeKind.KEYWORD);
        parseBlock(initializer);
    }

    private void parseTypeAliasRest(CompositeElement alias) {
        take(alias, NodeKind.KEYWORD);
        expect(alias, TokenType.IDENTIFIER, NodeKind.IDENTIFIER, "type alias name");
        if (peek().type() == TokenType.LT) {
            takeAngles(begin(alias, NodeKind.TYPE_PARAMETER_LIST));
        }
        expect(alias, TokenType.EQ, NodeKind.PUNCTUATION, "'='");
        parseTypeTokens(begin(alias, NodeKind.TYPE_REFERENCE));
    }

    /**
     * Flat tokens of a type: qualified names, type arguments, nullability and
     * function types.
     */
    private void parseTypeTokens(CompositeElement into) {
        while (peek().type() == TokenType.AT) {
            parseAnnotation(into);
        }
        if (peek().isSoftKeyword("suspend")) {
            take(into, NodeKind.KEYWORD);
        }
        if (peek().type() == TokenType.LPAREN) {
            takeBalanced(into);
            if (peek().type() == TokenType.QUEST && !hasTriviaBeforeNext()) {
                take(into);
            }
            if (peek().type() == TokenType.ARROW) {
                take(into);
                parseTypeTokens(into);
            }
            return;
        }
        expect(into, TokenType.IDENTIFIER, NodeKind.IDENTIFIER, "type");
        while (true) {
            if (peek().type() == TokenType.LT && !hasTriviaBeforeNext()) {
                takeAngles(into);
            }
            if (peek().type() == TokenType.DOT && !hasTriviaBeforeNext()
                    && peekAhead(1).type() == TokenType.IDENTIFIER) {
                take(into);
                take(into, NodeKind.IDENTIFIER);
                continue;
            }
            break;
        }
        if (peek().type() == TokenType.QUEST && !hasTriviaBeforeNext()) {
            take(into);
        }
    }

    private void parseBlock(CompositeElement parent) {
        if (peek().type() != TokenType.LBRACE) {
            throw new ExpectedTokenException("'{'", peek());
        }
        takeBalanced(begin(parent, NodeKind.BLOCK));
    }

    // ========================================================================
    // Expressions and statements
    // ========================================================================

    private void parseStatement(CompositeElement parent) {
        Token next = peek();
        TokenType type = next.type();
        if (type == TokenType.RPAREN || type == TokenType.RBRACKET || type == TokenType.RBRACE) {
            throw new ExpectedTokenException("declaration", next);
        }
        parseExpressionUnits(begin(parent, NodeKind.STATEMENT), true, false);
    }

    /**
     * Parses an expression into {@code parent}. A lone object literal is attached
     * directly; anything else is wrapped in an {@link NodeKind#EXPRESSION} node.
     */
    private void parseExpression(CompositeElement parent) {
        CompositeElement expression = begin(parent, NodeKind.EXPRESSION);
        parseExpressionUnits(expression, false, false);
        List<SyntaxNode> children = expression.children();
        if (children.isEmpty()) {
            throw new ExpectedTokenException("expression", peek());
        }
        if (children.size() == 1 && children.get(0) instanceof CompositeElement only) {
            expression.removeChild(only);
            parent.replaceChild(expression, only);
        }
    }

    private void parseExpressionUnits(CompositeElement into, boolean allowComma, boolean stopAtBrace) {
        boolean first = true;
        while (true) {
            Token next = peek();
            switch (next.type()) {
                case EOF, RBRACE, RPAREN, RBRACKET, SEMICOLON:
                    return;
                case COMMA:
                    if (!allowComma) {
                        return;
                    }
                    break;
                case LBRACE:
                    if (stopAtBrace) {
                        return;
                    }
                    break;
                default:
                    break;
            }
            if (!first && newlineBeforeNext() && !continuesOnNextLine(next)) {
                return;
            }
            parseUnit(into);
            first = false;
        }
    }

    private boolean continuesOnNextLine(Token next) {
        switch (next.type()) {
            case DOT, SAFE_ACCESS, ELVIS, COLONCOLON:
                return true;
            case OPERATOR:
                if (next.text().equals("&&") || next.text().equals("||")) {
                    return true;
                }
                break;
            case KEYWORD:
                if (CONTINUATION_KEYWORDS.contains(next.text())) {
                    return true;
                }
                break;
            default:
                break;
        }
        if (previous == null) {
            return false;
        }
        return switch (previous.type()) {
            case EQ, ARROW, DOT, SAFE_ACCESS, ELVIS, COMMA, COLON, COLONCOLON -> true;
            case OPERATOR -> !POSTFIX_OPERATORS.contains(previous.text());
            case KEYWORD -> OPEN_KEYWORDS.contains(previous.text());
            default -> false;
        };
    }

    private void parseUnit(CompositeElement into) {
        Token next = peek();
        if (next.isKeyword("object")) {
            TokenType following = peekAhead(1).type();
            if (following == TokenType.COLON || following == TokenType.LBRACE) {
                parseObjectLiteral(into);
                return;
            }
        }
        switch (next.type()) {
            case LBRACE, LPAREN, LBRACKET -> takeBalanced(into);
            default -> take(into);
        }
    }

    private void parseObjectLiteral(CompositeElement parent) {
        CompositeElement literal = begin(parent, NodeKind.OBJECT_LITERAL);
        CompositeElement declaration = begin(literal, NodeKind.OBJECT_DECLARATION);
        take(declaration, NodeKind.KEYWORD);
        if (peek().type() == TokenType.COLON) {
            take(declaration);
            parseSuperTypeList(declaration);
        }
        if (peek().type() != TokenType.LBRACE) {
            throw new ExpectedTokenException("'{'", peek());
        }
        parseClassBody(declaration);
    }

    // ========================================================================
    // Token plumbing
    // ========================================================================

    private int significantIndex(int from) {
        int i = from;
        while (tokens.get(i).type().isTrivia()) {
            i++;
        }
        return i;
    }

    private Token peek() {
        return tokens.get(significantIndex(current));
    }

    /**
     * The significant token {@code n} positions after the next one.
     */
    private Token peekAhead(int n) {
        int index = significantIndex(current);
        for (int i = 0; i < n && tokens.get(index).type() != TokenType.EOF; i++) {
            index = significantIndex(index + 1);
        }
        return tokens.get(index);
    }

    private boolean hasTriviaBeforeNext() {
        return tokens.get(current).type().isTrivia();
    }

    private boolean newlineBeforeNext() {
        int end = significantIndex(current);
        for (int i = current; i < end; i++) {
            if (tokens.get(i).text().indexOf('\n') >= 0) {
                return true;
            }
        }
        return false;
    }

    private int matchingClose(int open) {
        int depth = 0;
        for (int i = open; i < tokens.size(); i++) {
            TokenType type = tokens.get(i).type();
            if (isOpener(type)) {
                depth++;
            } else if (isCloser(type)) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * Moves pending whitespace and comments into {@code into}.
     */
    private void trivia(CompositeElement into) {
        while (tokens.get(current).type().isTrivia()) {
            Token token = tokens.get(current++);
            NodeKind kind = token.type() == TokenType.WHITE_SPACE ? NodeKind.WHITE_SPACE : NodeKind.COMMENT;
            into.addChild(new LeafElement(kind, token.text()));
        }
    }

    private CompositeElement begin(CompositeElement parent, NodeKind kind) {
        trivia(parent);
        CompositeElement node = CompositeElement.create(kind);
        parent.addChild(node);
        return node;
    }

    private LeafElement take(CompositeElement into) {
        return take(into, leafKind(peek().type()));
    }

    private LeafElement take(CompositeElement into, NodeKind kind) {
        trivia(into);
        Token token = tokens.get(current);
        if (token.type() == TokenType.EOF) {
            throw new ExpectedTokenException("more input", token);
        }
        current++;
        previous = token;
        LeafElement leaf = new LeafElement(kind, token.text());
        into.addChild(leaf);
        return leaf;
    }

    private LeafElement expect(CompositeElement into, TokenType type, NodeKind kind, String what) {
        Token next = peek();
        if (next.type() != type) {
            throw new ExpectedTokenException(what, next);
        }
        return take(into, kind);
    }

    /**
     * Takes a bracketed group, from the opening token through its matching close.
     */
    private void takeBalanced(CompositeElement into) {
        Token open = peek();
        take(into);
        int depth = 1;
        while (depth > 0) {
            Token next = peek();
            if (next.type() == TokenType.EOF) {
                throw new ExpectedTokenException("closing bracket for '" + open.text() + "' at line " + open.line(), next);
            }
            if (isOpener(next.type())) {
                depth++;
            } else if (isCloser(next.type())) {
                depth--;
            }
            take(into);
        }
    }

    private void takeAngles(CompositeElement into) {
        take(into);
        int depth = 1;
        while (depth > 0) {
            Token next = peek();
            switch (next.type()) {
                case EOF, LBRACE, RBRACE, SEMICOLON -> throw new ExpectedTokenException("'>'", next);
                case LT -> depth++;
                case GT -> depth--;
                default -> {
                }
            }
            if (isOpener(next.type())) {
                takeBalanced(into);
            } else {
                take(into);
            }
        }
    }

    private static boolean isOpener(TokenType type) {
        return type == TokenType.LBRACE || type == TokenType.LPAREN || type == TokenType.LBRACKET;
    }

    private static boolean isCloser(TokenType type) {
        return type == TokenType.RBRACE || type == TokenType.RPAREN || type == TokenType.RBRACKET;
    }

    private static NodeKind leafKind(TokenType type) {
        return switch (type) {
            case WHITE_SPACE -> NodeKind.WHITE_SPACE;
            case LINE_COMMENT, BLOCK_COMMENT -> NodeKind.COMMENT;
            case IDENTIFIER -> NodeKind.IDENTIFIER;
            case KEYWORD -> NodeKind.KEYWORD;
            case STRING, CHAR, NUMBER -> NodeKind.LITERAL;
            case LBRACE -> NodeKind.LBRACE;
            case RBRACE -> NodeKind.RBRACE;
            default -> NodeKind.PUNCTUATION;
        };
    }
}
