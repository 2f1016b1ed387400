package com.proxymirror.ast;

/**
 * Closed set of syntax node kinds.
 */
public enum NodeKind {
    // Leaves
    WHITE_SPACE(true),
    COMMENT(true),
    IDENTIFIER(true),
    KEYWORD(true),
    LITERAL(true),
    LBRACE(true),
    RBRACE(true),
    PUNCTUATION(true),

    // Composites
    FILE(false),
    PACKAGE_DIRECTIVE(false),
    IMPORT_LIST(false),
    IMPORT_DIRECTIVE(false),
    CLASS(false),               // class or interface
    OBJECT_DECLARATION(false),  // named, companion or anonymous object
    CLASS_BODY(false),
    PRIMARY_CONSTRUCTOR(false),
    SECONDARY_CONSTRUCTOR(false),
    CLASS_INITIALIZER(false),
    TYPE_PARAMETER_LIST(false),
    SUPER_TYPE_LIST(false),
    MODIFIER_LIST(false),
    ANNOTATION_ENTRY(false),
    PROPERTY(false),
    PROPERTY_DELEGATE(false),
    PROPERTY_ACCESSOR(false),
    FUNCTION(false),
    VALUE_PARAMETER_LIST(false),
    TYPE_REFERENCE(false),
    TYPEALIAS(false),
    BLOCK(false),
    OBJECT_LITERAL(false),
    EXPRESSION(false),
    STATEMENT(false);

    private final boolean leaf;

    NodeKind(boolean leaf) {
        this.leaf = leaf;
    }

    public boolean isLeaf() {
        return leaf;
    }

    /**
     * Whitespace and comments carry no structure.
     */
    public boolean isTrivia() {
        return this == WHITE_SPACE || this == COMMENT;
    }
}
