package com.proxymirror.ast;

/**
 * A named declaration: class, object, property or function.
 */
public abstract class Declaration extends CompositeElement {

    protected Declaration(NodeKind kind) {
        super(kind);
    }

    /**
     * The identifier leaf naming this declaration, or null for anonymous objects.
     */
    public LeafElement nameIdentifier() {
        for (SyntaxNode child : children()) {
            if (child instanceof LeafElement leaf && leaf.kind() == NodeKind.IDENTIFIER) {
                return leaf;
            }
        }
        return null;
    }

    /**
     * The declared name with surrounding backticks removed, or null.
     */
    public String name() {
        LeafElement identifier = nameIdentifier();
        return identifier == null ? null : unquote(identifier.text());
    }

    public CompositeElement modifierList() {
        for (CompositeElement child : compositeChildren()) {
            if (child.kind() == NodeKind.MODIFIER_LIST) {
                return child;
            }
        }
        return null;
    }

    public boolean hasModifier(String modifier) {
        CompositeElement modifiers = modifierList();
        if (modifiers == null) {
            return false;
        }
        for (SyntaxNode child : modifiers.children()) {
            if (child.kind() == NodeKind.KEYWORD && child.text().equals(modifier)) {
                return true;
            }
        }
        return false;
    }

    protected boolean hasKeyword(String keyword) {
        for (SyntaxNode child : children()) {
            if (child.kind() == NodeKind.KEYWORD && child.text().equals(keyword)) {
                return true;
            }
        }
        return false;
    }

    public static String unquote(String identifier) {
        if (identifier.length() >= 2 && identifier.startsWith("`") && identifier.endsWith("`")) {
            return identifier.substring(1, identifier.length() - 1);
        }
        return identifier;
    }
}
