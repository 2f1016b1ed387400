package com.proxymirror.ast;

import java.util.List;

/**
 * A {@code val} or {@code var} declaration.
 */
public final class PropertyDeclaration extends Declaration {

    PropertyDeclaration() {
        super(NodeKind.PROPERTY);
    }

    public boolean isVar() {
        return hasKeyword("var");
    }

    public CompositeElement typeReference() {
        return childOfKind(NodeKind.TYPE_REFERENCE);
    }

    /**
     * The expression after {@code =}, or null when the property has none.
     */
    public SyntaxNode initializer() {
        boolean afterEq = false;
        for (SyntaxNode child : children()) {
            if (afterEq && child instanceof CompositeElement) {
                return child;
            }
            if (child.kind() == NodeKind.PUNCTUATION && child.text().equals("=")) {
                afterEq = true;
            }
        }
        return null;
    }

    public CompositeElement delegate() {
        return childOfKind(NodeKind.PROPERTY_DELEGATE);
    }

    /**
     * The expression following {@code by}, or null when the property is not delegated.
     */
    public CompositeElement delegateExpression() {
        CompositeElement delegate = delegate();
        if (delegate == null) {
            return null;
        }
        List<CompositeElement> parts = delegate.compositeChildren();
        return parts.isEmpty() ? null : parts.get(0);
    }

    public List<CompositeElement> accessors() {
        return compositeChildren().stream()
            .filter(child -> child.kind() == NodeKind.PROPERTY_ACCESSOR)
            .toList();
    }

    private CompositeElement childOfKind(NodeKind kind) {
        for (CompositeElement child : compositeChildren()) {
            if (child.kind() == kind) {
                return child;
            }
        }
        return null;
    }
}
