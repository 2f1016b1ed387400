package com.proxymirror.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Braced member list of a class or object. The first child is always the opening
 * brace; a well-formed body ends with the closing brace.
 */
public final class ClassBody extends CompositeElement {

    ClassBody() {
        super(NodeKind.CLASS_BODY);
    }

    public LeafElement lBrace() {
        return firstChild() instanceof LeafElement leaf && leaf.kind() == NodeKind.LBRACE ? leaf : null;
    }

    public LeafElement rBrace() {
        return lastChild() instanceof LeafElement leaf && leaf.kind() == NodeKind.RBRACE ? leaf : null;
    }

    public List<Declaration> declarations() {
        List<Declaration> result = new ArrayList<>();
        for (SyntaxNode child : children()) {
            if (child instanceof Declaration declaration) {
                result.add(declaration);
            }
        }
        return result;
    }

    public List<PropertyDeclaration> properties() {
        return TreeUtil.childrenOfType(this, PropertyDeclaration.class);
    }
}
