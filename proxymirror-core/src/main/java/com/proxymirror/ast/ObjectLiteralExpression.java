package com.proxymirror.ast;

/**
 * {@code object : Supertype { ... }} used as an expression.
 */
public final class ObjectLiteralExpression extends CompositeElement {

    ObjectLiteralExpression() {
        super(NodeKind.OBJECT_LITERAL);
    }

    public ObjectDeclaration objectDeclaration() {
        return TreeUtil.firstChildOfType(this, ObjectDeclaration.class);
    }
}
