package com.proxymirror.ast;

/**
 * An {@code object} declaration. Object literals wrap an anonymous one.
 */
public final class ObjectDeclaration extends Declaration {

    ObjectDeclaration() {
        super(NodeKind.OBJECT_DECLARATION);
    }

    public ClassBody body() {
        return TreeUtil.firstChildOfType(this, ClassBody.class);
    }

    public boolean isCompanion() {
        return hasModifier("companion");
    }

    public boolean isAnonymous() {
        return nameIdentifier() == null;
    }
}
