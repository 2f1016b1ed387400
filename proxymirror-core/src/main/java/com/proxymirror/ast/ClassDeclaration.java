package com.proxymirror.ast;

/**
 * A {@code class} or {@code interface} declaration.
 */
public final class ClassDeclaration extends Declaration {

    ClassDeclaration() {
        super(NodeKind.CLASS);
    }

    /**
     * Returns the class body, or null for a class declared without braces.
     */
    public ClassBody body() {
        return TreeUtil.firstChildOfType(this, ClassBody.class);
    }

    public boolean isInterface() {
        return hasKeyword("interface");
    }
}
