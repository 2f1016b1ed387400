package com.proxymirror.ast;

/**
 * A {@code fun} declaration.
 */
public final class FunctionDeclaration extends Declaration {

    FunctionDeclaration() {
        super(NodeKind.FUNCTION);
    }

    public CompositeElement valueParameterList() {
        for (CompositeElement child : compositeChildren()) {
            if (child.kind() == NodeKind.VALUE_PARAMETER_LIST) {
                return child;
            }
        }
        return null;
    }

    /**
     * The block body, or null for expression-bodied and abstract functions.
     */
    public CompositeElement bodyBlock() {
        for (CompositeElement child : compositeChildren()) {
            if (child.kind() == NodeKind.BLOCK) {
                return child;
            }
        }
        return null;
    }
}
