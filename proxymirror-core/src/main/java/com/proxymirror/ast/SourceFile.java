package com.proxymirror.ast;

import java.util.List;

/**
 * Root of a parsed source file.
 */
public final class SourceFile extends CompositeElement {

    SourceFile() {
        super(NodeKind.FILE);
    }

    /**
     * Top-level classes and interfaces, in document order.
     */
    public List<ClassDeclaration> classes() {
        return TreeUtil.childrenOfType(this, ClassDeclaration.class);
    }

    /**
     * Returns the leaf covering {@code offset}, or null when the offset is outside the text.
     */
    public LeafElement findLeafAt(int offset) {
        if (offset < 0 || offset >= textLength()) {
            return null;
        }
        SyntaxNode node = this;
        int base = 0;
        while (!(node instanceof LeafElement)) {
            SyntaxNode next = null;
            for (SyntaxNode child : node.children()) {
                int length = child.textLength();
                if (offset < base + length) {
                    next = child;
                    break;
                }
                base += length;
            }
            if (next == null) {
                return null;
            }
            node = next;
        }
        return (LeafElement) node;
    }
}
