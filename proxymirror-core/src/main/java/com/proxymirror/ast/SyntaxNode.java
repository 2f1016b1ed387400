package com.proxymirror.ast;

import java.util.List;
import java.util.Optional;

/**
 * Base class for all nodes of a lossless syntax tree.
 *
 * <p>Children are owned by their parent; the parent link is a back reference used
 * for traversal only. Concatenating the text of all leaves in document order yields
 * the exact source the tree was parsed from.</p>
 */
public abstract sealed class SyntaxNode permits LeafElement, CompositeElement {

    private final NodeKind kind;
    private CompositeElement parent;

    protected SyntaxNode(NodeKind kind) {
        if (kind == null) {
            throw new IllegalArgumentException("Node kind must not be null");
        }
        this.kind = kind;
    }

    public NodeKind kind() {
        return kind;
    }

    public boolean isLeaf() {
        return kind.isLeaf();
    }

    /**
     * Returns the parent node, or null for a root or detached node.
     */
    public CompositeElement parent() {
        return parent;
    }

    void setParent(CompositeElement parent) {
        this.parent = parent;
    }

    /**
     * Returns the children in document order. The list is read-only; use the
     * mutation methods of {@link CompositeElement} to change it.
     */
    public abstract List<SyntaxNode> children();

    public abstract String text();

    public abstract int textLength();

    abstract void appendText(StringBuilder out);

    public SyntaxNode firstChild() {
        List<SyntaxNode> children = children();
        return children.isEmpty() ? null : children.get(0);
    }

    public SyntaxNode lastChild() {
        List<SyntaxNode> children = children();
        return children.isEmpty() ? null : children.get(children.size() - 1);
    }

    public SyntaxNode nextSibling() {
        if (parent == null) {
            return null;
        }
        int index = parent.indexOfChild(this);
        List<SyntaxNode> siblings = parent.children();
        return index + 1 < siblings.size() ? siblings.get(index + 1) : null;
    }

    public SyntaxNode prevSibling() {
        if (parent == null) {
            return null;
        }
        int index = parent.indexOfChild(this);
        return index > 0 ? parent.children().get(index - 1) : null;
    }

    /**
     * Offset of this node's first character, relative to the root of its tree.
     */
    public int startOffset() {
        int offset = 0;
        SyntaxNode node = this;
        while (node.parent != null) {
            for (SyntaxNode sibling : node.parent.children()) {
                if (sibling == node) {
                    break;
                }
                offset += sibling.textLength();
            }
            node = node.parent;
        }
        return offset;
    }

    public int endOffset() {
        return startOffset() + textLength();
    }

    public SyntaxNode root() {
        SyntaxNode node = this;
        while (node.parent != null) {
            node = node.parent;
        }
        return node;
    }

    /**
     * Returns the file this node belongs to, or null when the tree is not rooted in one.
     */
    public SourceFile containingFile() {
        return root() instanceof SourceFile file ? file : null;
    }

    public boolean isAncestorOf(SyntaxNode node) {
        for (SyntaxNode current = node == null ? null : node.parent; current != null; current = current.parent) {
            if (current == this) {
                return true;
            }
        }
        return false;
    }

    /**
     * Typed view of this node, empty when the node is not of the requested type.
     */
    public <T extends SyntaxNode> Optional<T> as(Class<T> type) {
        return type.isInstance(this) ? Optional.of(type.cast(this)) : Optional.empty();
    }

    @Override
    public String toString() {
        String text = text();
        if (text.length() > 40) {
            text = text.substring(0, 37) + "...";
        }
        return kind + "(" + text.replace("\n", "\\n") + ")";
    }
}
