package com.proxymirror.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.function.Predicate;

/**
 * A node with an ordered, owned list of children.
 *
 * <p>Every mutation keeps the tree consistent: a node is attached to at most one
 * parent, appears in that parent's children exactly once, and can never become its
 * own ancestor.</p>
 */
public non-sealed class CompositeElement extends SyntaxNode {

    private final List<SyntaxNode> children = new ArrayList<>();

    protected CompositeElement(NodeKind kind) {
        super(kind);
        if (kind.isLeaf()) {
            throw new IllegalArgumentException(kind + " is a leaf kind");
        }
    }

    /**
     * Creates an empty node of the given kind, using the typed class where one exists.
     */
    public static CompositeElement create(NodeKind kind) {
        return switch (kind) {
            case FILE -> new SourceFile();
            case CLASS -> new ClassDeclaration();
            case OBJECT_DECLARATION -> new ObjectDeclaration();
            case CLASS_BODY -> new ClassBody();
            case PROPERTY -> new PropertyDeclaration();
            case FUNCTION -> new FunctionDeclaration();
            case OBJECT_LITERAL -> new ObjectLiteralExpression();
            default -> new CompositeElement(kind);
        };
    }

    @Override
    public List<SyntaxNode> children() {
        return Collections.unmodifiableList(children);
    }

    /**
     * Children that are not leaves, in document order.
     */
    public List<CompositeElement> compositeChildren() {
        List<CompositeElement> result = new ArrayList<>();
        for (SyntaxNode child : children) {
            if (child instanceof CompositeElement composite) {
                result.add(composite);
            }
        }
        return result;
    }

    @Override
    public String text() {
        StringBuilder out = new StringBuilder();
        appendText(out);
        return out.toString();
    }

    @Override
    public int textLength() {
        int length = 0;
        for (SyntaxNode child : children) {
            length += child.textLength();
        }
        return length;
    }

    @Override
    void appendText(StringBuilder out) {
        for (SyntaxNode child : children) {
            child.appendText(out);
        }
    }

    public void addChild(SyntaxNode child) {
        attach(children.size(), child);
    }

    public void addBefore(SyntaxNode child, SyntaxNode anchor) {
        attach(indexOfChild(anchor), child);
    }

    public void addAfter(SyntaxNode child, SyntaxNode anchor) {
        attach(indexOfChild(anchor) + 1, child);
    }

    public void removeChild(SyntaxNode child) {
        children.remove(indexOfChild(child));
        child.setParent(null);
    }

    public void replaceChild(SyntaxNode oldChild, SyntaxNode newChild) {
        int index = indexOfChild(oldChild);
        checkAttachable(newChild);
        children.set(index, newChild);
        oldChild.setParent(null);
        newChild.setParent(this);
    }

    /**
     * Detaches every direct child matching the filter.
     *
     * @return the number of children removed
     */
    public int removeChildren(Predicate<? super SyntaxNode> filter) {
        int removed = 0;
        Iterator<SyntaxNode> iterator = children.iterator();
        while (iterator.hasNext()) {
            SyntaxNode child = iterator.next();
            if (filter.test(child)) {
                iterator.remove();
                child.setParent(null);
                removed++;
            }
        }
        return removed;
    }

    int indexOfChild(SyntaxNode child) {
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i) == child) {
                return i;
            }
        }
        throw new IllegalArgumentException(child + " is not a child of " + kind());
    }

    private void attach(int index, SyntaxNode child) {
        checkAttachable(child);
        children.add(index, child);
        child.setParent(this);
    }

    private void checkAttachable(SyntaxNode child) {
        if (child == null) {
            throw new IllegalArgumentException("Child must not be null");
        }
        if (child.parent() != null) {
            throw new IllegalArgumentException(child + " is already attached to " + child.parent().kind());
        }
        if (child == this || child.isAncestorOf(this)) {
            throw new IllegalArgumentException("Attaching " + child + " to " + kind() + " would create a cycle");
        }
    }
}
