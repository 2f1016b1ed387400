package com.proxymirror.ast;

import java.util.List;

/**
 * A token in the tree: identifier, keyword, literal, punctuation, whitespace or comment.
 */
public final class LeafElement extends SyntaxNode {

    private final String text;

    public LeafElement(NodeKind kind, String text) {
        super(kind);
        if (!kind.isLeaf()) {
            throw new IllegalArgumentException(kind + " is not a leaf kind");
        }
        if (text == null) {
            throw new IllegalArgumentException("Leaf text must not be null");
        }
        this.text = text;
    }

    @Override
    public List<SyntaxNode> children() {
        return List.of();
    }

    @Override
    public String text() {
        return text;
    }

    @Override
    public int textLength() {
        return text.length();
    }

    @Override
    void appendText(StringBuilder out) {
        out.append(text);
    }

    public boolean isWhitespace() {
        return kind() == NodeKind.WHITE_SPACE;
    }
}
