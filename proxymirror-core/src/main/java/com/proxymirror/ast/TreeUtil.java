package com.proxymirror.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helpers for walking syntax trees.
 */
public final class TreeUtil {

    private TreeUtil() {
        // Utility class
    }

    public static <T extends SyntaxNode> T firstChildOfType(SyntaxNode parent, Class<T> type) {
        for (SyntaxNode child : parent.children()) {
            if (type.isInstance(child)) {
                return type.cast(child);
            }
        }
        return null;
    }

    public static <T extends SyntaxNode> List<T> childrenOfType(SyntaxNode parent, Class<T> type) {
        List<T> result = new ArrayList<>();
        for (SyntaxNode child : parent.children()) {
            if (type.isInstance(child)) {
                result.add(type.cast(child));
            }
        }
        return result;
    }

    /**
     * All nodes of the given type below {@code root}, depth-first in document order.
     */
    public static <T extends SyntaxNode> List<T> descendantsOfType(SyntaxNode root, Class<T> type) {
        List<T> result = new ArrayList<>();
        collect(root, type, result);
        return result;
    }

    private static <T extends SyntaxNode> void collect(SyntaxNode node, Class<T> type, List<T> out) {
        for (SyntaxNode child : node.children()) {
            if (type.isInstance(child)) {
                out.add(type.cast(child));
            }
            collect(child, type, out);
        }
    }

    /**
     * Ancestors from the parent up to the root.
     */
    public static List<CompositeElement> ancestors(SyntaxNode node) {
        List<CompositeElement> result = new ArrayList<>();
        for (CompositeElement parent = node.parent(); parent != null; parent = parent.parent()) {
            result.add(parent);
        }
        return result;
    }

    /**
     * Leading spaces and tabs of the line on which {@code node} starts.
     */
    public static String lineIndent(SyntaxNode node) {
        String text = node.root().text();
        int lineStart = lineStart(text, node.startOffset());
        int end = lineStart;
        while (end < text.length() && (text.charAt(end) == ' ' || text.charAt(end) == '\t')) {
            end++;
        }
        return text.substring(lineStart, end);
    }

    public static boolean onSameLine(SyntaxNode first, SyntaxNode second) {
        String text = first.root().text();
        return lineStart(text, first.startOffset()) == lineStart(text, second.startOffset());
    }

    public static int newlineCount(String text) {
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                count++;
            }
        }
        return count;
    }

    private static int lineStart(String text, int offset) {
        return text.lastIndexOf('\n', offset - 1) + 1;
    }
}
