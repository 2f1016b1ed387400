package com.proxymirror.intention;

import com.proxymirror.ast.ClassBody;
import com.proxymirror.ast.CompositeElement;
import com.proxymirror.ast.LeafElement;
import com.proxymirror.ast.NodeFactory;
import com.proxymirror.ast.NodeKind;
import com.proxymirror.ast.PropertyDeclaration;
import com.proxymirror.ast.SyntaxNode;
import com.proxymirror.ast.TreeUtil;

import java.util.List;

/**
 * Appends a member as the last declaration of an object body, directly before the
 * closing brace, and lays out the whitespace around it.
 */
public class ProxyBodyMutator {

    private final MirrorConventions conventions;

    public ProxyBodyMutator(MirrorConventions conventions) {
        this.conventions = conventions;
    }

    /**
     * @throws IllegalArgumentException      if {@code member} already has a parent
     * @throws StructuralAssumptionException if the body does not end with a closing brace;
     *                                       nothing is modified in that case
     */
    public void insert(ClassBody body, PropertyDeclaration member) {
        if (member.parent() != null) {
            throw new IllegalArgumentException("Member is already attached to a " + member.parent().kind());
        }
        LeafElement closingBrace = body.rBrace();
        if (closingBrace == null) {
            throw new StructuralAssumptionException("Object body does not end with '}'");
        }
        LeafElement openingBrace = body.lBrace();
        String braceIndent = TreeUtil.lineIndent(openingBrace != null ? openingBrace : body);
        String memberIndent = memberIndent(body, openingBrace, braceIndent);
        String lineBreak = body.root().text().contains("\r\n") ? "\r\n" : "\n";

        if (body.compositeChildren().isEmpty()) {
            body.removeChildren(child -> child.kind() == NodeKind.WHITE_SPACE);
        }
        body.addBefore(member, closingBrace);
        separate(body, member, lineBreak, memberIndent);
        separate(body, closingBrace, lineBreak, braceIndent);
    }

    private String memberIndent(ClassBody body, SyntaxNode openingBrace, String braceIndent) {
        List<CompositeElement> members = body.compositeChildren();
        if (!members.isEmpty() && openingBrace != null && !TreeUtil.onSameLine(openingBrace, members.get(0))) {
            return TreeUtil.lineIndent(members.get(0));
        }
        return braceIndent + indentUnit(braceIndent);
    }

    // A tab-indented brace line keeps tabs even when the configured unit is spaces
    private String indentUnit(String braceIndent) {
        String unit = conventions.indentUnit();
        if (braceIndent.indexOf('\t') >= 0 && unit.indexOf('\t') < 0) {
            return "\t";
        }
        return unit;
    }

    // Existing blank lines before the node are kept
    private static void separate(ClassBody body, SyntaxNode node, String lineBreak, String indent) {
        SyntaxNode previous = node.prevSibling();
        if (previous != null && previous.kind() == NodeKind.WHITE_SPACE) {
            int lines = Math.max(1, TreeUtil.newlineCount(previous.text()));
            body.replaceChild(previous, NodeFactory.createWhitespace(lineBreak.repeat(lines) + indent));
        } else {
            body.addBefore(NodeFactory.createWhitespace(lineBreak + indent), node);
        }
    }
}
