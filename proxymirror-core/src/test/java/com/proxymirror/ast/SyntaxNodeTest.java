package com.proxymirror.ast;

import com.proxymirror.Parser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SyntaxNodeTest {

    private static final String SOURCE = "class A {\n    val x = 1\n    val y = 2\n}\n";

    private SourceFile file;
    private ClassBody body;

    @BeforeEach
    void setUp() {
        file = Parser.parse(SOURCE);
        body = file.classes().get(0).body();
    }

    private static void assertParentLinks(SyntaxNode node) {
        for (SyntaxNode child : node.children()) {
            assertSame(node, child.parent(), () -> "parent of " + child);
            assertParentLinks(child);
        }
    }

    @Test
    void testParentLinksAfterParse() {
        assertNull(file.parent());
        assertParentLinks(file);
    }

    @Test
    void testOffsets() {
        PropertyDeclaration y = body.properties().get(1);
        assertEquals(SOURCE.indexOf("val y"), y.startOffset());
        assertEquals(SOURCE.indexOf("val y") + "val y = 2".length(), y.endOffset());
        assertSame(file, y.root());
        assertSame(file, y.containingFile());
    }

    @Test
    void testSiblings() {
        PropertyDeclaration x = body.properties().get(0);
        assertEquals(NodeKind.WHITE_SPACE, x.prevSibling().kind());
        assertEquals(NodeKind.WHITE_SPACE, x.nextSibling().kind());
        assertNull(body.firstChild().prevSibling());
        assertNull(body.lastChild().nextSibling());
        assertNull(file.nextSibling());
    }

    @Test
    void testFindLeafAt() {
        LeafElement leaf = file.findLeafAt(SOURCE.indexOf("y ="));
        assertEquals(NodeKind.IDENTIFIER, leaf.kind());
        assertEquals("y", leaf.text());
        assertNull(file.findLeafAt(-1));
        assertNull(file.findLeafAt(SOURCE.length()));
    }

    @Test
    void testTypedView() {
        assertTrue(file.as(SourceFile.class).isPresent());
        assertTrue(file.as(ClassBody.class).isEmpty());
        assertTrue(body.properties().get(0).as(Declaration.class).isPresent());
    }

    @Test
    void testAddBeforeAndRemove() {
        PropertyDeclaration x = body.properties().get(0);
        PropertyDeclaration z = NodeFactory.createProperty("val z = 3");
        body.addBefore(z, x);
        assertSame(body, z.parent());
        assertSame(x, z.nextSibling());
        assertEquals("class A {\n    val z = 3val x = 1\n    val y = 2\n}\n", file.text());

        body.removeChild(z);
        assertNull(z.parent());
        assertEquals(SOURCE, file.text());
        assertParentLinks(file);
    }

    @Test
    void testAddAfter() {
        PropertyDeclaration y = body.properties().get(1);
        body.addAfter(new LeafElement(NodeKind.COMMENT, " // last"), y);
        assertEquals("class A {\n    val x = 1\n    val y = 2 // last\n}\n", file.text());
    }

    @Test
    void testReplaceChild() {
        PropertyDeclaration x = body.properties().get(0);
        PropertyDeclaration replacement = NodeFactory.createProperty("var x = 10");
        body.replaceChild(x, replacement);
        assertNull(x.parent());
        assertSame(body, replacement.parent());
        assertEquals("class A {\n    var x = 10\n    val y = 2\n}\n", file.text());
    }

    @Test
    void testRemoveChildren() {
        int removed = body.removeChildren(child -> child.kind() == NodeKind.WHITE_SPACE);
        assertEquals(3, removed);
        assertEquals("class A {val x = 1val y = 2}\n", file.text());
    }

    @Test
    void testAttachingAnAttachedNodeFails() {
        PropertyDeclaration x = body.properties().get(0);
        assertThrows(IllegalArgumentException.class, () -> body.addChild(x));
        assertEquals(SOURCE, file.text());
    }

    @Test
    void testCyclesAreRejected() {
        ClassDeclaration owner = file.classes().get(0);
        file.removeChild(owner);
        assertThrows(IllegalArgumentException.class, () -> body.addChild(owner));
        assertThrows(IllegalArgumentException.class, () -> body.addChild(body));
    }

    @Test
    void testAnchorMustBeAChild() {
        PropertyDeclaration detached = NodeFactory.createProperty("val q = 0");
        assertThrows(IllegalArgumentException.class,
            () -> body.addBefore(NodeFactory.createProperty("val r = 0"), detached));
        assertThrows(IllegalArgumentException.class, () -> body.removeChild(detached));
    }

    @Test
    void testLeafKindsAreChecked() {
        assertThrows(IllegalArgumentException.class, () -> new LeafElement(NodeKind.CLASS, "class"));
        assertThrows(IllegalArgumentException.class, () -> CompositeElement.create(NodeKind.IDENTIFIER));
    }

    @Test
    void testCreateUsesTypedClasses() {
        assertInstanceOf(SourceFile.class, CompositeElement.create(NodeKind.FILE));
        assertInstanceOf(ClassBody.class, CompositeElement.create(NodeKind.CLASS_BODY));
        assertInstanceOf(PropertyDeclaration.class, CompositeElement.create(NodeKind.PROPERTY));
        assertEquals(CompositeElement.class, CompositeElement.create(NodeKind.BLOCK).getClass());
    }

    @Test
    void testTreeUtilLineHelpers() {
        PropertyDeclaration y = body.properties().get(1);
        assertEquals("    ", TreeUtil.lineIndent(y));
        assertEquals("", TreeUtil.lineIndent(file.classes().get(0)));
        assertTrue(TreeUtil.onSameLine(body.lBrace(), file.classes().get(0)));
        assertFalse(TreeUtil.onSameLine(body.lBrace(), y));
        assertEquals(2, TreeUtil.newlineCount("\n\n  "));
    }

    @Test
    void testDescendantsAndAncestors() {
        assertEquals(2, TreeUtil.descendantsOfType(file, PropertyDeclaration.class).size());
        LeafElement leaf = file.findLeafAt(SOURCE.indexOf("x"));
        assertEquals(NodeKind.PROPERTY, TreeUtil.ancestors(leaf).get(0).kind());
        assertSame(file, TreeUtil.ancestors(leaf).get(TreeUtil.ancestors(leaf).size() - 1));
        assertTrue(file.isAncestorOf(leaf));
        assertFalse(leaf.isAncestorOf(file));
    }
}
