package com.proxymirror.ast;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class NodeFactoryTest {

    @Test
    void testCreateProperty() {
        PropertyDeclaration property = NodeFactory.createProperty("override val loading by owner.delegateFor(\"loading\")");
        assertNull(property.parent());
        assertNull(property.containingFile());
        assertEquals("loading", property.name());
        assertTrue(property.hasModifier("override"));
        assertNotNull(property.delegate());
    }

    @Test
    void testCreateFromTemplate() {
        PropertyDeclaration property = NodeFactory.createFromTemplate(
            "override val {identifier} by owner.delegateFor(\"{name}\")",
            Map.of("identifier", "`is loading`", "name", "is loading"));
        assertEquals("override val `is loading` by owner.delegateFor(\"is loading\")", property.text());
        assertEquals("is loading", property.name());
    }

    @Test
    void testTemplateValuesAreNotExpandedAgain() {
        PropertyDeclaration property = NodeFactory.createFromTemplate(
            "override val {identifier} by owner.delegateFor(\"{name}\")",
            Map.of("identifier", "`{name}`", "name", "{identifier}"));
        assertEquals("override val `{name}` by owner.delegateFor(\"{identifier}\")", property.text());
        assertEquals("{name}", property.name());
    }

    @Test
    void testUnknownPlaceholderIsKept() {
        PropertyDeclaration property = NodeFactory.createFromTemplate(
            "val {identifier} = \"{other}\"", Map.of("identifier", "a"));
        assertEquals("val a = \"{other}\"", property.text());
    }

    @Test
    void testTemplateMustProduceADeclaration() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> NodeFactory.createFromTemplate("{identifier} by owner", Map.of("identifier", "x")));
        assertNotNull(e.getCause());
    }

    @Test
    void testRejectsNonProperties() {
        assertThrows(IllegalArgumentException.class, () -> NodeFactory.createProperty("fun f() = 1"));
        assertThrows(IllegalArgumentException.class, () -> NodeFactory.createProperty("val"));
        assertThrows(IllegalArgumentException.class, () -> NodeFactory.createProperty("val a = 1; val b = 2"));
    }

    @Test
    void testCreateWhitespace() {
        LeafElement whitespace = NodeFactory.createWhitespace("\n    ");
        assertEquals(NodeKind.WHITE_SPACE, whitespace.kind());
        assertTrue(whitespace.isWhitespace());
        assertThrows(IllegalArgumentException.class, () -> NodeFactory.createWhitespace(""));
        assertThrows(IllegalArgumentException.class, () -> NodeFactory.createWhitespace(" x "));
    }
}
