package com.proxymirror.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.proxymirror.ast.CompositeElement;
import com.proxymirror.ast.Declaration;
import com.proxymirror.ast.LeafElement;
import com.proxymirror.ast.NodeKind;
import com.proxymirror.ast.SyntaxNode;

import java.io.IOException;

/**
 * Jackson module that reads and writes syntax trees.
 *
 * <p>Nodes are written as {@code {"kind", "start", "end", "name", "text", "children"}}
 * where {@code name} appears on named declarations, {@code text} on leaves and
 * {@code children} on composites. Reading ignores {@code start}, {@code end} and
 * {@code name} and rebuilds the tree from the leaves' text.</p>
 *
 * <p>The deserializer is registered for {@link SyntaxNode} itself; read the base type
 * and narrow the result.</p>
 */
public class SyntaxTreeModule extends SimpleModule {

    public SyntaxTreeModule() {
        super("SyntaxTreeModule", new Version(0, 1, 0, "SNAPSHOT", "com.proxymirror", "proxymirror-jackson"));
        addSerializer(SyntaxNode.class, new SyntaxNodeSerializer());
        addDeserializer(SyntaxNode.class, new SyntaxNodeDeserializer());
    }

    // ==================== Serializer ====================

    static class SyntaxNodeSerializer extends StdSerializer<SyntaxNode> {

        SyntaxNodeSerializer() {
            super(SyntaxNode.class);
        }

        @Override
        public void serialize(SyntaxNode node, JsonGenerator gen, SerializerProvider provider) throws IOException {
            write(node, node.startOffset(), gen);
        }

        // Offsets are accumulated on the way down instead of asking each node
        private void write(SyntaxNode node, int start, JsonGenerator gen) throws IOException {
            gen.writeStartObject();
            gen.writeStringField("kind", node.kind().name());
            gen.writeNumberField("start", start);
            gen.writeNumberField("end", start + node.textLength());
            if (node instanceof Declaration declaration && declaration.name() != null) {
                gen.writeStringField("name", declaration.name());
            }
            if (node instanceof LeafElement) {
                gen.writeStringField("text", node.text());
            } else {
                gen.writeArrayFieldStart("children");
                int offset = start;
                for (SyntaxNode child : node.children()) {
                    write(child, offset, gen);
                    offset += child.textLength();
                }
                gen.writeEndArray();
            }
            gen.writeEndObject();
        }
    }

    // ==================== Deserializer ====================

    static class SyntaxNodeDeserializer extends StdDeserializer<SyntaxNode> {

        SyntaxNodeDeserializer() {
            super(SyntaxNode.class);
        }

        @Override
        public SyntaxNode deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonNode tree = p.getCodec().readTree(p);
            return build(tree, p);
        }

        private SyntaxNode build(JsonNode json, JsonParser p) throws IOException {
            if (json == null || !json.isObject()) {
                throw JsonMappingException.from(p, "Expected a node object but found " + json);
            }
            NodeKind kind = kindOf(json, p);
            if (kind.isLeaf()) {
                JsonNode text = json.get("text");
                if (text == null || !text.isTextual()) {
                    throw JsonMappingException.from(p, "Leaf of kind " + kind + " has no text");
                }
                return new LeafElement(kind, text.asText());
            }
            CompositeElement composite = CompositeElement.create(kind);
            JsonNode children = json.get("children");
            if (children != null) {
                if (!children.isArray()) {
                    throw JsonMappingException.from(p, "'children' of " + kind + " is not an array");
                }
                for (JsonNode child : children) {
                    composite.addChild(build(child, p));
                }
            }
            return composite;
        }

        private static NodeKind kindOf(JsonNode json, JsonParser p) throws JsonMappingException {
            JsonNode kind = json.get("kind");
            if (kind == null || !kind.isTextual()) {
                throw JsonMappingException.from(p, "Node has no 'kind'");
            }
            try {
                return NodeKind.valueOf(kind.asText());
            } catch (IllegalArgumentException e) {
                throw JsonMappingException.from(p, "Unknown node kind '" + kind.asText() + "'", e);
            }
        }
    }
}
