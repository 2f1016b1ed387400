package com.proxymirror.jackson;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.proxymirror.ast.SourceFile;
import com.proxymirror.ast.SyntaxNode;
import com.proxymirror.json.TreeJsonDeserializer;
import com.proxymirror.json.TreeJsonException;
import com.proxymirror.json.TreeJsonProvider;
import com.proxymirror.json.TreeJsonSerializer;

/**
 * Registered as the {@code Jackson} tree provider. Serializer and deserializer share one
 * mapper configured with {@link SyntaxTreeModule}.
 */
public class JacksonTreeJsonProvider implements TreeJsonProvider {

    private final TreeJsonSerializer serializer;
    private final TreeJsonDeserializer deserializer;

    public JacksonTreeJsonProvider() {
        ObjectMapper mapper = ProxyMirrorJackson.createObjectMapper();
        this.serializer = new JacksonSerializer(mapper);
        this.deserializer = new JacksonDeserializer(mapper);
    }

    @Override
    public TreeJsonSerializer getSerializer() {
        return serializer;
    }

    @Override
    public TreeJsonDeserializer getDeserializer() {
        return deserializer;
    }

    @Override
    public String getName() {
        return "Jackson";
    }

    private static class JacksonSerializer implements TreeJsonSerializer {
        private final ObjectMapper mapper;

        JacksonSerializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public String serialize(SyntaxNode node) throws TreeJsonException {
            try {
                return mapper.writeValueAsString(node);
            } catch (Exception e) {
                throw new TreeJsonException("Failed to serialize " + node.kind() + " node", e);
            }
        }

        @Override
        public String serializePretty(SyntaxNode node) throws TreeJsonException {
            try {
                return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
            } catch (Exception e) {
                throw new TreeJsonException("Failed to serialize " + node.kind() + " node", e);
            }
        }
    }

    private static class JacksonDeserializer implements TreeJsonDeserializer {
        private final ObjectMapper mapper;

        JacksonDeserializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public SourceFile deserializeFile(String json) throws TreeJsonException {
            return deserialize(json, SourceFile.class);
        }

        @Override
        public <T extends SyntaxNode> T deserialize(String json, Class<T> type) throws TreeJsonException {
            SyntaxNode node;
            try {
                node = mapper.readValue(json, SyntaxNode.class);
            } catch (Exception e) {
                throw new TreeJsonException("Failed to deserialize " + type.getSimpleName(), e);
            }
            if (!type.isInstance(node)) {
                throw new TreeJsonException("Expected " + type.getSimpleName() + " but the root is "
                    + (node == null ? "null" : node.kind()));
            }
            return type.cast(node);
        }
    }
}
