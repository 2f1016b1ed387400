package com.proxymirror.json;

import com.proxymirror.ast.SourceFile;
import com.proxymirror.ast.SyntaxNode;

/**
 * Rebuilds syntax trees from the JSON written by {@link TreeJsonSerializer}. Offsets
 * and names in the input are ignored; they follow from the leaves' text.
 */
public interface TreeJsonDeserializer {

    /**
     * Deserializes a JSON string whose root is a {@code FILE} node.
     *
     * @throws TreeJsonException if deserialization fails
     */
    SourceFile deserializeFile(String json) throws TreeJsonException;

    /**
     * Deserializes a JSON string to a specific node type.
     *
     * @param json the JSON string to deserialize
     * @param type the expected node type
     * @param <T>  the node type
     * @return the deserialized, detached node
     * @throws TreeJsonException if deserialization fails or the root is not a {@code type}
     */
    <T extends SyntaxNode> T deserialize(String json, Class<T> type) throws TreeJsonException;
}
