package com.proxymirror.json;

import com.proxymirror.ast.SyntaxNode;

/**
 * Writes syntax trees as JSON.
 *
 * <p>Every node becomes an object with {@code kind}, {@code start} and {@code end}.
 * Leaves add {@code text}, composites add {@code children}, and declarations add
 * their {@code name}.</p>
 */
public interface TreeJsonSerializer {

    /**
     * @throws TreeJsonException if serialization fails
     */
    String serialize(SyntaxNode node) throws TreeJsonException;

    /**
     * @throws TreeJsonException if serialization fails
     */
    String serializePretty(SyntaxNode node) throws TreeJsonException;
}
