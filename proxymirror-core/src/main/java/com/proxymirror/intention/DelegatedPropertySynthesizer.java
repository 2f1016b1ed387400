package com.proxymirror.intention;

import com.proxymirror.ast.Declaration;
import com.proxymirror.ast.NodeFactory;
import com.proxymirror.ast.PropertyDeclaration;

import java.util.Map;

/**
 * Builds the delegated property that mirrors a state property inside the proxy object.
 */
public class DelegatedPropertySynthesizer {

    private final MirrorConventions conventions;

    public DelegatedPropertySynthesizer(MirrorConventions conventions) {
        this.conventions = conventions;
    }

    /**
     * @param identifier the state property's name exactly as written, backticks included
     * @return a detached property declaration
     * @throws IllegalArgumentException if the delegate template does not produce a property
     */
    public PropertyDeclaration build(String identifier) {
        return NodeFactory.createFromTemplate(conventions.delegateTemplate(), Map.of(
            "identifier", identifier,
            "name", Declaration.unquote(identifier)));
    }
}
