package com.proxymirror.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Factory for ObjectMapper instances that handle syntax trees and conventions files.
 *
 * <pre>
 * ObjectMapper mapper = ProxyMirrorJackson.createObjectMapper();
 * String json = mapper.writeValueAsString(sourceFile);
 * SyntaxNode node = mapper.readValue(json, SyntaxNode.class);
 * </pre>
 */
public final class ProxyMirrorJackson {

    private ProxyMirrorJackson() {
        // Utility class
    }

    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new ParameterNamesModule());
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        // Conventions files may carry keys of newer versions
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.registerModule(new SyntaxTreeModule());
        return mapper;
    }
}
