package com.proxymirror.ast;

import com.proxymirror.ParseException;
import com.proxymirror.Parser;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds new, detached nodes from source text.
 */
public final class NodeFactory {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{(\\w+)\\}");

    private NodeFactory() {
        // Utility class
    }

    /**
     * Parses {@code text} as a single property declaration.
     *
     * @throws IllegalArgumentException if the text is not exactly one property
     */
    public static PropertyDeclaration createProperty(String text) {
        SyntaxNode declaration;
        try {
            declaration = Parser.parseDeclaration(text);
        } catch (ParseException e) {
            throw new IllegalArgumentException("Not a declaration: " + text, e);
        }
        return declaration.as(PropertyDeclaration.class)
            .orElseThrow(() -> new IllegalArgumentException("Not a property declaration: " + text));
    }

    /**
     * Replaces each {@code {key}} placeholder in the template with its value, then
     * parses the result as a property. Substitution is a single pass over the template,
     * so placeholders inside substituted values stay as they are. Placeholders without
     * a value are left untouched.
     */
    public static PropertyDeclaration createFromTemplate(String template, Map<String, String> values) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder text = new StringBuilder();
        while (matcher.find()) {
            String value = values.get(matcher.group(1));
            matcher.appendReplacement(text, Matcher.quoteReplacement(value != null ? value : matcher.group()));
        }
        matcher.appendTail(text);
        return createProperty(text.toString());
    }

    public static LeafElement createWhitespace(String text) {
        if (text.isEmpty() || !text.isBlank()) {
            throw new IllegalArgumentException("Not whitespace: '" + text + "'");
        }
        return new LeafElement(NodeKind.WHITE_SPACE, text);
    }
}
