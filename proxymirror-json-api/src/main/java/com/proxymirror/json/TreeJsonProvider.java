package com.proxymirror.json;

import java.util.ServiceLoader;
import java.util.stream.Stream;

/**
 * Converts syntax trees to and from JSON. Providers register themselves in
 * {@code META-INF/services/com.proxymirror.json.TreeJsonProvider}; the command-line
 * tool uses the first one registered for {@code --dump-tree}.
 *
 * <pre>{@code
 * TreeJsonProvider provider = TreeJsonProvider.getProvider();
 * String json = provider.getSerializer().serialize(file);
 * SourceFile copy = provider.getDeserializer().deserializeFile(json);
 * }</pre>
 */
public interface TreeJsonProvider {

    TreeJsonSerializer getSerializer();

    TreeJsonDeserializer getDeserializer();

    /**
     * Short name used to pick this provider with {@link #getProvider(String)}.
     */
    String getName();

    /**
     * @throws IllegalStateException if no provider is registered
     */
    static TreeJsonProvider getProvider() {
        return registered()
            .findFirst()
            .orElseThrow(() -> new IllegalStateException(
                "No tree JSON provider registered; proxymirror-jackson must be on the runtime path"));
    }

    /**
     * Returns the registered provider called {@code name}, compared without regard to case.
     *
     * @throws IllegalStateException if none of the registered providers has that name
     */
    static TreeJsonProvider getProvider(String name) {
        return registered()
            .filter(provider -> provider.getName().equalsIgnoreCase(name))
            .findFirst()
            .orElseThrow(() -> new IllegalStateException("Unknown tree JSON provider '" + name + "'"));
    }

    static boolean isProviderAvailable() {
        return registered().findAny().isPresent();
    }

    private static Stream<TreeJsonProvider> registered() {
        return ServiceLoader.load(TreeJsonProvider.class).stream().map(ServiceLoader.Provider::get);
    }
}
