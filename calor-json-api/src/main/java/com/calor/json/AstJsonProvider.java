package com.calor.json;

import java.util.ServiceLoader;

/**
 * Pluggable JSON binding for the Calor tree. Implementations register themselves in
 * {@code META-INF/services/com.calor.json.AstJsonProvider} and are found with
 * {@link ServiceLoader}, so putting {@code calor-jackson} on the classpath is enough:
 *
 * <pre>{@code
 * AstJsonProvider provider = AstJsonProvider.getProvider();
 * String json = provider.getSerializer().serialize(program);
 * Program copy = provider.getDeserializer().deserializeProgram(json);
 * }</pre>
 */
public interface AstJsonProvider {

    AstJsonSerializer getSerializer();

    AstJsonDeserializer getDeserializer();

    /**
     * Short name used by {@link #getProvider(String)}, e.g. {@code "Jackson"}.
     */
    String getName();

    /**
     * @throws IllegalStateException if no provider is on the classpath
     */
    static AstJsonProvider getProvider() {
        for (AstJsonProvider provider : ServiceLoader.load(AstJsonProvider.class)) {
            return provider;
        }
        throw new IllegalStateException(
            "No AstJsonProvider found on the classpath. Add calor-jackson (or another provider) to your dependencies.");
    }

    /**
     * @throws IllegalStateException if no provider with that name (ignoring case) is on the classpath
     */
    static AstJsonProvider getProvider(String name) {
        for (AstJsonProvider provider : ServiceLoader.load(AstJsonProvider.class)) {
            if (provider.getName().equalsIgnoreCase(name)) {
                return provider;
            }
        }
        throw new IllegalStateException("No AstJsonProvider named '" + name + "' found on the classpath.");
    }

    static boolean isProviderAvailable() {
        return ServiceLoader.load(AstJsonProvider.class).iterator().hasNext();
    }
}
