package io.graphqlsse.json.spi;

import java.util.Iterator;
import java.util.Objects;
import java.util.ServiceLoader;

/**
 * Resolves the installed {@link JsonCodec} via {@link ServiceLoader}.
 *
 * <p>For GraalVM native-image or shaded deployments, pass a codec explicitly instead.
 */
public final class JsonCodecs {
    private JsonCodecs() {}

    public static JsonCodec load() {
        return load(Thread.currentThread().getContextClassLoader());
    }

    public static JsonCodec load(ClassLoader cl) {
        Objects.requireNonNull(cl, "cl");
        Iterator<JsonCodecProvider> providers = ServiceLoader.load(JsonCodecProvider.class, cl).iterator();
        if (!providers.hasNext()) {
            throw new IllegalStateException("No JsonCodecProvider installed; add graphql-sse-json-jackson to the classpath");
        }
        return providers.next().codec();
    }
}
