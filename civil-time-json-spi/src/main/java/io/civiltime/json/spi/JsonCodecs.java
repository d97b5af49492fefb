package io.civiltime.json.spi;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.Objects;
import java.util.ServiceLoader;

/**
 * Locates the installed {@link JsonCodec}.
 *
 * <p>Prefer constructing a codec directly where the implementation is known. This lookup is for
 * callers that only depend on the SPI module.
 */
public final class JsonCodecs {
    private static final Logger log = LoggerFactory.getLogger(JsonCodecs.class);

    private JsonCodecs() {}

    /**
     * Creates a codec from the first provider found on the class path.
     *
     * @throws JsonException if no provider is installed
     */
    public static JsonCodec load() throws JsonException {
        return load(Thread.currentThread().getContextClassLoader());
    }

    public static JsonCodec load(ClassLoader classLoader) throws JsonException {
        Iterator<JsonCodecProvider> providers = ServiceLoader.load(JsonCodecProvider.class, classLoader).iterator();
        if (!providers.hasNext()) {
            throw new JsonException("No " + JsonCodecProvider.class.getName() + " found on the class path");
        }
        JsonCodecProvider provider = providers.next();
        log.info("Using JSON codec provider: {}", provider.name());
        return Objects.requireNonNull(provider.create(), "provider returned null codec");
    }
}
