package io.civiltime.json.spi;

/**
 * ServiceLoader entry point for a {@link JsonCodec} implementation.
 *
 * <p>Implementations are listed in {@code META-INF/services/io.civiltime.json.spi.JsonCodecProvider}.
 */
public interface JsonCodecProvider {

    /**
     * Short name of the backing library, e.g. {@code "jackson"}.
     */
    String name();

    JsonCodec create();
}
