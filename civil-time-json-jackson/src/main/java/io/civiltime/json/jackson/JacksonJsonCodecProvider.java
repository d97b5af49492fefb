package io.civiltime.json.jackson;

import io.civiltime.json.spi.JsonCodec;
import io.civiltime.json.spi.JsonCodecProvider;

/**
 * ServiceLoader provider for {@link JacksonJsonCodec}.
 */
public final class JacksonJsonCodecProvider implements JsonCodecProvider {
    @Override
    public String name() {
        return "jackson";
    }

    @Override
    public JsonCodec create() {
        return new JacksonJsonCodec();
    }
}
