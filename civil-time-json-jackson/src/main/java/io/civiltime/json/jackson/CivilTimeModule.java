package io.civiltime.json.jackson;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.civiltime.core.TextCodec;

/**
 * Jackson module binding {@code Date}, {@code Time} and {@code DateTime} to JSON strings.
 *
 * <p>Each type is written as its quoted text form and read back through the strict parser of
 * that type. Register it on any {@link com.fasterxml.jackson.databind.ObjectMapper}:
 * <pre>{@code
 * ObjectMapper mapper = new ObjectMapper().registerModule(new CivilTimeModule());
 * }</pre>
 */
public final class CivilTimeModule extends SimpleModule {

    public CivilTimeModule() {
        super(CivilTimeModule.class.getSimpleName());
        for (TextCodec<?> codec : TextCodec.all()) {
            register(codec);
        }
    }

    private <T> void register(TextCodec<T> codec) {
        addSerializer(codec.type(), new TextCodecSerializer<>(codec));
        addDeserializer(codec.type(), new TextCodecDeserializer<>(codec));
    }
}
