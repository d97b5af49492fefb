package io.civiltime.json.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.civiltime.core.CivilTimeException;
import io.civiltime.core.TextCodec;

import java.io.IOException;

/**
 * Writes a civil value as a JSON string.
 */
final class TextCodecSerializer<T> extends StdSerializer<T> {
    private final TextCodec<T> codec;

    TextCodecSerializer(TextCodec<T> codec) {
        super(codec.type());
        this.codec = codec;
    }

    @Override
    public void serialize(T value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        String text;
        try {
            text = codec.toText(value);
        } catch (CivilTimeException e) {
            throw JsonMappingException.from(provider, e.getMessage(), e);
        }
        gen.writeString(text);
    }
}
