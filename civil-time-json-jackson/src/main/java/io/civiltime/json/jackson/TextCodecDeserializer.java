package io.civiltime.json.jackson;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.deser.std.StdScalarDeserializer;
import io.civiltime.core.CivilTimeException;
import io.civiltime.core.TextCodec;

import java.io.IOException;

/**
 * Reads a civil value from a JSON string. Any other token is an input mismatch.
 */
final class TextCodecDeserializer<T> extends StdScalarDeserializer<T> {
    private final TextCodec<T> codec;

    TextCodecDeserializer(TextCodec<T> codec) {
        super(codec.type());
        this.codec = codec;
    }

    @Override
    public T deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        if (!p.hasToken(JsonToken.VALUE_STRING)) {
            return ctxt.reportInputMismatch(this, "Expected JSON string for %s, got %s",
                    codec.type().getSimpleName(), p.currentToken());
        }
        String text = p.getText();
        try {
            return codec.fromText(text);
        } catch (CivilTimeException e) {
            throw JsonMappingException.from(p, e.getMessage(), e);
        }
    }
}
