package io.civiltime.core;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Text encoding of a civil value, the form used for JSON strings and storage scalars.
 *
 * <p>Serialization bindings (Jackson modules and the like) wire these into their own string hooks.
 *
 * @param <T> the civil value type
 */
public interface TextCodec<T> {

    Class<T> type();

    /**
     * @throws CivilTimeException.OutOfRange if the value cannot be represented
     */
    String toText(T value);

    /**
     * @throws CivilTimeException.ParseFailure if the text is malformed or names an invalid value
     */
    T fromText(String text);

    /**
     * The codecs for {@link Date}, {@link Time} and {@link DateTime}.
     */
    static List<TextCodec<?>> all() {
        return List.of(Date.TEXT, Time.TEXT, DateTime.TEXT);
    }

    static <T> TextCodec<T> of(Class<T> type, Function<T, String> encoder, Function<String, T> decoder) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(encoder, "encoder");
        Objects.requireNonNull(decoder, "decoder");
        return new TextCodec<>() {
            @Override
            public Class<T> type() {
                return type;
            }

            @Override
            public String toText(T value) {
                return encoder.apply(value);
            }

            @Override
            public T fromText(String text) {
                return decoder.apply(text);
            }

            @Override
            public String toString() {
                return "TextCodec[" + type.getSimpleName() + "]";
            }
        };
    }
}
