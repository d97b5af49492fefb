package io.civiltime.json.spi;

import java.io.InputStream;
import java.util.List;

/**
 * Minimal JSON codec interface providing serialization and deserialization.
 * Implementations wrap a specific JSON library and bind the civil value types
 * ({@code Date}, {@code Time}, {@code DateTime}) to JSON strings.
 *
 * <p>Civil values may appear on their own or as fields of the caller's POJOs.
 */
public interface JsonCodec {

    // ===== Serialization =====

    /**
     * Serializes an object to a JSON byte array.
     * @param value the object to serialize
     * @return JSON bytes
     * @throws JsonException if serialization fails, including a civil value that cannot be encoded
     */
    byte[] writeBytes(Object value) throws JsonException;

    /**
     * Serializes an object to a JSON string.
     * @param value the object to serialize
     * @return JSON string
     * @throws JsonException if serialization fails, including a civil value that cannot be encoded
     */
    String writeString(Object value) throws JsonException;

    // ===== Deserialization =====

    /**
     * Deserializes JSON bytes to a typed object.
     * @param data JSON bytes
     * @param type target class
     * @return deserialized object
     * @throws JsonException if the JSON is malformed or a civil value is rejected
     */
    <T> T readValue(byte[] data, Class<T> type) throws JsonException;

    /**
     * Deserializes JSON string to an object of the specified type.
     * @param json JSON string
     * @param type target class
     * @return deserialized object
     * @throws JsonException if the JSON is malformed or a civil value is rejected
     */
    <T> T readValue(String json, Class<T> type) throws JsonException;

    /**
     * Deserializes JSON input stream to an object of the specified type.
     * @param input JSON input stream
     * @param type target class
     * @return deserialized object
     * @throws JsonException if the JSON is malformed or a civil value is rejected
     */
    <T> T readValue(InputStream input, Class<T> type) throws JsonException;

    /**
     * Deserializes a JSON array to a list of typed objects.
     * @param json JSON string (must be a JSON array)
     * @param elementType element class
     * @return list of deserialized objects
     * @throws JsonException if deserialization fails
     */
    <T> List<T> readList(String json, Class<T> elementType) throws JsonException;
}
