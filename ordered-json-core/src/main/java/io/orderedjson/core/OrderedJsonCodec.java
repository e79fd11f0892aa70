package io.orderedjson.core;

import java.io.InputStream;

/**
 * Reads and writes {@link JsonValue} trees while preserving object member order.
 * Implementations wrap a specific streaming JSON library (Jackson, etc.).
 *
 * <p>Implementations are stateless apart from their configuration and may be shared
 * between threads; the values they produce are not.
 */
public interface OrderedJsonCodec {

    // ===== Decoding =====

    /**
     * Decodes a JSON object. The input must contain exactly one object and nothing after it.
     * @param json JSON text
     * @return the object with members in document order
     * @throws MalformedJsonException if the input is not a single well-formed object
     * @throws JsonException if reading fails
     */
    OrderedMap readObject(String json) throws JsonException;

    /**
     * Decodes a JSON object from UTF-8 (or auto-detected) bytes.
     * @see #readObject(String)
     */
    OrderedMap readObject(byte[] data) throws JsonException;

    /**
     * Decodes a JSON object from a stream. The stream is not closed.
     * @see #readObject(String)
     */
    OrderedMap readObject(InputStream input) throws JsonException;

    /**
     * Decodes any single JSON value. Objects at every nesting level keep member order.
     * @throws MalformedJsonException if the input is not a single well-formed value
     * @throws JsonException if reading fails
     */
    JsonValue readValue(String json) throws JsonException;

    /**
     * @see #readValue(String)
     */
    JsonValue readValue(byte[] data) throws JsonException;

    // ===== Encoding =====

    /**
     * Encodes a value to a JSON string, objects in key order.
     * @throws JsonEncodeException if a contained value cannot be rendered as JSON
     */
    String writeString(JsonValue value) throws JsonException;

    /**
     * Encodes a value to UTF-8 JSON bytes, objects in key order.
     * @throws JsonEncodeException if a contained value cannot be rendered as JSON
     */
    byte[] writeBytes(JsonValue value) throws JsonException;
}
