package io.orderedjson.core;

/**
 * Raised when a contained value cannot be rendered as JSON, for example a
 * non-finite {@link JsonNumber}. The whole encode is aborted.
 */
public class JsonEncodeException extends JsonException {
    public JsonEncodeException(String message) {
        super(message);
    }

    public JsonEncodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
