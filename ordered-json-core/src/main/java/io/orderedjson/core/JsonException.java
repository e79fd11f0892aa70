package io.orderedjson.core;

/**
 * Base exception for ordered JSON encoding and decoding failures.
 *
 * <p>Raised by {@link OrderedJsonCodec} implementations. Subclasses distinguish
 * malformed input from values that cannot be rendered; a plain {@code JsonException}
 * reports an I/O failure of the underlying source or sink.
 */
public class JsonException extends Exception {
    public JsonException(String message) {
        super(message);
    }

    public JsonException(String message, Throwable cause) {
        super(message, cause);
    }

    public JsonException(Throwable cause) {
        super(cause);
    }
}
