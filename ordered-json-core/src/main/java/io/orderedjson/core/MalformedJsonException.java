package io.orderedjson.core;

/**
 * Raised when input does not conform to the JSON object/array grammar at the
 * position examined: a missing open or close delimiter, a non-string key, an
 * unexpected delimiter, trailing tokens after the top-level value, or nesting
 * deeper than {@link OrderedJsonConfig#maxDepth()}.
 *
 * <p>No partial result accompanies this exception.
 */
public class MalformedJsonException extends JsonException {
    public MalformedJsonException(String message) {
        super(message);
    }

    public MalformedJsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
