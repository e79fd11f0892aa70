package io.orderedjson.core;

/**
 * A decoded JSON value. Exactly one implementation exists per {@link JsonValueType}:
 * <ul>
 *   <li>{@link JsonValueType#OBJECT} - {@link OrderedMap}</li>
 *   <li>{@link JsonValueType#ARRAY} - {@link JsonArray}</li>
 *   <li>{@link JsonValueType#STRING} - {@link JsonString}</li>
 *   <li>{@link JsonValueType#NUMBER} - {@link JsonNumber}</li>
 *   <li>{@link JsonValueType#BOOLEAN} - {@link JsonBoolean}</li>
 *   <li>{@link JsonValueType#NULL} - {@link JsonNull}</li>
 * </ul>
 *
 * <p>Consumers switch on {@link #getValueType()} and narrow with the matching
 * {@code as*} accessor.
 */
public interface JsonValue {

    /**
     * Returns the value type tag.
     */
    JsonValueType getValueType();

    default boolean isObject() {
        return getValueType() == JsonValueType.OBJECT;
    }

    default boolean isArray() {
        return getValueType() == JsonValueType.ARRAY;
    }

    default boolean isString() {
        return getValueType() == JsonValueType.STRING;
    }

    default boolean isNumber() {
        return getValueType() == JsonValueType.NUMBER;
    }

    default boolean isBoolean() {
        return getValueType() == JsonValueType.BOOLEAN;
    }

    default boolean isNull() {
        return getValueType() == JsonValueType.NULL;
    }

    /**
     * Narrows this value to an {@link OrderedMap}.
     * @throws IllegalStateException if this is not an object
     */
    default OrderedMap asObject() {
        throw new IllegalStateException("not an object: " + getValueType());
    }

    /**
     * Narrows this value to a {@link JsonArray}.
     * @throws IllegalStateException if this is not an array
     */
    default JsonArray asArray() {
        throw new IllegalStateException("not an array: " + getValueType());
    }

    /**
     * Narrows this value to a {@link JsonString}.
     * @throws IllegalStateException if this is not a string
     */
    default JsonString asString() {
        throw new IllegalStateException("not a string: " + getValueType());
    }

    /**
     * Narrows this value to a {@link JsonNumber}.
     * @throws IllegalStateException if this is not a number
     */
    default JsonNumber asNumber() {
        throw new IllegalStateException("not a number: " + getValueType());
    }

    /**
     * Narrows this value to a {@link JsonBoolean}.
     * @throws IllegalStateException if this is not a boolean
     */
    default JsonBoolean asBoolean() {
        throw new IllegalStateException("not a boolean: " + getValueType());
    }
}
