package io.orderedjson.core;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * An ordered sequence of JSON values.
 *
 * <p>Not thread-safe. Callers that share an instance across threads must serialize access.
 */
public final class JsonArray implements JsonValue, Iterable<JsonValue> {
    private final List<JsonValue> elements = new ArrayList<>();

    public JsonArray() {
    }

    public static JsonArray of(JsonValue... values) {
        JsonArray array = new JsonArray();
        for (JsonValue value : values) {
            array.add(value);
        }
        return array;
    }

    /**
     * Appends a value. {@code null} is stored as {@link JsonNull#INSTANCE}.
     */
    public JsonArray add(JsonValue value) {
        elements.add(value == null ? JsonNull.INSTANCE : value);
        return this;
    }

    public JsonArray add(String value) {
        return add(value == null ? JsonNull.INSTANCE : JsonString.of(value));
    }

    public JsonArray add(long value) {
        return add(JsonNumber.of(value));
    }

    public JsonArray add(double value) {
        return add(JsonNumber.of(value));
    }

    public JsonArray add(BigDecimal value) {
        return add(value == null ? JsonNull.INSTANCE : JsonNumber.of(value));
    }

    public JsonArray add(boolean value) {
        return add(JsonBoolean.of(value));
    }

    /**
     * Appends a new empty object and returns it.
     */
    public OrderedMap addObject() {
        OrderedMap child = new OrderedMap();
        add(child);
        return child;
    }

    /**
     * Appends a new empty array and returns it.
     */
    public JsonArray addArray() {
        JsonArray child = new JsonArray();
        add(child);
        return child;
    }

    /**
     * @throws IndexOutOfBoundsException if {@code index} is out of range
     */
    public JsonValue get(int index) {
        return elements.get(index);
    }

    public int size() {
        return elements.size();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    /**
     * Read-only view of the elements in order.
     */
    public List<JsonValue> values() {
        return Collections.unmodifiableList(elements);
    }

    @Override
    public Iterator<JsonValue> iterator() {
        return values().iterator();
    }

    @Override
    public JsonValueType getValueType() {
        return JsonValueType.ARRAY;
    }

    @Override
    public JsonArray asArray() {
        return this;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof JsonArray other)) return false;
        return elements.equals(other.elements);
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }

    @Override
    public String toString() {
        return elements.toString();
    }
}
