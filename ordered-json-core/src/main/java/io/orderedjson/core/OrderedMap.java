package io.orderedjson.core;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiConsumer;

/**
 * A JSON object that remembers the order in which its keys were first set.
 *
 * <p>The JSON specification says member order is insignificant, but some third-party
 * producers and consumers depend on it. Decoding into an {@code OrderedMap} and encoding it
 * again reproduces the members in the order they arrived.
 *
 * <p>Setting an existing key replaces its value without moving it. Keys are never removed:
 * {@link #remove(String)} is unsupported.
 *
 * <p>Not thread-safe. Concurrent reads and writes, including iterating while another
 * thread calls {@link #set}, must be serialized by the caller, e.g. with one lock per map.
 */
public final class OrderedMap implements JsonValue {
    private final Map<String, JsonValue> entries = new HashMap<>();
    private final List<String> order = new ArrayList<>();

    public OrderedMap() {
    }

    /**
     * Inserts or updates a member. A new key is appended to the key order; an existing key
     * keeps its position. {@code null} is stored as {@link JsonNull#INSTANCE}.
     * @return this map
     */
    public OrderedMap set(String key, JsonValue value) {
        Objects.requireNonNull(key, "key");
        JsonValue v = value == null ? JsonNull.INSTANCE : value;
        if (entries.put(key, v) == null) {
            order.add(key);
        }
        return this;
    }

    public OrderedMap put(String key, String value) {
        return set(key, value == null ? JsonNull.INSTANCE : JsonString.of(value));
    }

    public OrderedMap put(String key, long value) {
        return set(key, JsonNumber.of(value));
    }

    public OrderedMap put(String key, double value) {
        return set(key, JsonNumber.of(value));
    }

    public OrderedMap put(String key, BigDecimal value) {
        return set(key, value == null ? JsonNull.INSTANCE : JsonNumber.of(value));
    }

    public OrderedMap put(String key, boolean value) {
        return set(key, JsonBoolean.of(value));
    }

    /**
     * Sets {@code key} to a new empty object and returns the child.
     */
    public OrderedMap putObject(String key) {
        OrderedMap child = new OrderedMap();
        set(key, child);
        return child;
    }

    /**
     * Sets {@code key} to a new empty array and returns the child.
     */
    public JsonArray putArray(String key) {
        JsonArray child = new JsonArray();
        set(key, child);
        return child;
    }

    /**
     * Looks up a member.
     * @return the value, or empty if the key was never set
     */
    public Optional<JsonValue> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    public boolean containsKey(String key) {
        return entries.containsKey(key);
    }

    /**
     * Always fails. Removing a key would have to keep the key order consistent, which this
     * map does not support.
     * @throws UnsupportedOperationException always
     */
    public JsonValue remove(String key) {
        throw new UnsupportedOperationException("OrderedMap does not support removing keys");
    }

    /**
     * Read-only view of the keys in first-insertion order.
     */
    public List<String> keys() {
        return Collections.unmodifiableList(order);
    }

    /**
     * Returns a single-pass iterator over the members in key order. Each call starts a
     * fresh traversal. Values are read lazily as the iterator advances; setting a new key
     * during iteration makes the iterator throw {@link java.util.ConcurrentModificationException}.
     */
    public Iterator<Map.Entry<String, JsonValue>> entries() {
        Iterator<String> keys = order.iterator();
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return keys.hasNext();
            }

            @Override
            public Map.Entry<String, JsonValue> next() {
                String key = keys.next();
                return Map.entry(key, entries.get(key));
            }
        };
    }

    /**
     * Visits every member in key order.
     */
    public void forEach(BiConsumer<? super String, ? super JsonValue> action) {
        Objects.requireNonNull(action, "action");
        for (String key : order) {
            action.accept(key, entries.get(key));
        }
    }

    public int size() {
        return order.size();
    }

    public boolean isEmpty() {
        return order.isEmpty();
    }

    @Override
    public JsonValueType getValueType() {
        return JsonValueType.OBJECT;
    }

    @Override
    public OrderedMap asObject() {
        return this;
    }

    /**
     * Two maps are equal when they hold equal values under the same keys in the same order.
     */
    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof OrderedMap other)) return false;
        return order.equals(other.order) && entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return 31 * order.hashCode() + entries.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        for (int i = 0; i < order.size(); i++) {
            if (i > 0) sb.append(", ");
            String key = order.get(i);
            sb.append(key).append('=').append(entries.get(key));
        }
        return sb.append('}').toString();
    }
}
