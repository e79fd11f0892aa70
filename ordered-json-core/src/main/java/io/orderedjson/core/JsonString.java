package io.orderedjson.core;

import java.util.Objects;

/**
 * A JSON string.
 */
public final class JsonString implements JsonValue {
    private final String value;

    private JsonString(String value) {
        this.value = value;
    }

    public static JsonString of(String value) {
        return new JsonString(Objects.requireNonNull(value, "value"));
    }

    /**
     * The unescaped string content.
     */
    public String value() {
        return value;
    }

    @Override
    public JsonValueType getValueType() {
        return JsonValueType.STRING;
    }

    @Override
    public JsonString asString() {
        return this;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof JsonString other)) return false;
        return value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
