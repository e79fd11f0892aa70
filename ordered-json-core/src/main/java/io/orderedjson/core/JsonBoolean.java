package io.orderedjson.core;

/**
 * The JSON literals {@code true} and {@code false}.
 */
public final class JsonBoolean implements JsonValue {
    public static final JsonBoolean TRUE = new JsonBoolean(true);
    public static final JsonBoolean FALSE = new JsonBoolean(false);

    private final boolean value;

    private JsonBoolean(boolean value) {
        this.value = value;
    }

    public static JsonBoolean of(boolean value) {
        return value ? TRUE : FALSE;
    }

    public boolean value() {
        return value;
    }

    @Override
    public JsonValueType getValueType() {
        return JsonValueType.BOOLEAN;
    }

    @Override
    public JsonBoolean asBoolean() {
        return this;
    }

    @Override
    public String toString() {
        return Boolean.toString(value);
    }
}
