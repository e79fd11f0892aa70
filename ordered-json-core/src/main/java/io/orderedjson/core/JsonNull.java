package io.orderedjson.core;

/**
 * The JSON literal {@code null}.
 */
public final class JsonNull implements JsonValue {
    public static final JsonNull INSTANCE = new JsonNull();

    private JsonNull() {
    }

    @Override
    public JsonValueType getValueType() {
        return JsonValueType.NULL;
    }

    @Override
    public String toString() {
        return "null";
    }
}
