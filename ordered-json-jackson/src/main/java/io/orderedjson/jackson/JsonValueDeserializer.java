package io.orderedjson.jackson;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.orderedjson.core.JsonNull;
import io.orderedjson.core.JsonValue;

import java.io.IOException;

/**
 * Jackson deserializer for {@link JsonValue} and its concrete cases.
 *
 * <p>A parser positioned on a key or an object close, as Jackson leaves it on buffered
 * paths, is read as an object already opened.
 *
 * <p>Reads whatever value is present and checks it against the target type, so a
 * {@code JsonArray} property rejects an object. JSON {@code null} maps to
 * {@link JsonNull#INSTANCE} when the target type admits it.
 *
 * @param <T> the target type
 */
public final class JsonValueDeserializer<T extends JsonValue> extends StdDeserializer<T> {
    private final Class<T> type;
    private final JsonValueReader reader;

    public JsonValueDeserializer(Class<T> type, int maxDepth) {
        this(type, new JsonValueReader(maxDepth));
    }

    JsonValueDeserializer(Class<T> type, JsonValueReader reader) {
        super(type);
        this.type = type;
        this.reader = reader;
    }

    @Override
    public T deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonValue value = p.hasToken(JsonToken.FIELD_NAME) || p.hasToken(JsonToken.END_OBJECT)
                ? reader.readObject(p)
                : reader.readValue(p);
        if (!type.isInstance(value)) {
            return ctxt.reportInputMismatch(this, "Cannot read JSON %s as %s",
                    value.getValueType(), type.getSimpleName());
        }
        return type.cast(value);
    }

    @Override
    public T getNullValue(DeserializationContext ctxt) {
        if (type.isInstance(JsonNull.INSTANCE)) {
            return type.cast(JsonNull.INSTANCE);
        }
        return null;
    }

    @Override
    public boolean isCachable() {
        return true;
    }
}
