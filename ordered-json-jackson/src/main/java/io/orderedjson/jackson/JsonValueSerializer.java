package io.orderedjson.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.orderedjson.core.JsonValue;

import java.io.IOException;

/**
 * Jackson serializer for every {@link JsonValue}, including {@link io.orderedjson.core.OrderedMap}
 * members in key order. Registered by {@link OrderedJsonModule}.
 */
public final class JsonValueSerializer extends StdSerializer<JsonValue> {

    public JsonValueSerializer() {
        super(JsonValue.class);
    }

    @Override
    public void serialize(JsonValue value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        JsonValueWriter.write(value, gen);
    }
}
