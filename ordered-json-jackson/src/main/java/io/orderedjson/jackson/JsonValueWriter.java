package io.orderedjson.jackson;

import com.fasterxml.jackson.core.JsonGenerationException;
import com.fasterxml.jackson.core.JsonGenerator;
import io.orderedjson.core.JsonArray;
import io.orderedjson.core.JsonBoolean;
import io.orderedjson.core.JsonNumber;
import io.orderedjson.core.JsonString;
import io.orderedjson.core.JsonValue;
import io.orderedjson.core.OrderedMap;

import java.io.IOException;
import java.util.Iterator;
import java.util.Map;

/**
 * Recursive encoder onto a Jackson generator. Object members are written in key order;
 * indentation is whatever pretty printer the generator carries.
 */
final class JsonValueWriter {
    private JsonValueWriter() {}

    static void write(JsonValue value, JsonGenerator gen) throws IOException {
        if (value == null) {
            gen.writeNull();
            return;
        }
        switch (value.getValueType()) {
            case OBJECT:
                writeObject(narrow(value, OrderedMap.class, gen), gen);
                break;
            case ARRAY:
                writeArray(narrow(value, JsonArray.class, gen), gen);
                break;
            case STRING:
                gen.writeString(narrow(value, JsonString.class, gen).value());
                break;
            case NUMBER:
                writeNumber(narrow(value, JsonNumber.class, gen), gen);
                break;
            case BOOLEAN:
                gen.writeBoolean(narrow(value, JsonBoolean.class, gen).value());
                break;
            case NULL:
                gen.writeNull();
                break;
            default:
                throw new JsonGenerationException("Unsupported JSON value type: " + value.getValueType(), gen);
        }
    }

    private static void writeObject(OrderedMap map, JsonGenerator gen) throws IOException {
        gen.writeStartObject(map);
        Iterator<Map.Entry<String, JsonValue>> it = map.entries();
        while (it.hasNext()) {
            Map.Entry<String, JsonValue> member = it.next();
            gen.writeFieldName(member.getKey());
            write(member.getValue(), gen);
        }
        gen.writeEndObject();
    }

    private static void writeArray(JsonArray array, JsonGenerator gen) throws IOException {
        gen.writeStartArray(array, array.size());
        for (JsonValue element : array) {
            write(element, gen);
        }
        gen.writeEndArray();
    }

    private static void writeNumber(JsonNumber number, JsonGenerator gen) throws IOException {
        if (!number.isFinite()) {
            throw new JsonGenerationException("Number has no JSON representation: " + number.text(), gen);
        }
        gen.writeNumber(number.text());
    }

    // Rejects JsonValue implementations from outside the core model.
    private static <T extends JsonValue> T narrow(JsonValue value, Class<T> type, JsonGenerator gen)
            throws JsonGenerationException {
        if (!type.isInstance(value)) {
            throw new JsonGenerationException("Unsupported JSON value implementation: "
                    + value.getClass().getName() + " (" + value.getValueType() + ")", gen);
        }
        return type.cast(value);
    }
}
