package io.orderedjson.jackson;

import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import io.orderedjson.core.JsonArray;
import io.orderedjson.core.JsonBoolean;
import io.orderedjson.core.JsonNull;
import io.orderedjson.core.JsonNumber;
import io.orderedjson.core.JsonString;
import io.orderedjson.core.JsonValue;
import io.orderedjson.core.OrderedMap;

import java.io.IOException;
import java.io.Serializable;

/**
 * Recursive-descent decoder over a Jackson token stream.
 *
 * <p>Objects become {@link OrderedMap}s with members in arrival order, arrays become
 * {@link JsonArray}s, and numbers keep the parser's original text. Every method expects
 * the parser to be positioned on the first token of the value and leaves it on the last.
 *
 * <p>Grammar violations are reported as {@link JsonParseException} so that Jackson attaches
 * the location and, inside databind, the property path.
 */
final class JsonValueReader implements Serializable {
    private static final long serialVersionUID = 1L;

    private final int maxDepth;

    JsonValueReader(int maxDepth) {
        if (maxDepth < 1) throw new IllegalArgumentException("maxDepth must be >= 1");
        this.maxDepth = maxDepth;
    }

    /**
     * Reads an object. The current token must be the object open, or the first key or the
     * object close when Jackson has already consumed the open (buffered and polymorphic paths).
     */
    OrderedMap readObject(JsonParser p) throws IOException {
        JsonToken t = p.currentToken();
        if (t == JsonToken.START_OBJECT) {
            return readMembers(p, p.nextToken(), 1);
        }
        if (t == JsonToken.FIELD_NAME || t == JsonToken.END_OBJECT) {
            return readMembers(p, t, 1);
        }
        throw new JsonParseException(p, "Expected object open '{'; found " + describe(t));
    }

    /**
     * Reads any value starting at the current token.
     */
    JsonValue readValue(JsonParser p) throws IOException {
        return readValue(p, p.currentToken(), 0);
    }

    private JsonValue readValue(JsonParser p, JsonToken t, int depth) throws IOException {
        if (t == null) {
            throw new JsonParseException(p, "Expected a value; found end of input");
        }
        switch (t) {
            case START_OBJECT:
                return readMembers(p, p.nextToken(), depth + 1);
            case START_ARRAY:
                return readElements(p, depth + 1);
            case VALUE_STRING:
                return JsonString.of(p.getText());
            case VALUE_NUMBER_INT:
            case VALUE_NUMBER_FLOAT:
                return readNumber(p);
            case VALUE_TRUE:
                return JsonBoolean.TRUE;
            case VALUE_FALSE:
                return JsonBoolean.FALSE;
            case VALUE_NULL:
                return JsonNull.INSTANCE;
            case END_OBJECT:
            case END_ARRAY:
            case FIELD_NAME:
                throw new JsonParseException(p, "Unexpected delimiter: " + describe(t));
            default:
                throw new JsonParseException(p, "Unexpected token: " + describe(t));
        }
    }

    // t is the token after '{'
    private OrderedMap readMembers(JsonParser p, JsonToken t, int depth) throws IOException {
        checkDepth(p, depth);
        OrderedMap map = new OrderedMap();
        for (; t != JsonToken.END_OBJECT; t = p.nextToken()) {
            if (t == null) {
                throw new JsonParseException(p, "Expected object close '}'; found end of input");
            }
            if (t != JsonToken.FIELD_NAME) {
                throw new JsonParseException(p, "Object key must be a string; found " + describe(t));
            }
            String key = p.currentName();
            map.set(key, readValue(p, p.nextToken(), depth));
        }
        return map;
    }

    private JsonArray readElements(JsonParser p, int depth) throws IOException {
        checkDepth(p, depth);
        JsonArray array = new JsonArray();
        JsonToken t;
        while ((t = p.nextToken()) != JsonToken.END_ARRAY) {
            if (t == null) {
                throw new JsonParseException(p, "Expected array close ']'; found end of input");
            }
            array.add(readValue(p, t, depth));
        }
        return array;
    }

    private static JsonNumber readNumber(JsonParser p) throws IOException {
        String text = p.getText();
        try {
            return JsonNumber.parse(text);
        } catch (NumberFormatException e) {
            throw new JsonParseException(p, "Number has no JSON representation: " + text, e);
        }
    }

    private void checkDepth(JsonParser p, int depth) throws JsonParseException {
        if (depth > maxDepth) {
            throw new JsonParseException(p, "Nesting depth exceeds maximum of " + maxDepth);
        }
    }

    private static String describe(JsonToken t) {
        if (t == null) return "end of input";
        String literal = t.asString();
        return literal != null ? "'" + literal + "'" : t.name();
    }
}
