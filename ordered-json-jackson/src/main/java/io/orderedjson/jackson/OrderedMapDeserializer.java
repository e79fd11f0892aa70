package io.orderedjson.jackson;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.orderedjson.core.OrderedMap;

import java.io.IOException;

/**
 * Jackson deserializer for {@link OrderedMap}. Accepts only a JSON object; members keep
 * document order at every nesting level. Registered by {@link OrderedJsonModule}.
 */
public final class OrderedMapDeserializer extends StdDeserializer<OrderedMap> {
    private final JsonValueReader reader;

    public OrderedMapDeserializer(int maxDepth) {
        this(new JsonValueReader(maxDepth));
    }

    OrderedMapDeserializer(JsonValueReader reader) {
        super(OrderedMap.class);
        this.reader = reader;
    }

    @Override
    public OrderedMap deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        return reader.readObject(p);
    }

    @Override
    public boolean isCachable() {
        return true;
    }
}
