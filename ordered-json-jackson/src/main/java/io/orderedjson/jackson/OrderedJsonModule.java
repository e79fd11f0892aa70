package io.orderedjson.jackson;

import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.module.SimpleModule;
import io.orderedjson.core.JsonArray;
import io.orderedjson.core.JsonBoolean;
import io.orderedjson.core.JsonNull;
import io.orderedjson.core.JsonNumber;
import io.orderedjson.core.JsonString;
import io.orderedjson.core.JsonValue;
import io.orderedjson.core.OrderedJsonConfig;
import io.orderedjson.core.OrderedMap;

import java.util.Objects;

/**
 * Jackson module that binds {@link OrderedMap} and the other {@link JsonValue} types, so
 * they can appear anywhere in a Jackson-mapped object graph:
 * <pre>{@code
 * ObjectMapper mapper = new ObjectMapper().registerModule(new OrderedJsonModule());
 * OrderedMap map = mapper.readValue(json, OrderedMap.class);
 * String again = mapper.writeValueAsString(map);   // same member order
 * }</pre>
 *
 * <p>Also discoverable through {@link java.util.ServiceLoader}, e.g.
 * {@code ObjectMapper.findAndRegisterModules()}, with {@link OrderedJsonConfig#DEFAULT}.
 * Output indentation follows the mapper's own {@code INDENT_OUTPUT} setting.
 */
public final class OrderedJsonModule extends SimpleModule {
    private static final long serialVersionUID = 1L;

    private final OrderedJsonConfig config;

    public OrderedJsonModule() {
        this(OrderedJsonConfig.DEFAULT);
    }

    public OrderedJsonModule(OrderedJsonConfig config) {
        super(OrderedJsonModule.class.getSimpleName(), Version.unknownVersion());
        this.config = Objects.requireNonNull(config, "config");

        JsonValueReader reader = new JsonValueReader(config.maxDepth());
        addSerializer(JsonValue.class, new JsonValueSerializer());
        addDeserializer(OrderedMap.class, new OrderedMapDeserializer(reader));
        addDeserializer(JsonValue.class, new JsonValueDeserializer<>(JsonValue.class, reader));
        addDeserializer(JsonArray.class, new JsonValueDeserializer<>(JsonArray.class, reader));
        addDeserializer(JsonString.class, new JsonValueDeserializer<>(JsonString.class, reader));
        addDeserializer(JsonNumber.class, new JsonValueDeserializer<>(JsonNumber.class, reader));
        addDeserializer(JsonBoolean.class, new JsonValueDeserializer<>(JsonBoolean.class, reader));
        addDeserializer(JsonNull.class, new JsonValueDeserializer<>(JsonNull.class, reader));
    }

    public OrderedJsonConfig getConfig() {
        return config;
    }
}
