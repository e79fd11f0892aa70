package io.orderedjson.jackson;

import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.orderedjson.core.JsonEncodeException;
import io.orderedjson.core.JsonException;
import io.orderedjson.core.JsonValue;
import io.orderedjson.core.MalformedJsonException;
import io.orderedjson.core.OrderedJsonCodec;
import io.orderedjson.core.OrderedJsonConfig;
import io.orderedjson.core.OrderedMap;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringWriter;
import java.io.Writer;
import java.util.Objects;

/**
 * Jackson implementation of {@link OrderedJsonCodec}.
 *
 * <p>Uses the mapper's {@link JsonFactory} for tokenizing and printing only, so the mapper
 * does not need {@link OrderedJsonModule} registered. Parser and generator features set on
 * the factory (comments, non-numeric numbers, etc.) apply.
 */
public final class JacksonOrderedJsonCodec implements OrderedJsonCodec {
    private final ObjectMapper mapper;
    private final OrderedJsonConfig config;
    private final JsonValueReader reader;

    /**
     * Creates a codec with a default ObjectMapper and {@link OrderedJsonConfig#DEFAULT}.
     */
    public JacksonOrderedJsonCodec() {
        this(OrderedJsonConfig.DEFAULT);
    }

    public JacksonOrderedJsonCodec(OrderedJsonConfig config) {
        this(new ObjectMapper(new JsonFactory()), config);
    }

    /**
     * Creates a codec on top of a caller-configured ObjectMapper.
     * @param mapper the ObjectMapper whose factory is used
     * @param config nesting limit and output indentation
     */
    public JacksonOrderedJsonCodec(ObjectMapper mapper, OrderedJsonConfig config) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.config = Objects.requireNonNull(config, "config");
        this.reader = new JsonValueReader(config.maxDepth());
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getMapper() {
        return mapper;
    }

    public OrderedJsonConfig getConfig() {
        return config;
    }

    @Override
    public OrderedMap readObject(String json) throws JsonException {
        Objects.requireNonNull(json, "json");
        return decode(f -> f.createParser(json), reader::readObject);
    }

    @Override
    public OrderedMap readObject(byte[] data) throws JsonException {
        Objects.requireNonNull(data, "data");
        return decode(f -> f.createParser(data), reader::readObject);
    }

    @Override
    public OrderedMap readObject(InputStream input) throws JsonException {
        Objects.requireNonNull(input, "input");
        return decode(f -> f.createParser(input).disable(JsonParser.Feature.AUTO_CLOSE_SOURCE), reader::readObject);
    }

    @Override
    public JsonValue readValue(String json) throws JsonException {
        Objects.requireNonNull(json, "json");
        return decode(f -> f.createParser(json), reader::readValue);
    }

    @Override
    public JsonValue readValue(byte[] data) throws JsonException {
        Objects.requireNonNull(data, "data");
        return decode(f -> f.createParser(data), reader::readValue);
    }

    @Override
    public String writeString(JsonValue value) throws JsonException {
        Objects.requireNonNull(value, "value");
        StringWriter out = new StringWriter();
        encode(f -> f.createGenerator(out), value);
        return out.toString();
    }

    @Override
    public byte[] writeBytes(JsonValue value) throws JsonException {
        Objects.requireNonNull(value, "value");
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        encode(f -> f.createGenerator(out, JsonEncoding.UTF8), value);
        return out.toByteArray();
    }

    /**
     * Writes a value to a caller-owned writer, which is flushed but not closed.
     */
    public void write(JsonValue value, Writer out) throws JsonException {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(out, "out");
        encode(f -> f.createGenerator(out).disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET), value);
    }

    private <T> T decode(ParserOpener opener, ValueRead<T> read) throws JsonException {
        try (JsonParser p = opener.open(mapper.getFactory())) {
            p.nextToken();
            T result = read.read(p);
            JsonToken trailing = p.nextToken();
            if (trailing != null) {
                throw new JsonParseException(p, "Unexpected trailing input: " + trailing);
            }
            return result;
        } catch (JsonProcessingException e) {
            throw new MalformedJsonException(e.getMessage(), e);
        } catch (IOException e) {
            throw new JsonException("Failed to read JSON", e);
        }
    }

    private void encode(GeneratorOpener opener, JsonValue value) throws JsonException {
        try (JsonGenerator gen = opener.open(mapper.getFactory())) {
            if (config.indentOutput()) {
                gen.useDefaultPrettyPrinter();
            }
            JsonValueWriter.write(value, gen);
        } catch (JsonProcessingException e) {
            throw new JsonEncodeException(e.getMessage(), e);
        } catch (IOException e) {
            throw new JsonException("Failed to write JSON", e);
        }
    }

    @FunctionalInterface
    private interface ParserOpener {
        JsonParser open(JsonFactory factory) throws IOException;
    }

    @FunctionalInterface
    private interface GeneratorOpener {
        JsonGenerator open(JsonFactory factory) throws IOException;
    }

    @FunctionalInterface
    private interface ValueRead<T> {
        T read(JsonParser p) throws IOException;
    }
}
