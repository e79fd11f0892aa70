package io.orderedjson.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.orderedjson.core.JsonArray;
import io.orderedjson.core.JsonNumber;
import io.orderedjson.core.JsonValue;
import io.orderedjson.core.JsonValueType;
import io.orderedjson.core.OrderedMap;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonValueSerializerTest {

    private final ObjectMapper mapper = new ObjectMapper().registerModule(new OrderedJsonModule());

    @Test
    void writesCompactObjectInKeyOrder() throws Exception {
        OrderedMap map = new OrderedMap();
        map.put("a", 34);
        map.set("b", JsonArray.of(JsonNumber.of(3), JsonNumber.of(4), JsonNumber.of(5)));

        assertThat(mapper.writeValueAsString(map)).isEqualTo("{\"a\":34,\"b\":[3,4,5]}");
    }

    @Test
    void writesInsertionOrderRatherThanSortedOrder() throws Exception {
        OrderedMap map = new OrderedMap().put("z", "last letter").put("a", "first letter");
        map.putObject("m").put("y", false).put("b", (String) null);

        assertThat(mapper.writeValueAsString(map))
                .isEqualTo("{\"z\":\"last letter\",\"a\":\"first letter\",\"m\":{\"y\":false,\"b\":null}}");
    }

    @Test
    void writesEmptyContainers() throws Exception {
        OrderedMap map = new OrderedMap();
        map.putObject("o");
        map.putArray("a");

        assertThat(mapper.writeValueAsString(map)).isEqualTo("{\"o\":{},\"a\":[]}");
        assertThat(mapper.writeValueAsString(new OrderedMap())).isEqualTo("{}");
    }

    @Test
    void writesNumberTextVerbatim() throws Exception {
        OrderedMap map = new OrderedMap()
                .set("big", JsonNumber.parse("12345678901234567890.000000000001"))
                .set("exp", JsonNumber.parse("1.50E+3"));

        assertThat(mapper.writeValueAsString(map))
                .isEqualTo("{\"big\":12345678901234567890.000000000001,\"exp\":1.50E+3}");
    }

    @Test
    void escapesKeysAndStrings() throws Exception {
        OrderedMap map = new OrderedMap().put("quote\"key", "line\nbreak");

        assertThat(mapper.writeValueAsString(map)).isEqualTo("{\"quote\\\"key\":\"line\\nbreak\"}");
    }

    @Test
    void indentationKeepsKeyOrder() throws Exception {
        OrderedMap map = new OrderedMap().put("second", 2).put("first", 1);

        String pretty = mapper.copy().enable(SerializationFeature.INDENT_OUTPUT).writeValueAsString(map);

        assertThat(pretty).contains("\n");
        assertThat(pretty.indexOf("\"second\"")).isLessThan(pretty.indexOf("\"first\""));
    }

    @Test
    void rejectsNonFiniteNumber() {
        OrderedMap map = new OrderedMap().put("ok", 1).put("bad", Double.NaN);

        assertThatThrownBy(() -> mapper.writeValueAsString(map))
                .isInstanceOf(JsonProcessingException.class)
                .hasMessageContaining("NaN");
    }

    @Test
    void rejectsForeignJsonValueImplementation() {
        JsonValue foreign = () -> JsonValueType.STRING;
        OrderedMap map = new OrderedMap().set("x", foreign);

        assertThatThrownBy(() -> mapper.writeValueAsString(map))
                .isInstanceOf(JsonProcessingException.class)
                .hasMessageContaining("Unsupported JSON value implementation");
    }
}
