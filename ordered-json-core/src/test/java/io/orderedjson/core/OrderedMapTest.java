package io.orderedjson.core;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OrderedMapTest {

    @Test
    void keysFollowInsertionOrderNotSortOrder() {
        OrderedMap map = new OrderedMap()
                .put("zip", "94043")
                .put("country", "US")
                .put("lat", 37.4192)
                .put("mobile", true);

        assertThat(map.keys()).containsExactly("zip", "country", "lat", "mobile");
        assertThat(map.size()).isEqualTo(4);
    }

    @Test
    void setExistingKeyUpdatesValueInPlace() {
        OrderedMap map = new OrderedMap().put("a", 1).put("b", 2).put("a", 3);

        assertThat(map.keys()).containsExactly("a", "b");
        assertThat(map.get("a")).contains(JsonNumber.of(3));
    }

    @Test
    void getReportsAbsentKey() {
        OrderedMap map = new OrderedMap().put("a", "x");

        assertThat(map.get("missing")).isEmpty();
        assertThat(map.containsKey("missing")).isFalse();
        assertThat(map.get("a")).contains(JsonString.of("x"));
    }

    @Test
    void nullValueIsStoredAsJsonNull() {
        OrderedMap map = new OrderedMap().set("n", null).put("s", (String) null);

        assertThat(map.get("n")).contains(JsonNull.INSTANCE);
        assertThat(map.get("s")).contains(JsonNull.INSTANCE);
        assertThat(map.keys()).containsExactly("n", "s");
    }

    @Test
    void nullKeyIsRejected() {
        assertThatThrownBy(() -> new OrderedMap().put(null, 1))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void removeIsUnsupportedAndLeavesMapIntact() {
        OrderedMap map = new OrderedMap().put("a", 1);

        assertThatThrownBy(() -> map.remove("a"))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThat(map.keys()).containsExactly("a");
        assertThat(map.containsKey("a")).isTrue();
    }

    @Test
    void keysViewIsReadOnlyAndLive() {
        OrderedMap map = new OrderedMap().put("a", 1);
        List<String> keys = map.keys();

        assertThatThrownBy(() -> keys.add("b")).isInstanceOf(UnsupportedOperationException.class);
        map.put("b", 2);
        assertThat(keys).containsExactly("a", "b");
    }

    @Test
    void entriesTraverseInKeyOrderAndRestartOnEachCall() {
        OrderedMap map = new OrderedMap().put("b", 1).put("a", 2).put("c", 3);

        List<String> first = new ArrayList<>();
        map.entries().forEachRemaining(e -> first.add(e.getKey() + "=" + e.getValue()));
        List<String> second = new ArrayList<>();
        map.entries().forEachRemaining(e -> second.add(e.getKey() + "=" + e.getValue()));

        assertThat(first).containsExactly("b=1", "a=2", "c=3");
        assertThat(second).isEqualTo(first);
    }

    @Test
    void entriesReadValuesLazily() {
        OrderedMap map = new OrderedMap().put("a", 1).put("b", 2);
        Iterator<Map.Entry<String, JsonValue>> it = map.entries();

        assertThat(it.next().getValue()).isEqualTo(JsonNumber.of(1));
        map.put("b", "updated");
        assertThat(it.next().getValue()).isEqualTo(JsonString.of("updated"));
        assertThat(it.hasNext()).isFalse();
    }

    @Test
    void addingKeyDuringTraversalFailsFast() {
        OrderedMap map = new OrderedMap().put("a", 1).put("b", 2);
        Iterator<Map.Entry<String, JsonValue>> it = map.entries();
        it.next();

        map.put("c", 3);

        assertThatThrownBy(it::next).isInstanceOf(ConcurrentModificationException.class);
    }

    @Test
    void forEachVisitsInKeyOrder() {
        OrderedMap map = new OrderedMap().put("second", 2).put("first", 1);
        List<String> visited = new ArrayList<>();

        map.forEach((k, v) -> visited.add(k));

        assertThat(visited).containsExactly("second", "first");
    }

    @Test
    void putObjectAndPutArrayReturnAttachedChildren() {
        OrderedMap root = new OrderedMap();
        root.putObject("meta").put("v", 1);
        root.putArray("items").add(3).add(4).addObject().put("k", "x");

        assertThat(root.keys()).containsExactly("meta", "items");
        assertThat(root.get("meta").orElseThrow().asObject().get("v")).contains(JsonNumber.of(1));
        JsonArray items = root.get("items").orElseThrow().asArray();
        assertThat(items.size()).isEqualTo(3);
        assertThat(items.get(2).asObject().keys()).containsExactly("k");
    }

    @Test
    void decimalsAndNestedArraysKeepTheirText() {
        OrderedMap root = new OrderedMap().put("price", new BigDecimal("19.90"));
        JsonArray matrix = root.putArray("matrix");
        matrix.addArray().add(new BigDecimal("1.10")).add(2);
        matrix.addArray();

        assertThat(root.get("price")).contains(JsonNumber.parse("19.90"));
        assertThat(matrix.size()).isEqualTo(2);
        assertThat(matrix.get(0).asArray().values())
                .containsExactly(JsonNumber.parse("1.10"), JsonNumber.of(2));
        assertThat(matrix.get(1).asArray().isEmpty()).isTrue();
    }

    @Test
    void equalityIsOrderSensitive() {
        OrderedMap ab = new OrderedMap().put("a", 1).put("b", 2);
        OrderedMap ab2 = new OrderedMap().put("a", 1).put("b", 2);
        OrderedMap ba = new OrderedMap().put("b", 2).put("a", 1);

        assertThat(ab).isEqualTo(ab2).hasSameHashCodeAs(ab2);
        assertThat(ab).isNotEqualTo(ba);
    }

    @Test
    void narrowingToWrongCaseFails() {
        JsonValue map = new OrderedMap();

        assertThat(map.getValueType()).isEqualTo(JsonValueType.OBJECT);
        assertThat(map.isObject()).isTrue();
        assertThatThrownBy(map::asArray)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("OBJECT");
    }
}
