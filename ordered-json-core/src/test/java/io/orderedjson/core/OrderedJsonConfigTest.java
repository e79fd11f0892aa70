package io.orderedjson.core;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OrderedJsonConfigTest {

    @Test
    void defaultsAreCompactWithBoundedDepth() {
        assertThat(OrderedJsonConfig.DEFAULT.maxDepth()).isEqualTo(OrderedJsonConfig.DEFAULT_MAX_DEPTH);
        assertThat(OrderedJsonConfig.DEFAULT.indentOutput()).isFalse();
    }

    @Test
    void withersReturnModifiedCopies() {
        OrderedJsonConfig config = OrderedJsonConfig.DEFAULT.withMaxDepth(8).withIndentOutput(true);

        assertThat(config.maxDepth()).isEqualTo(8);
        assertThat(config.indentOutput()).isTrue();
        assertThat(OrderedJsonConfig.DEFAULT.maxDepth()).isEqualTo(OrderedJsonConfig.DEFAULT_MAX_DEPTH);
    }

    @Test
    void rejectsNonPositiveDepth() {
        assertThatThrownBy(() -> new OrderedJsonConfig(0, false))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxDepth");
    }
}
