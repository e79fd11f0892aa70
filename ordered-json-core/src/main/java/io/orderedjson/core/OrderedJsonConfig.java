package io.orderedjson.core;

import java.io.Serializable;

/**
 * Codec configuration.
 *
 * <p>Immutable. Use {@link #DEFAULT} unless a different nesting limit or indented output
 * is needed.
 */
public final class OrderedJsonConfig implements Serializable {
    private static final long serialVersionUID = 1L;

    public static final int DEFAULT_MAX_DEPTH = 500;

    public static final OrderedJsonConfig DEFAULT = new OrderedJsonConfig(DEFAULT_MAX_DEPTH, false);

    private final int maxDepth;
    private final boolean indentOutput;

    /**
     * @param maxDepth maximum number of nested objects and arrays accepted when decoding
     * @param indentOutput whether the codec writes indented instead of compact JSON
     * @throws IllegalArgumentException if {@code maxDepth < 1}
     */
    public OrderedJsonConfig(int maxDepth, boolean indentOutput) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be >= 1, got " + maxDepth);
        }
        this.maxDepth = maxDepth;
        this.indentOutput = indentOutput;
    }

    /**
     * Maximum nesting depth for decoding. The top-level object counts as depth 1.
     */
    public int maxDepth() {
        return maxDepth;
    }

    /**
     * Whether encoded output is indented.
     */
    public boolean indentOutput() {
        return indentOutput;
    }

    public OrderedJsonConfig withMaxDepth(int maxDepth) {
        return new OrderedJsonConfig(maxDepth, indentOutput);
    }

    public OrderedJsonConfig withIndentOutput(boolean indentOutput) {
        return new OrderedJsonConfig(maxDepth, indentOutput);
    }

    @Override
    public String toString() {
        return "OrderedJsonConfig{maxDepth=" + maxDepth + ", indentOutput=" + indentOutput + "}";
    }
}
