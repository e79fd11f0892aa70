package io.orderedjson.core;

/**
 * Enumeration of JSON value types.
 */
public enum JsonValueType {
    OBJECT,
    ARRAY,
    STRING,
    NUMBER,
    BOOLEAN,
    NULL
}
