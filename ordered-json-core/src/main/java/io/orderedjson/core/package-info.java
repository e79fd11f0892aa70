/**
 * Insertion-ordered JSON value model.
 *
 * <p>This module is deliberately library-neutral. It contains only:
 * <ul>
 *   <li>{@link io.orderedjson.core.OrderedMap} and the other {@link io.orderedjson.core.JsonValue} cases</li>
 *   <li>The {@link io.orderedjson.core.OrderedJsonCodec} contract and its exceptions</li>
 *   <li>Codec configuration</li>
 * </ul>
 *
 * <p>The Jackson binding lives in the {@code ordered-json-jackson} module.
 */
package io.orderedjson.core;
