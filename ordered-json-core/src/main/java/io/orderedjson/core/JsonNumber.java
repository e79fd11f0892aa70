package io.orderedjson.core;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A JSON number kept in its original textual form.
 *
 * <p>Decoding never converts to a binary type, so {@code 12345678901234567890.000000000001}
 * survives a decode/encode round trip unchanged. Conversion happens only when one of the
 * {@code *Value()} or {@code toBig*()} methods is called. Two numbers are equal when their
 * text is equal: {@code 1.0} and {@code 1} are different values.
 */
public final class JsonNumber implements JsonValue {
    private static final Pattern GRAMMAR = Pattern.compile("-?(?:0|[1-9][0-9]*)(?:\\.[0-9]+)?(?:[eE][+-]?[0-9]+)?");

    /** Largest exponent magnitude {@link #toBigInteger()} will expand; Jackson's default. */
    public static final int MAX_BIG_INTEGER_SCALE = 100_000;

    private final String text;

    private JsonNumber(String text) {
        this.text = text;
    }

    /**
     * Parses number text as it appears in a JSON document.
     * @param text the digits, e.g. {@code -0.5e10}
     * @throws NumberFormatException if {@code text} is not a JSON number
     */
    public static JsonNumber parse(String text) {
        Objects.requireNonNull(text, "text");
        if (!GRAMMAR.matcher(text).matches()) {
            throw new NumberFormatException("not a JSON number: \"" + text + "\"");
        }
        return new JsonNumber(text);
    }

    public static JsonNumber of(long value) {
        return new JsonNumber(Long.toString(value));
    }

    public static JsonNumber of(BigInteger value) {
        return new JsonNumber(value.toString());
    }

    public static JsonNumber of(BigDecimal value) {
        return new JsonNumber(value.toString());
    }

    /**
     * Creates a number from a double. {@code NaN} and the infinities are accepted here
     * but have no JSON representation, so encoding a map that contains one fails.
     */
    public static JsonNumber of(double value) {
        return new JsonNumber(Double.toString(value));
    }

    /**
     * The number exactly as written.
     */
    public String text() {
        return text;
    }

    /**
     * Returns true if the text is valid JSON number syntax, i.e. the value is not
     * {@code NaN} or infinite.
     */
    public boolean isFinite() {
        return GRAMMAR.matcher(text).matches();
    }

    /**
     * Returns true if the text has neither a fraction nor an exponent.
     */
    public boolean isIntegral() {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '.' || c == 'e' || c == 'E') return false;
        }
        return isFinite();
    }

    public BigDecimal toBigDecimal() {
        return new BigDecimal(text);
    }

    /**
     * @throws ArithmeticException if the value has a non-zero fractional part, or its
     *     exponent exceeds {@link #MAX_BIG_INTEGER_SCALE} in magnitude
     */
    public BigInteger toBigInteger() {
        BigDecimal value = toBigDecimal();
        if (Math.abs((long) value.scale()) > MAX_BIG_INTEGER_SCALE) {
            throw new ArithmeticException("scale " + value.scale() + " exceeds maximum of "
                    + MAX_BIG_INTEGER_SCALE + ": " + text);
        }
        return value.toBigIntegerExact();
    }

    /**
     * @throws ArithmeticException if the value is fractional or outside the long range
     */
    public long longValue() {
        if (isIntegral()) {
            try {
                return Long.parseLong(text);
            } catch (NumberFormatException e) {
                throw new ArithmeticException("out of long range: " + text);
            }
        }
        return toBigDecimal().longValueExact();
    }

    /**
     * @throws ArithmeticException if the value is fractional or outside the int range
     */
    public int intValue() {
        return Math.toIntExact(longValue());
    }

    /**
     * Converts to the nearest double; precision beyond a double's may be lost.
     */
    public double doubleValue() {
        return Double.parseDouble(text);
    }

    @Override
    public JsonValueType getValueType() {
        return JsonValueType.NUMBER;
    }

    @Override
    public JsonNumber asNumber() {
        return this;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof JsonNumber other)) return false;
        return text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    @Override
    public String toString() {
        return text;
    }
}
