package com.sandkev.tradevol.exchange;

import com.sandkev.tradevol.shared.error.SerializationException;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Typed access to loosely-typed JSON ({@code Map<String, Object>}) responses.
 * Missing or malformed values raise {@link SerializationException}.
 */
public final class Payloads {

    private Payloads() {}

    @SuppressWarnings("unchecked")
    public static Map<String, Object> map(String source, Object value, String what) {
        if (value instanceof Map<?, ?> m) return (Map<String, Object>) m;
        throw malformed(source, what, value);
    }

    @SuppressWarnings("unchecked")
    public static List<Object> list(String source, Object value, String what) {
        if (value instanceof List<?> l) return (List<Object>) l;
        throw malformed(source, what, value);
    }

    public static BigDecimal decimal(String source, Map<String, Object> m, String field) {
        return decimal(source, m.get(field), field);
    }

    public static BigDecimal decimal(String source, Object value, String what) {
        if (value == null) throw malformed(source, what, null);
        try {
            return new BigDecimal(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new SerializationException(source, what + " is not a number: " + value, e);
        }
    }

    /** Integral millisecond timestamp; fractions or out-of-range values are malformed. */
    public static long epochMillis(String source, Object value, String what) {
        try {
            return decimal(source, value, what).longValueExact();
        } catch (ArithmeticException e) {
            throw new SerializationException(source, what + " is not an epoch millisecond value: " + value, e);
        }
    }

    public static long longValue(String source, Map<String, Object> m, String field) {
        Object v = m.get(field);
        if (v instanceof Number n) return n.longValue();
        return decimal(source, v, field).longValue();
    }

    public static String string(String source, Map<String, Object> m, String field) {
        Object v = m.get(field);
        if (v == null) throw malformed(source, field, null);
        return String.valueOf(v);
    }

    private static SerializationException malformed(String source, String what, Object value) {
        String type = value == null ? "null" : value.getClass().getSimpleName();
        return new SerializationException(source, "unexpected " + what + " (" + type + ")", null);
    }
}
