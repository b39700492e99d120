package com.babeltest.core.diagnostics;

import java.lang.reflect.Array;
import java.util.Collection;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Renders values for assertion messages, truncating long representations.
 */
public final class ValueFormatter {

    public static final int DEFAULT_MAX_LENGTH = 100;

    private ValueFormatter() {}

    public static String format(Object value) {
        return format(value, DEFAULT_MAX_LENGTH);
    }

    public static String format(Object value, int maxLength) {
        String repr = repr(value);
        if (repr.length() > maxLength) {
            return repr.substring(0, maxLength - 3) + "...";
        }
        return repr;
    }

    /** Two-line expected/actual rendering used by equality failures. */
    public static String diff(Object expected, Object actual) {
        return "Expected: " + format(expected) + "\n  Actual: " + format(actual);
    }

    private static String repr(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof CharSequence s) {
            return "'" + s + "'";
        }
        if (value instanceof Map<?, ?> map) {
            return map.entrySet().stream()
                    .map(e -> repr(e.getKey()) + ": " + repr(e.getValue()))
                    .collect(Collectors.joining(", ", "{", "}"));
        }
        if (value instanceof Collection<?> c) {
            return c.stream().map(ValueFormatter::repr).collect(Collectors.joining(", ", "[", "]"));
        }
        if (value.getClass().isArray()) {
            return IntStream.range(0, Array.getLength(value))
                    .mapToObj(i -> repr(Array.get(value, i)))
                    .collect(Collectors.joining(", ", "[", "]"));
        }
        return String.valueOf(value);
    }
}
