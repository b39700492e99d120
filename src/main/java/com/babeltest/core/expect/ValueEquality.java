package com.babeltest.core.expect;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.Objects;

/**
 * Equality between a JSON-like expected value and a Java result. Falls back from
 * {@link Objects#equals} to JSON-tree comparison, where numbers compare by value.
 */
public class ValueEquality {

    private static final Comparator<JsonNode> NUMERIC_LENIENT = (a, b) -> {
        if (a.isNumber() && b.isNumber()) {
            return a.decimalValue().compareTo(b.decimalValue());
        }
        return a.equals(b) ? 0 : 1;
    };

    private final ObjectMapper mapper;

    public ValueEquality(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public boolean equal(Object expected, Object actual) {
        if (Objects.equals(expected, actual)) {
            return true;
        }
        if (expected == null || actual == null) {
            return false;
        }
        if (expected instanceof Number e && actual instanceof Number a) {
            return numericEqual(e, a);
        }
        if (expected instanceof Boolean || actual instanceof Boolean) {
            return false;
        }
        try {
            JsonNode e = mapper.valueToTree(expected);
            JsonNode a = mapper.valueToTree(actual);
            return e.equals(NUMERIC_LENIENT, a);
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    static boolean numericEqual(Number a, Number b) {
        try {
            return new BigDecimal(a.toString()).compareTo(new BigDecimal(b.toString())) == 0;
        } catch (NumberFormatException e) {
            // NaN and infinities
            return Double.compare(a.doubleValue(), b.doubleValue()) == 0;
        }
    }
}
