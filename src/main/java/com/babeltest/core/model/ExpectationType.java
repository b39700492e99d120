package com.babeltest.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of assertion made about a test's return value.
 */
public enum ExpectationType {
    EXACT,
    CONTAINS,
    TYPE,
    NULL,
    NOT_NULL,
    TRUE,
    FALSE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ExpectationType fromWire(String value) {
        if (value == null || value.isBlank()) {
            return EXACT;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
