package com.babeltest.core.resolve;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How long a constructed receiver is reused by the {@link InstanceRegistry}.
 */
public enum InstanceLifecycle {
    /** One instance for the whole run. */
    SHARED,
    /** Cache cleared when a suite begins. */
    PER_SUITE,
    /** Cache cleared before every test. */
    PER_TEST;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static InstanceLifecycle fromWire(String value) {
        if (value == null || value.isBlank()) {
            return SHARED;
        }
        return valueOf(value.trim().replace('-', '_').toUpperCase(Locale.ROOT));
    }
}
