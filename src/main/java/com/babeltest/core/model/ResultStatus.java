package com.babeltest.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Outcome of a single test.
 */
public enum ResultStatus {
    PASSED,
    FAILED,
    ERROR,   // test could not run to a verdict (resolution, construction, protocol, unexpected failure)
    SKIPPED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Maps a status string reported by an out-of-process runtime. Anything unrecognised is an error.
     */
    public static ResultStatus fromWire(String value) {
        if (value == null) {
            return ERROR;
        }
        for (ResultStatus status : values()) {
            if (status.wireName().equalsIgnoreCase(value.trim())) {
                return status;
            }
        }
        return ERROR;
    }
}
