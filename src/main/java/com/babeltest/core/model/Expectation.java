package com.babeltest.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * An assertion about the return value of a test target.
 *
 * @param type  how {@code value} is compared against the actual result; defaults to {@link ExpectationType#EXACT}
 * @param value expected value, meaning depends on {@code type}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Expectation(
    ExpectationType type,
    Object value
) {
    public Expectation {
        if (type == null) {
            type = ExpectationType.EXACT;
        }
    }

    public static Expectation exact(Object value) {
        return new Expectation(ExpectationType.EXACT, value);
    }

    public static Expectation contains(Object value) {
        return new Expectation(ExpectationType.CONTAINS, value);
    }
}
