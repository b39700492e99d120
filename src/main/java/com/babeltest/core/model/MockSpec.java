package com.babeltest.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Replacement behaviour for one collaborator during a single test.
 *
 * <p>{@code given} is carried through unchanged but never consulted: every call to
 * the mocked target gets the same behaviour regardless of its arguments.
 *
 * @param target  dotted path of the collaborator to replace (e.g. {@code payments.PaymentGateway.charge})
 * @param given   argument matcher, {@code "any"} or a structural constraint
 * @param returns fixed value returned by every call
 * @param raises  failure raised by every call instead of returning
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MockSpec(
    String target,
    Object given,
    Object returns,
    @JsonProperty("throws") ThrowsExpectation raises
) {
    public static final String ANY = "any";

    public MockSpec {
        if (given == null) {
            given = ANY;
        }
    }

    public static MockSpec returning(String target, Object value) {
        return new MockSpec(target, ANY, value, null);
    }

    public static MockSpec raising(String target, ThrowsExpectation failure) {
        return new MockSpec(target, ANY, null, failure);
    }
}
