package com.babeltest.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Side-effect assertions for a test.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MutatesSpec(
    List<CalledAssertion> called
) {
    public MutatesSpec {
        called = called == null ? List.of() : List.copyOf(called);
    }

    public boolean isEmpty() {
        return called.isEmpty();
    }
}
