package com.babeltest.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * A named group of tests sharing an optional default target.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SuiteSpec(
    String name,
    String target,
    List<TestSpec> tests
) {
    public SuiteSpec {
        tests = tests == null ? List.of() : List.copyOf(tests);
    }
}
