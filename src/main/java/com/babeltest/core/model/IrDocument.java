package com.babeltest.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Root of the persisted intermediate representation: suites plus top-level tests.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IrDocument(
    String version,
    List<SuiteSpec> suites,
    List<TestSpec> tests
) {
    public static final String DEFAULT_VERSION = "0.1";

    public IrDocument {
        if (version == null || version.isBlank()) {
            version = DEFAULT_VERSION;
        }
        suites = suites == null ? List.of() : List.copyOf(suites);
        tests = tests == null ? List.of() : List.copyOf(tests);
    }

    @JsonIgnore
    public int testCount() {
        return tests.size() + suites.stream().mapToInt(s -> s.tests().size()).sum();
    }
}
