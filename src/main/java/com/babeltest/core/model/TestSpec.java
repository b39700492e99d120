package com.babeltest.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A single test case: what to call, with which inputs, and what should happen.
 *
 * <p>Instances are immutable. Suite target inheritance produces a new spec through
 * {@link #withTarget(String)} instead of modifying the original.
 *
 * @param target      dotted path to the function or method under test
 * @param description optional human-readable label
 * @param given       named input parameters
 * @param types       advisory type hints for {@code given} parameters
 * @param expect      return value assertion
 * @param raises      failure assertion (serialized as {@code throws})
 * @param mocks       collaborators replaced for the duration of this test
 * @param mutates     spy assertions checked after the call
 * @param timeoutMs   execution budget in milliseconds
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TestSpec(
    String target,
    String description,
    Map<String, Object> given,
    Map<String, String> types,
    Expectation expect,
    @JsonProperty("throws") ThrowsExpectation raises,
    List<MockSpec> mocks,
    MutatesSpec mutates,
    @JsonProperty("timeout_ms") Integer timeoutMs
) {
    /** Prefix marking a target as relative to the enclosing suite's target. */
    public static final String RELATIVE_MARKER = ".";

    public TestSpec {
        given = given == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(given));
        types = types == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(types));
        mocks = mocks == null ? List.of() : List.copyOf(mocks);
    }

    public static TestSpec of(String target, Map<String, Object> given, Expectation expect) {
        return new TestSpec(target, null, given, null, expect, null, null, null, null);
    }

    @JsonIgnore
    public String displayName() {
        return description != null && !description.isBlank() ? description : target;
    }

    @JsonIgnore
    public boolean isRelative() {
        return target != null && target.startsWith(RELATIVE_MARKER);
    }

    public TestSpec withTarget(String newTarget) {
        return new TestSpec(newTarget, description, given, types, expect, raises, mocks, mutates, timeoutMs);
    }

    public TestSpec withMocks(List<MockSpec> newMocks) {
        return new TestSpec(target, description, given, types, expect, raises, newMocks, mutates, timeoutMs);
    }
}
