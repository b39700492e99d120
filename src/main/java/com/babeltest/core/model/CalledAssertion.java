package com.babeltest.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Spy assertion that a collaborator was invoked during the test.
 *
 * @param target   dotted path of the collaborator method
 * @param withArgs named arguments at least one recorded call must contain (partial match)
 * @param times    exact expected call count; {@code null} means at least once
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CalledAssertion(
    String target,
    @JsonProperty("with_args") Map<String, Object> withArgs,
    Integer times
) {}
