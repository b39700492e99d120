package com.babeltest.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * An assertion that the call raises a failure. Absent fields match anything.
 *
 * @param type    failure type name (simple or fully-qualified)
 * @param message substring the failure message must contain
 * @param code    error code, either a number or a string
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ThrowsExpectation(
    String type,
    String message,
    Object code
) {
    public static ThrowsExpectation ofType(String type) {
        return new ThrowsExpectation(type, null, null);
    }

    public boolean isWildcard() {
        return type == null && message == null && code == null;
    }
}
