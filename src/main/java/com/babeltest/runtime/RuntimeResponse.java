package com.babeltest.runtime;

import com.babeltest.core.model.OutputBlock;
import com.babeltest.core.model.TestResult;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One response line from a child runtime.
 *
 * @param status     {@code passed}, {@code failed}, {@code error}, or {@code ok} for non-run commands
 * @param message    failure or error explanation
 * @param actual     value returned by the target
 * @param expected   value the test expected
 * @param durationMs time the child spent on the test
 * @param output     output the child captured while the test ran
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RuntimeResponse(
    String status,
    String message,
    Object actual,
    Object expected,
    @JsonProperty("duration_ms") Double durationMs,
    List<OutputBlock> output
) {
    public static final String OK = "ok";

    public static RuntimeResponse ok() {
        return new RuntimeResponse(OK, null, null, null, null, null);
    }

    public static RuntimeResponse error(String message) {
        return new RuntimeResponse("error", message, null, null, null, null);
    }

    public static RuntimeResponse of(TestResult result) {
        return new RuntimeResponse(result.status().wireName(), result.message(), result.actualValue(),
                result.expectedValue(), (double) result.durationMs(),
                result.output().isEmpty() ? null : result.output());
    }

    /** Same response with structured values replaced by their string form. */
    public RuntimeResponse stringified() {
        return new RuntimeResponse(status, message, actual == null ? null : String.valueOf(actual),
                expected == null ? null : String.valueOf(expected), durationMs, output);
    }
}
