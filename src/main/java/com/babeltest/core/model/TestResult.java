package com.babeltest.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Result of running one test. Created once per executed test and never modified.
 *
 * @param test          the test that was executed (with its resolved absolute target)
 * @param status        outcome
 * @param message       failure or error explanation; {@code null} when passed
 * @param actualValue   value returned by the target, when it returned
 * @param expectedValue value the test expected, when it asserted one
 * @param failure       failure raised by the target or by the harness, when any
 * @param durationMs    wall-clock time spent on the test
 * @param output        captured output blocks in capture order
 */
public record TestResult(
    TestSpec test,
    ResultStatus status,
    String message,
    Object actualValue,
    Object expectedValue,
    @JsonIgnore Throwable failure,
    long durationMs,
    List<OutputBlock> output
) {
    public TestResult {
        output = output == null ? List.of() : List.copyOf(output);
    }

    public static TestResult passed(TestSpec test, Object actualValue, Object expectedValue,
                                    long durationMs, List<OutputBlock> output) {
        return new TestResult(test, ResultStatus.PASSED, null, actualValue, expectedValue, null, durationMs, output);
    }

    public static TestResult failed(TestSpec test, String message, Object actualValue, Object expectedValue,
                                    Throwable failure, long durationMs, List<OutputBlock> output) {
        return new TestResult(test, ResultStatus.FAILED, message, actualValue, expectedValue, failure, durationMs, output);
    }

    public static TestResult error(TestSpec test, String message, Throwable failure,
                                   long durationMs, List<OutputBlock> output) {
        return new TestResult(test, ResultStatus.ERROR, message, null, null, failure, durationMs, output);
    }

    public static TestResult error(TestSpec test, String message) {
        return error(test, message, null, 0, List.of());
    }

    @JsonIgnore
    public boolean isUnsuccessful() {
        return status == ResultStatus.FAILED || status == ResultStatus.ERROR;
    }
}
