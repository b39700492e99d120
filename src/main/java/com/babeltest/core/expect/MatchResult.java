package com.babeltest.core.expect;

/**
 * Outcome of an expectation check; {@code message} explains a mismatch.
 */
public record MatchResult(boolean passed, String message) {

    private static final MatchResult PASS = new MatchResult(true, null);

    public static MatchResult pass() {
        return PASS;
    }

    public static MatchResult fail(String message) {
        return new MatchResult(false, message);
    }
}
