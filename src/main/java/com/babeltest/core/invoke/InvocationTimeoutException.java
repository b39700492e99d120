package com.babeltest.core.invoke;

import com.babeltest.core.diagnostics.BabelTestException;

/**
 * A call did not finish within its budget.
 */
public class InvocationTimeoutException extends BabelTestException {

    private final long timeoutMs;

    public InvocationTimeoutException(long timeoutMs) {
        super("Test timed out after " + timeoutMs + " ms");
        this.timeoutMs = timeoutMs;
    }

    public long timeoutMs() {
        return timeoutMs;
    }
}
