package com.babeltest.core.diagnostics;

/**
 * Base type for failures raised by the harness itself, as opposed to failures raised by code under test.
 */
public class BabelTestException extends RuntimeException {

    public BabelTestException(String message) {
        super(message);
    }

    public BabelTestException(String message, Throwable cause) {
        super(message, cause);
    }
}
