package com.babeltest.core.mock;

import com.babeltest.core.diagnostics.BabelTestException;

/**
 * A mock or spy could not be installed; the test does not run.
 */
public class MockInstallationException extends BabelTestException {

    public MockInstallationException(String message) {
        super(message);
    }

    public MockInstallationException(String message, Throwable cause) {
        super(message, cause);
    }
}
