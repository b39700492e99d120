package com.babeltest.runtime;

import com.babeltest.core.diagnostics.BabelTestException;

/**
 * A child runtime could not be built or launched. Aborts the run before any test executes.
 */
public class RuntimeStartupException extends BabelTestException {

    public RuntimeStartupException(String message) {
        super(message);
    }

    public RuntimeStartupException(String message, Throwable cause) {
        super(message, cause);
    }
}
