package com.babeltest.runtime;

import com.babeltest.core.diagnostics.BabelTestException;

/**
 * The conversation with a child runtime broke down: crash, malformed JSON, timeout.
 */
public class ProtocolException extends BabelTestException {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
