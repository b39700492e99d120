package com.babeltest.core.ir;

import com.babeltest.core.diagnostics.BabelTestException;

/**
 * Raised when an IR document cannot be read or parsed.
 */
public class IrLoadException extends BabelTestException {

    public IrLoadException(String message) {
        super(message);
    }

    public IrLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
