package com.babeltest.core.logging;

import ch.qos.logback.classic.Level;
import org.slf4j.LoggerFactory;

/**
 * Raises BabelTest's own loggers to DEBUG at runtime.
 */
public final class DebugLogging {

    public static final String ROOT_PACKAGE = "com.babeltest";

    private DebugLogging() {}

    public static void enable() {
        if (LoggerFactory.getLogger(ROOT_PACKAGE) instanceof ch.qos.logback.classic.Logger logback) {
            logback.setLevel(Level.DEBUG);
        }
    }
}
