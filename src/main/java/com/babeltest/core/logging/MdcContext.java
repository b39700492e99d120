package com.babeltest.core.logging;

import org.slf4j.MDC;

/**
 * BabelTest MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String RUN = "runId";
    public static final String SUITE = "suite";
    public static final String TEST = "test";

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put(RUN, runId);
    }

    public static void setSuite(String suite) {
        if (suite == null) {
            MDC.remove(SUITE);
        } else {
            MDC.put(SUITE, suite);
        }
    }

    public static void setTest(String test) {
        MDC.put(TEST, test);
    }

    public static void clearTest() {
        MDC.remove(TEST);
    }

    public static void clear() {
        MDC.remove(RUN);
        MDC.remove(SUITE);
        MDC.remove(TEST);
    }
}
