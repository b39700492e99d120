package com.babeltest.core.executor;

import com.babeltest.core.model.TestResult;
import com.babeltest.core.model.TestSpec;

/**
 * Runs single tests for one implementation language.
 *
 * <p>{@link #run(TestSpec)} reports harness problems as ERROR results instead of throwing,
 * so one broken test never stops a run. Executors that want suite and test boundary
 * notifications also implement {@link LifecycleAware}.
 */
public interface TestExecutor extends AutoCloseable {

    /** Short name used in logs and reports, e.g. {@code java} or a runtime name. */
    String name();

    TestResult run(TestSpec test);

    /** Releases workers and child processes. Safe to call more than once. */
    @Override
    void close();
}
