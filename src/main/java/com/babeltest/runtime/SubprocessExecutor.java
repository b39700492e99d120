package com.babeltest.runtime;

import com.babeltest.core.executor.LifecycleAware;
import com.babeltest.core.executor.TestExecutor;
import com.babeltest.core.model.ResultStatus;
import com.babeltest.core.model.TestResult;
import com.babeltest.core.model.TestSpec;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Runs tests in a child runtime over a {@link RuntimeChannel}.
 *
 * <p>Any protocol failure during {@code run} becomes an ERROR result for that test only.
 * Lifecycle notifications are best-effort.
 */
public class SubprocessExecutor implements TestExecutor, LifecycleAware {

    private static final Logger log = LoggerFactory.getLogger(SubprocessExecutor.class);

    private final String name;
    private final RuntimeChannel channel;

    public SubprocessExecutor(String name, RuntimeChannel channel) {
        this.name = name;
        this.channel = channel;
    }

    /**
     * Builds the runtime if it has a build command, then prepares its lazily started process.
     *
     * @throws RuntimeStartupException when the build fails
     */
    public static SubprocessExecutor start(String name, RuntimeProperties properties, ObjectMapper mapper) {
        RuntimeProcess.build(name, properties);
        return new SubprocessExecutor(name, new RuntimeProcess(name, properties, mapper));
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public TestResult run(TestSpec test) {
        long start = System.nanoTime();
        try {
            RuntimeResponse response = channel.send(RuntimeCommand.run(test));
            long durationMs = response.durationMs() != null
                    ? Math.round(response.durationMs())
                    : elapsed(start);
            return new TestResult(test, ResultStatus.fromWire(response.status()), response.message(),
                    response.actual(), response.expected(), null, durationMs, response.output());
        } catch (RuntimeException e) {
            log.warn("Runtime '{}' failed while running {}: {}", name, test.target(), e.getMessage());
            return TestResult.error(test, "Runtime adapter error: " + e.getMessage(), e, elapsed(start), List.of());
        }
    }

    @Override
    public void onSuiteStart(String suiteName) {
        notify(RuntimeCommand.SUITE_START, suiteName);
    }

    @Override
    public void onSuiteEnd(String suiteName) {
        notify(RuntimeCommand.SUITE_END, suiteName);
    }

    @Override
    public void onTestStart(String testName) {
        notify(RuntimeCommand.TEST_START, testName);
    }

    @Override
    public void onTestEnd(String testName) {
        notify(RuntimeCommand.TEST_END, testName);
    }

    private void notify(String event, String subject) {
        try {
            channel.send(RuntimeCommand.lifecycle(event, subject));
        } catch (RuntimeException e) {
            log.debug("Lifecycle event {} for '{}' not delivered to runtime '{}': {}",
                    event, subject, name, e.getMessage());
        }
    }

    private static long elapsed(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    @Override
    public void close() {
        channel.close();
    }
}
