package com.babeltest.core.engine;

import com.babeltest.core.events.EventBus;
import com.babeltest.core.events.RunEvent;
import com.babeltest.core.executor.LifecycleAware;
import com.babeltest.core.executor.TestExecutor;
import com.babeltest.core.logging.MdcContext;
import com.babeltest.core.metrics.RunMetrics;
import com.babeltest.core.model.IrDocument;
import com.babeltest.core.model.SuiteSpec;
import com.babeltest.core.model.TestResult;
import com.babeltest.core.model.TestSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Runs an IR document against one executor: top-level tests first, then each suite's
 * tests, strictly in declaration order and one at a time.
 * <p>
 * Owns the executor for the duration of a run context; closing the orchestrator closes
 * the executor. Results come back in input order, one per test.
 */
public class TestOrchestrator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TestOrchestrator.class);
    private static final AtomicInteger RUN_COUNTER = new AtomicInteger(0);

    private final TestExecutor executor;
    private final EventBus eventBus;
    private final RunMetrics metrics;

    public TestOrchestrator(TestExecutor executor) {
        this(executor, new EventBus(), RunMetrics.inMemory());
    }

    public TestOrchestrator(TestExecutor executor, EventBus eventBus, RunMetrics metrics) {
        this.executor = executor;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public List<TestResult> run(IrDocument document) {
        return run(generateRunId(), document);
    }

    public List<TestResult> run(String runId, IrDocument document) {
        MdcContext.setRun(runId);
        long start = System.nanoTime();
        try {
            log.info("Starting run {} with executor '{}': {} test(s)", runId, executor.name(), document.testCount());
            eventBus.publish(RunEvent.of(RunEvent.RUN_STARTED, runId, null,
                    Map.of("executor", executor.name(), "tests", document.testCount())));

            List<TestResult> results = new ArrayList<>(document.testCount());
            for (TestSpec test : document.tests()) {
                results.add(runTest(runId, null, test));
            }
            for (SuiteSpec suite : document.suites()) {
                runSuite(runId, suite, results);
            }

            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            RunSummary summary = RunSummary.of(results);
            metrics.recordRun(executor.name(), elapsedMs);
            eventBus.publish(RunEvent.of(RunEvent.RUN_COMPLETED, runId, null, Map.of(
                    "passed", summary.passed(), "failed", summary.failed(),
                    "errors", summary.errors(), "total", summary.total())));
            log.info("Run {} finished in {} ms: {}", runId, elapsedMs, summary);
            return results;
        } finally {
            MdcContext.clear();
        }
    }

    private void runSuite(String runId, SuiteSpec suite, List<TestResult> results) {
        MdcContext.setSuite(suite.name());
        try {
            eventBus.publish(RunEvent.of(RunEvent.SUITE_STARTED, runId, suite.name(),
                    Map.of("tests", suite.tests().size())));
            notifyExecutor(aware -> aware.onSuiteStart(suite.name()));

            for (TestSpec test : suite.tests()) {
                if (test.isRelative()) {
                    if (suite.target() == null || suite.target().isBlank()) {
                        TestResult structural = TestResult.error(test,
                                "Relative target '" + test.target() + "' but suite has no default target");
                        results.add(structural);
                        completed(runId, suite.name(), structural);
                        continue;
                    }
                    test = test.withTarget(suite.target() + test.target());
                }
                results.add(runTest(runId, suite.name(), test));
            }

            notifyExecutor(aware -> aware.onSuiteEnd(suite.name()));
            eventBus.publish(RunEvent.of(RunEvent.SUITE_COMPLETED, runId, suite.name(), Map.of()));
        } finally {
            MdcContext.setSuite(null);
        }
    }

    private TestResult runTest(String runId, String suite, TestSpec test) {
        String name = test.displayName();
        MdcContext.setTest(name);
        try {
            notifyExecutor(aware -> aware.onTestStart(name));
            TestResult result;
            try {
                result = executor.run(test);
                if (result == null) {
                    result = TestResult.error(test, "Executor '" + executor.name() + "' returned no result");
                    metrics.recordHarnessError("no-result");
                }
            } catch (RuntimeException e) {
                log.error("Executor '{}' failed on {}", executor.name(), test.target(), e);
                metrics.recordHarnessError(e.getClass().getSimpleName());
                result = TestResult.error(test, "Executor error: " + e.getMessage(), e, 0, List.of());
            }
            notifyExecutor(aware -> aware.onTestEnd(name));
            completed(runId, suite, result);
            return result;
        } finally {
            MdcContext.clearTest();
        }
    }

    private void completed(String runId, String suite, TestResult result) {
        metrics.recordTest(executor.name(), result.status(), result.durationMs());
        Map<String, Object> payload = new HashMap<>();
        payload.put("target", result.test().target());
        payload.put("name", result.test().displayName());
        payload.put("status", result.status().wireName());
        payload.put("durationMs", result.durationMs());
        if (result.message() != null) {
            payload.put("message", result.message());
        }
        eventBus.publish(new RunEvent(RunEvent.TEST_COMPLETED, runId, suite, payload, Instant.now()));
        log.debug("{} {} ({} ms)", result.status(), result.test().displayName(), result.durationMs());
    }

    private void notifyExecutor(Consumer<LifecycleAware> notification) {
        if (executor instanceof LifecycleAware aware) {
            try {
                notification.accept(aware);
            } catch (RuntimeException e) {
                log.warn("Lifecycle notification to '{}' failed: {}", executor.name(), e.getMessage());
            }
        }
    }

    public TestExecutor executor() {
        return executor;
    }

    /**
     * Generates a unique run ID in the format BT-YYYY-NNNN.
     */
    public static String generateRunId() {
        int count = RUN_COUNTER.incrementAndGet();
        int year = Instant.now().atZone(java.time.ZoneOffset.UTC).getYear();
        return String.format("BT-%d-%04d", year, count);
    }

    @Override
    public void close() {
        executor.close();
    }
}
