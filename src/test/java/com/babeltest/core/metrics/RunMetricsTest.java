package com.babeltest.core.metrics;

import com.babeltest.core.model.ResultStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RunMetricsTest {

    private SimpleMeterRegistry registry;
    private RunMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new RunMetrics(registry);
    }

    @Test
    @DisplayName("recordTest counts per executor and status")
    void recordTest() {
        metrics.recordTest("java", ResultStatus.PASSED, 12);
        metrics.recordTest("java", ResultStatus.PASSED, 8);
        metrics.recordTest("java", ResultStatus.FAILED, 3);

        var passed = registry.find("babeltest.tests.total").tag("status", "passed").counter();
        var failed = registry.find("babeltest.tests.total").tag("status", "failed").counter();
        assertNotNull(passed);
        assertNotNull(failed);
        assertEquals(2.0, passed.count());
        assertEquals(1.0, failed.count());

        var timer = registry.find("babeltest.test.duration").tag("executor", "java").timer();
        assertNotNull(timer);
        assertEquals(3, timer.count());
    }

    @Test
    @DisplayName("recordRun creates a run timer")
    void recordRun() {
        metrics.recordRun("python", 1500);
        var timer = registry.find("babeltest.run.duration").tag("executor", "python").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
    }

    @Test
    @DisplayName("recordHarnessError counts by reason")
    void recordHarnessError() {
        metrics.recordHarnessError("IllegalStateException");
        var counter = registry.find("babeltest.harness.errors").tag("reason", "IllegalStateException").counter();
        assertNotNull(counter);
        assertEquals(1.0, counter.count());
    }
}
