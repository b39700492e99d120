package com.babeltest.core.metrics;

import com.babeltest.core.model.ResultStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Micrometer metrics for test runs.
 */
@Service
public class RunMetrics {

    private final MeterRegistry registry;

    public RunMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /** Metrics kept in memory only, for runs assembled outside Spring. */
    public static RunMetrics inMemory() {
        return new RunMetrics(new SimpleMeterRegistry());
    }

    public MeterRegistry registry() {
        return registry;
    }

    public void recordTest(String executor, ResultStatus status, long ms) {
        Counter.builder("babeltest.tests.total")
                .tag("executor", executor)
                .tag("status", status.wireName())
                .register(registry)
                .increment();
        Timer.builder("babeltest.test.duration")
                .tag("executor", executor)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordRun(String executor, long ms) {
        Timer.builder("babeltest.run.duration")
                .tag("executor", executor)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Counts results produced by the harness itself rather than by the code under test,
     * e.g. an executor that threw.
     */
    public void recordHarnessError(String reason) {
        Counter.builder("babeltest.harness.errors")
                .description("Tests that ended in ERROR because the harness failed")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }
}
