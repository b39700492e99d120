package com.babeltest.core.engine;

import com.babeltest.core.events.EventBus;
import com.babeltest.core.events.RunEvent;
import com.babeltest.core.executor.LifecycleAware;
import com.babeltest.core.executor.TestExecutor;
import com.babeltest.core.metrics.RunMetrics;
import com.babeltest.core.model.Expectation;
import com.babeltest.core.model.IrDocument;
import com.babeltest.core.model.ResultStatus;
import com.babeltest.core.model.SuiteSpec;
import com.babeltest.core.model.TestResult;
import com.babeltest.core.model.TestSpec;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class TestOrchestratorTest {

    private TestExecutor executor;
    private EventBus eventBus;
    private SimpleMeterRegistry registry;
    private TestOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        executor = mock(TestExecutor.class);
        when(executor.name()).thenReturn("mock");
        when(executor.run(any())).thenAnswer(inv -> TestResult.passed(inv.getArgument(0), null, null, 1, List.of()));
        eventBus = new EventBus();
        registry = new SimpleMeterRegistry();
        orchestrator = new TestOrchestrator(executor, eventBus, new RunMetrics(registry));
    }

    private static TestSpec test(String target) {
        return TestSpec.of(target, Map.of(), Expectation.exact(1));
    }

    // -- ordering and targets --------------------------------------------------

    @Nested
    @DisplayName("ordering and targets")
    class OrderingAndTargets {

        @Test
        @DisplayName("top-level tests run before suites, in declaration order")
        void order() {
            var doc = new IrDocument(null,
                    List.of(new SuiteSpec("s", null, List.of(test("m.c"), test("m.d")))),
                    List.of(test("m.a"), test("m.b")));

            List<TestResult> results = orchestrator.run(doc);

            assertEquals(List.of("m.a", "m.b", "m.c", "m.d"),
                    results.stream().map(r -> r.test().target()).toList());
        }

        @Test
        @DisplayName("relative targets are joined to the suite target")
        void relativeTarget() {
            var doc = new IrDocument(null, List.of(new SuiteSpec("users", "app.services.UserService",
                    List.of(test(".getById"), test("math.add")))), null);

            List<TestResult> results = orchestrator.run(doc);

            var captor = ArgumentCaptor.forClass(TestSpec.class);
            verify(executor, times(2)).run(captor.capture());
            assertEquals("app.services.UserService.getById", captor.getAllValues().get(0).target());
            assertEquals("math.add", captor.getAllValues().get(1).target());
            assertEquals("app.services.UserService.getById", results.get(0).test().target());
        }

        @Test
        @DisplayName("relative target without a suite target is an error and never executed")
        void relativeWithoutSuiteTarget() {
            var doc = new IrDocument(null, List.of(new SuiteSpec("bare", null,
                    List.of(test(".getById"), test("math.add")))), null);

            List<TestResult> results = orchestrator.run(doc);

            assertEquals(2, results.size());
            assertEquals(ResultStatus.ERROR, results.get(0).status());
            assertEquals("Relative target '.getById' but suite has no default target", results.get(0).message());
            assertEquals(ResultStatus.PASSED, results.get(1).status());
            verify(executor, times(1)).run(any());
        }

        @Test
        @DisplayName("empty document yields no results")
        void emptyDocument() {
            assertTrue(orchestrator.run(new IrDocument(null, null, null)).isEmpty());
            verify(executor, never()).run(any());
        }
    }

    // -- harness failures ------------------------------------------------------

    @Nested
    @DisplayName("harness failures")
    class HarnessFailures {

        @Test
        @DisplayName("executor exception becomes an error and the run continues")
        void executorThrows() {
            when(executor.run(any()))
                    .thenThrow(new IllegalStateException("pipe closed"))
                    .thenAnswer(inv -> TestResult.passed(inv.getArgument(0), null, null, 1, List.of()));
            var doc = new IrDocument(null, null, List.of(test("m.a"), test("m.b")));

            List<TestResult> results = orchestrator.run(doc);

            assertEquals(ResultStatus.ERROR, results.get(0).status());
            assertEquals("Executor error: pipe closed", results.get(0).message());
            assertEquals(ResultStatus.PASSED, results.get(1).status());
            assertEquals(1.0, registry.find("babeltest.harness.errors")
                    .tag("reason", "IllegalStateException").counter().count());
        }

        @Test
        @DisplayName("missing result becomes an error")
        void nullResult() {
            when(executor.run(any())).thenReturn(null);
            List<TestResult> results = orchestrator.run(new IrDocument(null, null, List.of(test("m.a"))));
            assertEquals("Executor 'mock' returned no result", results.get(0).message());
        }
    }

    // -- lifecycle -------------------------------------------------------------

    @Nested
    @DisplayName("lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("lifecycle-aware executors get suite and test boundaries")
        void lifecycleAware() {
            TestExecutor aware = mock(TestExecutor.class, withSettings().extraInterfaces(LifecycleAware.class));
            when(aware.name()).thenReturn("aware");
            when(aware.run(any())).thenAnswer(inv -> TestResult.passed(inv.getArgument(0), null, null, 1, List.of()));
            var doc = new IrDocument(null, List.of(new SuiteSpec("s", null, List.of(test("m.a")))), null);

            new TestOrchestrator(aware).run(doc);

            LifecycleAware lifecycle = (LifecycleAware) aware;
            InOrder order = inOrder(aware);
            order.verify(lifecycle).onSuiteStart("s");
            order.verify(lifecycle).onTestStart("m.a");
            order.verify(aware).run(any());
            order.verify(lifecycle).onTestEnd("m.a");
            order.verify(lifecycle).onSuiteEnd("s");
        }

        @Test
        @DisplayName("failing lifecycle notification does not stop the test")
        void lifecycleFailure() {
            TestExecutor aware = mock(TestExecutor.class, withSettings().extraInterfaces(LifecycleAware.class));
            when(aware.name()).thenReturn("aware");
            when(aware.run(any())).thenAnswer(inv -> TestResult.passed(inv.getArgument(0), null, null, 1, List.of()));
            doThrow(new IllegalStateException("boom")).when((LifecycleAware) aware).onTestStart(any());

            List<TestResult> results = new TestOrchestrator(aware)
                    .run(new IrDocument(null, null, List.of(test("m.a"))));

            assertEquals(ResultStatus.PASSED, results.get(0).status());
        }

        @Test
        @DisplayName("closing the orchestrator closes the executor")
        void close() {
            orchestrator.close();
            verify(executor).close();
        }
    }

    // -- events and context ----------------------------------------------------

    @Nested
    @DisplayName("events and context")
    class EventsAndContext {

        @Test
        @DisplayName("publishes run, suite and test events in order")
        void events() {
            List<RunEvent> events = new ArrayList<>();
            eventBus.subscribe("BT-2026-0001", events::add);
            var doc = new IrDocument(null, List.of(new SuiteSpec("s", null, List.of(test("m.b")))),
                    List.of(test("m.a")));

            orchestrator.run("BT-2026-0001", doc);

            assertEquals(List.of(RunEvent.RUN_STARTED, RunEvent.TEST_COMPLETED, RunEvent.SUITE_STARTED,
                            RunEvent.TEST_COMPLETED, RunEvent.SUITE_COMPLETED, RunEvent.RUN_COMPLETED),
                    events.stream().map(RunEvent::eventType).toList());
            RunEvent suiteTest = events.get(3);
            assertEquals("s", suiteTest.suite());
            assertEquals("passed", suiteTest.payload().get("status"));
            assertEquals(2, events.get(5).payload().get("passed"));
        }

        @Test
        @DisplayName("MDC carries the run id during execution and is cleared after")
        void mdc() {
            List<String> seen = new ArrayList<>();
            when(executor.run(any())).thenAnswer(inv -> {
                seen.add(MDC.get("runId"));
                return TestResult.passed(inv.getArgument(0), null, null, 1, List.of());
            });

            orchestrator.run("BT-2026-0042", new IrDocument(null, null, List.of(test("m.a"))));

            assertEquals(List.of("BT-2026-0042"), seen);
            assertNull(MDC.get("runId"));
        }

        @Test
        @DisplayName("run ids follow BT-YYYY-NNNN")
        void runId() {
            assertTrue(TestOrchestrator.generateRunId().matches("BT-\\d{4}-\\d{4,}"));
        }

        @Test
        @DisplayName("summary counts statuses")
        void summary() {
            TestSpec spec = test("m.a");
            RunSummary summary = RunSummary.of(List.of(
                    TestResult.passed(spec, null, null, 0, List.of()),
                    TestResult.failed(spec, "no", null, null, null, 0, List.of()),
                    TestResult.error(spec, "broken")));
            assertEquals(3, summary.total());
            assertFalse(summary.successful());
            assertEquals("1 passed, 1 failed, 1 errors (3 total)", summary.toString());
        }
    }
}
