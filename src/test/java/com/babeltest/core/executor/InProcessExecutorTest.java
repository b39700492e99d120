package com.babeltest.core.executor;

import com.babeltest.core.model.CalledAssertion;
import com.babeltest.core.model.Expectation;
import com.babeltest.core.model.ExpectationType;
import com.babeltest.core.model.MockSpec;
import com.babeltest.core.model.MutatesSpec;
import com.babeltest.core.model.OutputBlock;
import com.babeltest.core.model.ResultStatus;
import com.babeltest.core.model.TestResult;
import com.babeltest.core.model.TestSpec;
import com.babeltest.core.model.ThrowsExpectation;
import com.babeltest.core.resolve.InstanceLifecycle;
import com.babeltest.fixtures.FixtureRegistrar;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InProcessExecutorTest {

    private InProcessExecutor executor;

    @BeforeEach
    void setUp() {
        executor = new InProcessExecutor(FixtureRegistrar.registry(), ExecutionSettings.defaults());
    }

    @AfterEach
    void tearDown() {
        executor.close();
    }

    private static TestSpec test(String target, Map<String, Object> given, Expectation expect) {
        return TestSpec.of(target, given, expect);
    }

    private static TestSpec throwing(String target, Map<String, Object> given, ThrowsExpectation raises) {
        return new TestSpec(target, null, given, null, null, raises, null, null, null);
    }

    // -- return values ---------------------------------------------------------

    @Nested
    @DisplayName("return values")
    class ReturnValues {

        @Test
        @DisplayName("exact match passes")
        void exactPasses() {
            TestResult result = executor.run(test("math.add", Map.of("a", 2, "b", 3), Expectation.exact(5)));
            assertEquals(ResultStatus.PASSED, result.status());
            assertEquals(5, result.actualValue());
        }

        @Test
        @DisplayName("contains match on an instance method passes")
        void containsPasses() {
            TestResult result = executor.run(test("app.services.UserService.getById",
                    Map.of("id", 7), Expectation.contains(Map.of("name", "User 7"))));
            assertEquals(ResultStatus.PASSED, result.status(), result.message());
        }

        @Test
        @DisplayName("records compare structurally")
        void recordComparison() {
            TestResult result = executor.run(test("math.profile", Map.of("name", "Ada", "age", 36),
                    Expectation.exact(Map.of("name", "Ada", "age", 36, "tags", List.of("new", "trial")))));
            assertEquals(ResultStatus.PASSED, result.status(), result.message());
        }

        @Test
        @DisplayName("mismatch fails with both values in the message")
        void mismatchFails() {
            TestResult result = executor.run(test("math.add", Map.of("a", 2, "b", 2), Expectation.exact(5)));
            assertEquals(ResultStatus.FAILED, result.status());
            assertEquals("Expected 5, got 4", result.message());
            assertEquals(4, result.actualValue());
            assertEquals(5, result.expectedValue());
        }

        @Test
        @DisplayName("type expectation checks the returned type")
        void typeExpectation() {
            TestResult result = executor.run(test("math.greet", Map.of("name", "Bo"),
                    new Expectation(ExpectationType.TYPE, "String")));
            assertEquals(ResultStatus.PASSED, result.status(), result.message());
        }

        @Test
        @DisplayName("a test without expectations passes when the call returns")
        void noExpectation() {
            assertEquals(ResultStatus.PASSED, executor.run(test("math.nothing", Map.of(), null)).status());
        }
    }

    // -- failures --------------------------------------------------------------

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("expected failure passes")
        void expectedFailure() {
            TestResult result = executor.run(throwing("math.divide", Map.of("a", 1, "b", 0),
                    new ThrowsExpectation("ArithmeticException", "by zero", null)));
            assertEquals(ResultStatus.PASSED, result.status(), result.message());
        }

        @Test
        @DisplayName("wrong failure type fails")
        void wrongType() {
            TestResult result = executor.run(throwing("math.divide", Map.of("a", 1, "b", 0),
                    ThrowsExpectation.ofType("IllegalStateException")));
            assertEquals(ResultStatus.FAILED, result.status());
            assertEquals("Expected IllegalStateException, got ArithmeticException", result.message());
        }

        @Test
        @DisplayName("succeeding call fails a throws test")
        void succeededInstead() {
            TestResult result = executor.run(throwing("math.divide", Map.of("a", 4, "b", 2),
                    ThrowsExpectation.ofType("ArithmeticException")));
            assertEquals(ResultStatus.FAILED, result.status());
            assertEquals("Expected exception ArithmeticException but call succeeded", result.message());
        }

        @Test
        @DisplayName("throws wins over expect")
        void throwsTakesPrecedence() {
            var spec = new TestSpec("math.divide", null, Map.of("a", 1, "b", 0), null, Expectation.exact(1),
                    ThrowsExpectation.ofType("ArithmeticException"), null, null, null);
            assertEquals(ResultStatus.PASSED, executor.run(spec).status());
        }

        @Test
        @DisplayName("unexpected failure is an error")
        void unexpectedFailure() {
            TestResult result = executor.run(test("math.divide", Map.of("a", 1, "b", 0), Expectation.exact(1)));
            assertEquals(ResultStatus.ERROR, result.status());
            assertEquals("ArithmeticException: Division by zero", result.message());
            assertInstanceOf(ArithmeticException.class, result.failure());
        }

        @Test
        @DisplayName("exceeding timeout_ms fails")
        void timeout() {
            var spec = new TestSpec("timing.slow", null, Map.of("delayMs", 2_000), null,
                    Expectation.exact("done"), null, null, null, 20);
            TestResult result = executor.run(spec);
            assertEquals(ResultStatus.FAILED, result.status());
            assertEquals("Test timed out after 20 ms", result.message());
        }

        @Test
        @DisplayName("async results are awaited")
        void asyncResult() {
            TestResult result = executor.run(test("timing.slowAsync", Map.of("delayMs", 5), Expectation.exact("done")));
            assertEquals(ResultStatus.PASSED, result.status(), result.message());
        }

        @Test
        @DisplayName("unresolvable target is an error")
        void unresolvable() {
            TestResult result = executor.run(test("math.missing", Map.of(), null));
            assertEquals(ResultStatus.ERROR, result.status());
            assertTrue(result.message().contains("'missing'"), result.message());
        }

        @Test
        @DisplayName("unknown module is an error")
        void unknownModule() {
            TestResult result = executor.run(test("nowhere.fn", Map.of(), null));
            assertEquals(ResultStatus.ERROR, result.status());
            assertTrue(result.message().startsWith("Cannot resolve target 'nowhere.fn'"), result.message());
        }
    }

    // -- mocks and spies -------------------------------------------------------

    @Nested
    @DisplayName("mocks and spies")
    class MocksAndSpies {

        private TestSpec placeOrder(List<MockSpec> mocks, MutatesSpec mutates,
                                    Expectation expect, ThrowsExpectation raises) {
            return new TestSpec("payments.OrderService.placeOrder", null,
                    Map.of("customerId", "c1", "amount", 12.5), null, expect, raises, mocks, mutates, null);
        }

        @Test
        @DisplayName("mocked collaborator failure surfaces through the target")
        void mockedFailure() {
            var mock = MockSpec.raising("payments.PaymentGateway.charge",
                    new ThrowsExpectation("PaymentDeclined", "insufficient funds", null));
            TestResult result = executor.run(placeOrder(List.of(mock), null, null,
                    new ThrowsExpectation("PaymentDeclined", null, "card_declined")));
            assertEquals(ResultStatus.PASSED, result.status(), result.message());
        }

        @Test
        @DisplayName("mocked return value flows into the result")
        void mockedReturn() {
            var mock = MockSpec.returning("payments.PaymentGateway.charge", "mock-1");
            TestResult result = executor.run(placeOrder(List.of(mock), null,
                    Expectation.contains(Map.of("receipt", "mock-1")), null));
            assertEquals(ResultStatus.PASSED, result.status(), result.message());
        }

        @Test
        @DisplayName("spy call count is checked after the call")
        void spyTimes() {
            var once = new MutatesSpec(List.of(new CalledAssertion("payments.PaymentGateway.charge",
                    Map.of("customerId", "c1"), 1)));
            assertEquals(ResultStatus.PASSED, executor.run(placeOrder(List.of(), once, null, null)).status());

            var twice = new MutatesSpec(List.of(new CalledAssertion("payments.PaymentGateway.charge", null, 2)));
            TestResult result = executor.run(placeOrder(List.of(), twice, null, null));
            assertEquals(ResultStatus.FAILED, result.status());
            assertTrue(result.message().contains("called 2 time(s), but it was called 1 time(s)"));
        }

        @Test
        @DisplayName("mock that cannot be installed is an error")
        void installFailure() {
            TestResult result = executor.run(placeOrder(List.of(MockSpec.returning("nowhere.fn", 1)),
                    null, null, null));
            assertEquals(ResultStatus.ERROR, result.status());
            assertTrue(result.message().startsWith("Failed to install mock:"), result.message());
        }

        @Test
        @DisplayName("mocks are restored after a failing test")
        void restoredAfterFailure() {
            var mocked = new TestSpec("math.add", null, Map.of("a", 2, "b", 3), null, Expectation.exact(5),
                    null, List.of(MockSpec.returning("math.add", 99)), null, null);
            assertEquals(ResultStatus.FAILED, executor.run(mocked).status());

            TestResult plain = executor.run(test("math.add", Map.of("a", 2, "b", 3), Expectation.exact(5)));
            assertEquals(ResultStatus.PASSED, plain.status(), plain.message());
        }
    }

    // -- lifecycle and capture -------------------------------------------------

    @Nested
    @DisplayName("lifecycle and capture")
    class LifecycleAndCapture {

        private TestResult increment(InProcessExecutor target) {
            target.onTestStart("increment");
            TestResult result = target.run(test("state.Counter.increment", Map.of(), null));
            target.onTestEnd("increment");
            return result;
        }

        @Test
        @DisplayName("shared instances keep state across tests")
        void shared() {
            increment(executor);
            assertEquals(2, increment(executor).actualValue());
        }

        @Test
        @DisplayName("per_test instances start fresh")
        void perTest() {
            try (var fresh = new InProcessExecutor(FixtureRegistrar.registry(),
                    ExecutionSettings.defaults().withLifecycle(InstanceLifecycle.PER_TEST))) {
                increment(fresh);
                assertEquals(1, increment(fresh).actualValue());
            }
        }

        @Test
        @DisplayName("per_suite instances reset at suite start")
        void perSuite() {
            try (var suites = new InProcessExecutor(FixtureRegistrar.registry(),
                    ExecutionSettings.defaults().withLifecycle(InstanceLifecycle.PER_SUITE))) {
                suites.onSuiteStart("first");
                increment(suites);
                assertEquals(2, increment(suites).actualValue());
                suites.onSuiteStart("second");
                assertEquals(1, increment(suites).actualValue());
            }
        }

        @Test
        @DisplayName("captured output is attached to the result")
        void captureOutput() {
            var settings = new ExecutionSettings(null, null, true, null, false);
            try (var capturing = new InProcessExecutor(FixtureRegistrar.registry(), settings)) {
                TestResult result = capturing.run(test("math.shout", Map.of("text", "hi"), Expectation.exact("HI")));
                assertEquals(ResultStatus.PASSED, result.status(), result.message());
                assertEquals(2, result.output().size());
                OutputBlock stdout = result.output().get(0);
                assertEquals(OutputBlock.STDOUT, stdout.stream());
                assertTrue(stdout.text().contains("shouting hi"));
                assertTrue(result.output().get(1).text().contains("warning: loud"));
            }
        }

        @Test
        @DisplayName("output is not captured by default")
        void noCaptureByDefault() {
            TestResult result = executor.run(test("math.shout", Map.of("text", "hi"), null));
            assertTrue(result.output().isEmpty());
        }
    }
}
