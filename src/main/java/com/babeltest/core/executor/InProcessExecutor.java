package com.babeltest.core.executor;

import com.babeltest.core.capture.OutputCapture;
import com.babeltest.core.diagnostics.ConstructionException;
import com.babeltest.core.diagnostics.ResolutionException;
import com.babeltest.core.expect.ExpectationMatcher;
import com.babeltest.core.expect.FailureMatcher;
import com.babeltest.core.expect.MatchResult;
import com.babeltest.core.expect.ValueNormalizer;
import com.babeltest.core.invoke.InvocationEngine;
import com.babeltest.core.invoke.InvocationTimeoutException;
import com.babeltest.core.mock.FailureFactory;
import com.babeltest.core.mock.MockInstallationException;
import com.babeltest.core.mock.MockInstaller;
import com.babeltest.core.mock.MockScope;
import com.babeltest.core.model.OutputBlock;
import com.babeltest.core.model.ResultStatus;
import com.babeltest.core.model.TestResult;
import com.babeltest.core.model.TestSpec;
import com.babeltest.core.resolve.FactoryLoader;
import com.babeltest.core.resolve.InstanceRegistry;
import com.babeltest.core.resolve.ResolvedTarget;
import com.babeltest.core.resolve.Resolver;
import com.babeltest.core.resolve.TargetRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Runs tests against Java code registered in a {@link TargetRegistry}, inside this JVM.
 *
 * <p>Per test: install mocks and spies, resolve the target, invoke it under the test's
 * budget, then check {@code throws}, {@code expect} and spy assertions in that order.
 * A test with both {@code throws} and {@code expect} is judged by {@code throws}.
 */
public class InProcessExecutor implements TestExecutor, LifecycleAware {

    private static final Logger log = LoggerFactory.getLogger(InProcessExecutor.class);

    public static final String NAME = "java";

    private final ExecutionSettings settings;
    private final InstanceRegistry instances;
    private final Resolver resolver;
    private final MockInstaller mocks;
    private final InvocationEngine engine;
    private final ExpectationMatcher matcher;
    private final FailureMatcher failureMatcher = new FailureMatcher();

    public InProcessExecutor(TargetRegistry registry, ExecutionSettings settings) {
        this.settings = settings;
        this.instances = new InstanceRegistry(registry,
                new FactoryLoader(registry, settings.factoriesPackage()), settings.lifecycle());
        this.resolver = new Resolver(registry, instances);
        this.mocks = new MockInstaller(resolver, registry.overrides(), new FailureFactory());
        this.engine = new InvocationEngine();
        this.matcher = new ExpectationMatcher(new ValueNormalizer(registry.binder().mapper()));
    }

    @Override
    public String name() {
        return NAME;
    }

    public ExecutionSettings settings() {
        return settings;
    }

    public InstanceRegistry instances() {
        return instances;
    }

    @Override
    public TestResult run(TestSpec test) {
        long start = System.nanoTime();
        Integer timeoutMs = test.timeoutMs() != null ? test.timeoutMs() : settings.timeoutMs();
        OutputCapture capture = OutputCapture.start(settings.captureOutput());
        MockScope scope = null;
        try {
            try {
                scope = mocks.install(test.mocks(), test.mutates());
            } catch (MockInstallationException e) {
                return TestResult.error(test, "Failed to install mock: " + e.getMessage(), e,
                        elapsed(start), capture.stop());
            }
            Object actual;
            try {
                ResolvedTarget target = resolver.resolve(test.target(), test.types());
                if (settings.debug()) {
                    log.info("Resolved {} to {} on {}", test.target(), target.methodName(), target.receiver());
                }
                actual = engine.invoke(target.invocable(), test.given(), timeoutMs);
            } catch (InvocationTimeoutException e) {
                return TestResult.failed(test, e.getMessage(), null, null, e, elapsed(start), capture.stop());
            } catch (ResolutionException | ConstructionException e) {
                return TestResult.error(test, e.getMessage(), e, elapsed(start), capture.stop());
            } catch (Exception | AssertionError | LinkageError | StackOverflowError e) {
                return raised(test, e, scope, elapsed(start), capture.stop());
            }
            return returned(test, actual, scope, elapsed(start), capture.stop());
        } finally {
            if (scope != null) {
                scope.close();
            }
            capture.stop();
        }
    }

    private TestResult returned(TestSpec test, Object actual, MockScope scope, long durationMs,
                                List<OutputBlock> output) {
        if (test.raises() != null) {
            String type = test.raises().type() != null ? test.raises().type() : "any";
            return TestResult.failed(test, "Expected exception " + type + " but call succeeded",
                    actual, null, null, durationMs, output);
        }
        Object expected = test.expect() != null ? test.expect().value() : null;
        if (test.expect() != null) {
            MatchResult match = matcher.matches(actual, test.expect());
            if (!match.passed()) {
                return TestResult.failed(test, match.message(), actual, expected, null, durationMs, output);
            }
        }
        MatchResult spies = scope.verify(matcher);
        if (!spies.passed()) {
            return TestResult.failed(test, spies.message(), actual, expected, null, durationMs, output);
        }
        return TestResult.passed(test, actual, expected, durationMs, output);
    }

    private TestResult raised(TestSpec test, Throwable raised, MockScope scope, long durationMs,
                              List<OutputBlock> output) {
        Throwable failure = FailureMatcher.unwrap(raised);
        if (test.raises() == null) {
            log.debug("Unexpected failure from {}", test.target(), failure);
            return TestResult.error(test, FailureMatcher.describe(failure), failure, durationMs, output);
        }
        MatchResult match = failureMatcher.matches(failure, test.raises());
        if (!match.passed()) {
            return TestResult.failed(test, match.message(), null, null, failure, durationMs, output);
        }
        MatchResult spies = scope.verify(matcher);
        if (!spies.passed()) {
            return TestResult.failed(test, spies.message(), null, null, failure, durationMs, output);
        }
        return new TestResult(test, ResultStatus.PASSED, null, null, null,
                failure, durationMs, output);
    }

    // -- LifecycleAware --------------------------------------------------

    @Override
    public void onSuiteStart(String suiteName) {
        instances.onSuiteStart();
    }

    @Override
    public void onSuiteEnd(String suiteName) {
        log.debug("Suite finished: {}", suiteName);
    }

    @Override
    public void onTestStart(String testName) {
        instances.onTestStart();
    }

    @Override
    public void onTestEnd(String testName) {
        log.debug("Test finished: {}", testName);
    }

    /** Drops all cached receivers regardless of lifecycle. */
    public void clearCache() {
        instances.clear();
    }

    private static long elapsed(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    @Override
    public void close() {
        engine.close();
    }
}
