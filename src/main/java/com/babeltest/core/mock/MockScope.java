package com.babeltest.core.mock;

import com.babeltest.core.expect.ExpectationMatcher;
import com.babeltest.core.expect.MatchResult;
import com.babeltest.core.model.CalledAssertion;
import com.babeltest.core.model.Expectation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

import static com.babeltest.core.diagnostics.ValueFormatter.format;

/**
 * Every mock and spy installed for one test. Closing restores the original bindings in
 * reverse installation order; closing twice is a no-op.
 */
public class MockScope implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MockScope.class);

    private final Deque<Runnable> restorers = new ArrayDeque<>();
    private final List<Spy> spies = new ArrayList<>();
    private final CallRecorder recorder = new CallRecorder();

    record Spy(CalledAssertion assertion, String path) {}

    void onClose(Runnable restore) {
        restorers.push(restore);
    }

    void spy(CalledAssertion assertion, String path) {
        spies.add(new Spy(assertion, path));
    }

    public CallRecorder recorder() {
        return recorder;
    }

    public int installed() {
        return restorers.size();
    }

    /**
     * Checks every spy assertion against the recorded calls; the first unmet one fails.
     */
    public MatchResult verify(ExpectationMatcher matcher) {
        for (Spy spy : spies) {
            CalledAssertion assertion = spy.assertion();
            List<Map<String, Object>> calls = recorder.calls(spy.path());
            if (assertion.times() != null && calls.size() != assertion.times()) {
                return MatchResult.fail("Expected %s to be called %d time(s), but it was called %d time(s)"
                        .formatted(assertion.target(), assertion.times(), calls.size()));
            }
            if (assertion.times() == null && calls.isEmpty()) {
                return MatchResult.fail("Expected " + assertion.target() + " to be called, but it was never called");
            }
            Map<String, Object> withArgs = assertion.withArgs();
            if (withArgs != null && !withArgs.isEmpty()) {
                boolean matched = calls.stream()
                        .anyMatch(call -> matcher.matches(call, Expectation.contains(withArgs)).passed());
                if (!matched) {
                    return MatchResult.fail("Expected " + assertion.target() + " to be called with "
                            + format(withArgs) + ", recorded calls: " + format(calls));
                }
            }
        }
        return MatchResult.pass();
    }

    @Override
    public void close() {
        while (!restorers.isEmpty()) {
            try {
                restorers.pop().run();
            } catch (RuntimeException e) {
                log.warn("Failed to restore a mocked binding", e);
            }
        }
    }
}
