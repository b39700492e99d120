package com.babeltest.core.ir;

import com.babeltest.core.model.CalledAssertion;
import com.babeltest.core.model.Expectation;
import com.babeltest.core.model.ExpectationType;
import com.babeltest.core.model.IrDocument;
import com.babeltest.core.model.MockSpec;
import com.babeltest.core.model.SuiteSpec;
import com.babeltest.core.model.TestSpec;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Structural checks on a loaded IR document, run before anything is executed.
 * Problems are reported, never thrown; the caller decides whether they are fatal.
 */
public class IrValidator {

    public record Problem(String location, String message) {
        @Override
        public String toString() {
            return location + ": " + message;
        }
    }

    public List<Problem> check(IrDocument document) {
        List<Problem> problems = new ArrayList<>();
        for (int i = 0; i < document.tests().size(); i++) {
            TestSpec test = document.tests().get(i);
            String location = "tests[" + i + "]";
            if (test.isRelative()) {
                problems.add(new Problem(location,
                        "Relative target '" + test.target() + "' outside a suite"));
            }
            checkTest(location, test, problems);
        }

        Set<String> suiteNames = new HashSet<>();
        for (int s = 0; s < document.suites().size(); s++) {
            SuiteSpec suite = document.suites().get(s);
            String suiteLocation = "suites[" + s + "]";
            if (suite.name() == null || suite.name().isBlank()) {
                problems.add(new Problem(suiteLocation, "Suite has no name"));
            } else {
                suiteLocation = "suite '" + suite.name() + "'";
                if (!suiteNames.add(suite.name())) {
                    problems.add(new Problem(suiteLocation, "Duplicate suite name"));
                }
            }
            if (suite.target() != null && !suite.target().isBlank() && suite.target().endsWith(".")) {
                problems.add(new Problem(suiteLocation, "Default target '" + suite.target() + "' ends with '.'"));
            }
            boolean hasDefault = suite.target() != null && !suite.target().isBlank();
            for (int i = 0; i < suite.tests().size(); i++) {
                TestSpec test = suite.tests().get(i);
                String location = suiteLocation + " tests[" + i + "]";
                if (test.isRelative() && !hasDefault) {
                    problems.add(new Problem(location,
                            "Relative target '" + test.target() + "' but suite has no default target"));
                }
                checkTest(location, test, problems);
            }
        }
        return problems;
    }

    private void checkTest(String location, TestSpec test, List<Problem> problems) {
        if (test.target() == null || test.target().isBlank()) {
            problems.add(new Problem(location, "Missing target"));
            return;
        }
        if (test.target().endsWith(".")) {
            problems.add(new Problem(location, "Target '" + test.target() + "' ends with '.'"));
        }
        if (test.timeoutMs() != null && test.timeoutMs() <= 0) {
            problems.add(new Problem(location, "timeout_ms must be positive, got " + test.timeoutMs()));
        }
        Expectation expect = test.expect();
        if (expect != null && expect.type() == ExpectationType.TYPE
                && !(expect.value() instanceof String name && !name.isBlank())) {
            problems.add(new Problem(location, "Type expectation needs a type name"));
        }
        for (int i = 0; i < test.mocks().size(); i++) {
            MockSpec mock = test.mocks().get(i);
            if (mock.target() == null || mock.target().isBlank()) {
                problems.add(new Problem(location + " mocks[" + i + "]", "Missing target"));
            }
        }
        if (test.mutates() != null) {
            for (int i = 0; i < test.mutates().called().size(); i++) {
                CalledAssertion called = test.mutates().called().get(i);
                String where = location + " mutates.called[" + i + "]";
                if (called.target() == null || called.target().isBlank()) {
                    problems.add(new Problem(where, "Missing target"));
                }
                if (called.times() != null && called.times() < 0) {
                    problems.add(new Problem(where, "times must not be negative"));
                }
            }
        }
    }
}
