package com.babeltest.core.engine;

import com.babeltest.core.model.TestResult;

import java.util.List;

/**
 * Outcome counts of a run.
 */
public record RunSummary(int passed, int failed, int errors, int skipped) {

    public static RunSummary of(List<TestResult> results) {
        int passed = 0, failed = 0, errors = 0, skipped = 0;
        for (TestResult result : results) {
            switch (result.status()) {
                case PASSED -> passed++;
                case FAILED -> failed++;
                case ERROR -> errors++;
                case SKIPPED -> skipped++;
            }
        }
        return new RunSummary(passed, failed, errors, skipped);
    }

    public int total() {
        return passed + failed + errors + skipped;
    }

    public boolean successful() {
        return failed == 0 && errors == 0;
    }

    @Override
    public String toString() {
        return "%d passed, %d failed, %d errors (%d total)".formatted(passed, failed, errors, total());
    }
}
