package com.babeltest.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while a run progresses.
 *
 * @param eventType event type (e.g. "run.started", "suite.started", "test.completed")
 * @param runId     the run this event belongs to
 * @param suite     the suite this event relates to (nullable for run-level and top-level test events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record RunEvent(
    String eventType,
    String runId,
    String suite,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String RUN_STARTED = "run.started";
    public static final String SUITE_STARTED = "suite.started";
    public static final String TEST_COMPLETED = "test.completed";
    public static final String SUITE_COMPLETED = "suite.completed";
    public static final String RUN_COMPLETED = "run.completed";

    public static RunEvent of(String eventType, String runId, String suite, Map<String, Object> payload) {
        return new RunEvent(eventType, runId, suite, payload, Instant.now());
    }
}
