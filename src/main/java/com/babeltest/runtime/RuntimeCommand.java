package com.babeltest.runtime;

import com.babeltest.core.model.TestSpec;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * One request line sent to a child runtime.
 *
 * @param action    {@code run}, {@code lifecycle} or {@code exit}
 * @param test      the test to execute, for {@code run}
 * @param lifecycle boundary event name, for {@code lifecycle}
 * @param data      event payload, for {@code lifecycle}
 * @param config    runtime configuration; only on the first command sent to a process
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RuntimeCommand(
    String action,
    TestSpec test,
    String lifecycle,
    Map<String, Object> data,
    Map<String, Object> config
) {
    public static final String RUN = "run";
    public static final String LIFECYCLE = "lifecycle";
    public static final String EXIT = "exit";

    public static final String SUITE_START = "suite_start";
    public static final String SUITE_END = "suite_end";
    public static final String TEST_START = "test_start";
    public static final String TEST_END = "test_end";
    public static final String CLEAR_CACHE = "clear_cache";

    public static RuntimeCommand run(TestSpec test) {
        return new RuntimeCommand(RUN, test, null, null, null);
    }

    public static RuntimeCommand lifecycle(String event, String name) {
        return new RuntimeCommand(LIFECYCLE, null, event, name == null ? Map.of() : Map.of("name", name), null);
    }

    public static RuntimeCommand exit() {
        return new RuntimeCommand(EXIT, null, null, null, null);
    }

    public RuntimeCommand withConfig(Map<String, Object> newConfig) {
        return new RuntimeCommand(action, test, lifecycle, data, newConfig);
    }
}
