package com.babeltest.core.executor;

import com.babeltest.core.resolve.InstanceLifecycle;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Knobs of the in-process executor. Also the shape of the {@code config} object a Java
 * child runtime receives with its first command.
 *
 * @param factoriesPackage package searched for conventional factory classes
 * @param lifecycle        instance reuse policy
 * @param captureOutput    whether stdout/stderr are captured per test
 * @param timeoutMs        budget for tests that set none; {@code null} waits indefinitely
 * @param debug            log resolution details
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExecutionSettings(
    @JsonProperty("factories") String factoriesPackage,
    InstanceLifecycle lifecycle,
    @JsonProperty("capture_output") boolean captureOutput,
    @JsonProperty("timeout_ms") Integer timeoutMs,
    boolean debug
) {
    public static final String DEFAULT_FACTORIES_PACKAGE = "babel.factories";

    public ExecutionSettings {
        if (factoriesPackage == null) {
            factoriesPackage = DEFAULT_FACTORIES_PACKAGE;
        }
        if (lifecycle == null) {
            lifecycle = InstanceLifecycle.SHARED;
        }
    }

    public static ExecutionSettings defaults() {
        return new ExecutionSettings(null, null, false, null, false);
    }

    public ExecutionSettings withLifecycle(InstanceLifecycle newLifecycle) {
        return new ExecutionSettings(factoriesPackage, newLifecycle, captureOutput, timeoutMs, debug);
    }

    public ExecutionSettings withDebug(boolean newDebug) {
        return new ExecutionSettings(factoriesPackage, lifecycle, captureOutput, timeoutMs, newDebug);
    }
}
