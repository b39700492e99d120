package com.babeltest.config;

import com.babeltest.core.executor.ExecutionSettings;
import com.babeltest.core.resolve.InstanceLifecycle;
import com.babeltest.runtime.RuntimeProperties;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BabelTestPropertiesTest {

    @Test
    void defaultsAreReasonable() {
        var props = new BabelTestProperties();
        assertEquals("java", props.getDefaultRuntime());
        assertEquals("babel.factories", props.getJava().getFactoriesPackage());
        assertEquals(InstanceLifecycle.SHARED, props.getJava().getInstanceLifecycle());
        assertFalse(props.getJava().isCaptureOutput());
        assertNull(props.getJava().getTimeoutMs());
        assertTrue(props.getRuntimes().isEmpty());
    }

    @Test
    void javaSectionBecomesExecutionSettings() {
        var props = new BabelTestProperties();
        props.getJava().setFactoriesPackage("my.factories");
        props.getJava().setInstanceLifecycle(InstanceLifecycle.PER_SUITE);
        props.getJava().setCaptureOutput(true);
        props.getJava().setTimeoutMs(250);

        ExecutionSettings settings = props.toSettings();

        assertEquals("my.factories", settings.factoriesPackage());
        assertEquals(InstanceLifecycle.PER_SUITE, settings.lifecycle());
        assertTrue(settings.captureOutput());
        assertEquals(250, settings.timeoutMs());
        assertFalse(settings.debug());
    }

    @Test
    void runtimeDefaultsAreReasonable() {
        var runtime = new RuntimeProperties();
        assertEquals(".", runtime.getWorkingDir());
        assertEquals(30_000, runtime.getResponseTimeoutMs());
        assertEquals(5_000, runtime.getShutdownTimeoutMs());
        assertFalse(runtime.hasBuildCommand());
    }

    @Test
    void runtimeCopyIsIndependent() {
        var runtime = new RuntimeProperties();
        runtime.setCommand(List.of("python", "-m", "babel_runtime"));
        runtime.getConfig().put("lifecycle", "shared");

        var copy = runtime.copy();
        copy.getConfig().put("lifecycle", "per_test");
        copy.setDebug(true);

        assertEquals("shared", runtime.getConfig().get("lifecycle"));
        assertFalse(runtime.isDebug());
        assertEquals(runtime.getCommand(), copy.getCommand());
    }
}
