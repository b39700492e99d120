package com.babeltest.config;

import com.babeltest.core.executor.ExecutionSettings;
import com.babeltest.core.resolve.InstanceLifecycle;
import com.babeltest.runtime.RuntimeProperties;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "babeltest")
public class BabelTestProperties {

    private String defaultRuntime = "java";
    private Java java = new Java();
    private Map<String, RuntimeProperties> runtimes = new LinkedHashMap<>();

    public String getDefaultRuntime() { return defaultRuntime; }
    public void setDefaultRuntime(String defaultRuntime) { this.defaultRuntime = defaultRuntime; }
    public Java getJava() { return java; }
    public void setJava(Java java) { this.java = java; }
    public Map<String, RuntimeProperties> getRuntimes() { return runtimes; }
    public void setRuntimes(Map<String, RuntimeProperties> runtimes) { this.runtimes = runtimes; }

    public ExecutionSettings toSettings() {
        return new ExecutionSettings(java.factoriesPackage, java.instanceLifecycle,
                java.captureOutput, java.timeoutMs, java.debug);
    }

    public static class Java {
        private String factoriesPackage = ExecutionSettings.DEFAULT_FACTORIES_PACKAGE;
        private InstanceLifecycle instanceLifecycle = InstanceLifecycle.SHARED;
        private boolean captureOutput = false;
        private Integer timeoutMs;
        private boolean debug = false;

        public String getFactoriesPackage() { return factoriesPackage; }
        public void setFactoriesPackage(String factoriesPackage) { this.factoriesPackage = factoriesPackage; }
        public InstanceLifecycle getInstanceLifecycle() { return instanceLifecycle; }
        public void setInstanceLifecycle(InstanceLifecycle instanceLifecycle) { this.instanceLifecycle = instanceLifecycle; }
        public boolean isCaptureOutput() { return captureOutput; }
        public void setCaptureOutput(boolean captureOutput) { this.captureOutput = captureOutput; }
        public Integer getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(Integer timeoutMs) { this.timeoutMs = timeoutMs; }
        public boolean isDebug() { return debug; }
        public void setDebug(boolean debug) { this.debug = debug; }
    }
}
