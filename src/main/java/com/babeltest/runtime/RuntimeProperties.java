package com.babeltest.runtime;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Launch settings of one child runtime, bound from {@code babeltest.runtimes.<name>}.
 */
public class RuntimeProperties {

    private List<String> command = new ArrayList<>();
    private List<String> buildCommand = new ArrayList<>();
    private String workingDir = ".";
    private String factories;
    private boolean debug = false;
    private long responseTimeoutMs = 30_000;
    private long shutdownTimeoutMs = 5_000;
    private Map<String, Object> config = new LinkedHashMap<>();

    public List<String> getCommand() { return command; }
    public void setCommand(List<String> command) { this.command = command; }
    public List<String> getBuildCommand() { return buildCommand; }
    public void setBuildCommand(List<String> buildCommand) { this.buildCommand = buildCommand; }
    public String getWorkingDir() { return workingDir; }
    public void setWorkingDir(String workingDir) { this.workingDir = workingDir; }
    public String getFactories() { return factories; }
    public void setFactories(String factories) { this.factories = factories; }
    public boolean isDebug() { return debug; }
    public void setDebug(boolean debug) { this.debug = debug; }
    public long getResponseTimeoutMs() { return responseTimeoutMs; }
    public void setResponseTimeoutMs(long responseTimeoutMs) { this.responseTimeoutMs = responseTimeoutMs; }
    public long getShutdownTimeoutMs() { return shutdownTimeoutMs; }
    public void setShutdownTimeoutMs(long shutdownTimeoutMs) { this.shutdownTimeoutMs = shutdownTimeoutMs; }
    public Map<String, Object> getConfig() { return config; }
    public void setConfig(Map<String, Object> config) { this.config = config; }

    public boolean hasBuildCommand() {
        return buildCommand != null && !buildCommand.isEmpty();
    }

    /** Independent copy, so per-run overrides never leak into the bound configuration. */
    public RuntimeProperties copy() {
        RuntimeProperties copy = new RuntimeProperties();
        copy.command = new ArrayList<>(command);
        copy.buildCommand = buildCommand == null ? new ArrayList<>() : new ArrayList<>(buildCommand);
        copy.workingDir = workingDir;
        copy.factories = factories;
        copy.debug = debug;
        copy.responseTimeoutMs = responseTimeoutMs;
        copy.shutdownTimeoutMs = shutdownTimeoutMs;
        copy.config = config == null ? new LinkedHashMap<>() : new LinkedHashMap<>(config);
        return copy;
    }
}
