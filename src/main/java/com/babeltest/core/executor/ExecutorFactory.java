package com.babeltest.core.executor;

import com.babeltest.core.resolve.InstanceLifecycle;
import com.babeltest.core.resolve.TargetRegistry;
import com.babeltest.runtime.RuntimeProperties;
import com.babeltest.runtime.SubprocessExecutor;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Opens the executor a run asks for: the in-process Java executor, or a configured child runtime.
 */
public class ExecutorFactory {

    private static final Logger log = LoggerFactory.getLogger(ExecutorFactory.class);

    private final TargetRegistry registry;
    private final ExecutionSettings javaSettings;
    private final Map<String, RuntimeProperties> runtimes;
    private final ObjectMapper mapper;

    public ExecutorFactory(TargetRegistry registry, ExecutionSettings javaSettings,
                           Map<String, RuntimeProperties> runtimes, ObjectMapper mapper) {
        this.registry = registry;
        this.javaSettings = javaSettings;
        this.runtimes = runtimes == null ? Map.of() : Map.copyOf(runtimes);
        this.mapper = mapper;
    }

    public TestExecutor create(String name) {
        return create(name, false, null);
    }

    /**
     * @param name      {@code "java"} (or {@code null}) for in-process, otherwise a configured runtime name
     * @param debug     force debug logging in the executor
     * @param lifecycle instance lifecycle override, {@code null} to keep the configured one
     * @throws IllegalArgumentException for an unknown runtime name
     * @throws com.babeltest.runtime.RuntimeStartupException when a runtime's build fails
     */
    public TestExecutor create(String name, boolean debug, InstanceLifecycle lifecycle) {
        if (name == null || name.isBlank() || InProcessExecutor.NAME.equals(name)) {
            ExecutionSettings settings = javaSettings;
            if (debug) {
                settings = settings.withDebug(true);
            }
            if (lifecycle != null) {
                settings = settings.withLifecycle(lifecycle);
            }
            log.debug("Using in-process executor ({} lifecycle)", settings.lifecycle());
            return new InProcessExecutor(registry, settings);
        }

        RuntimeProperties configured = runtimes.get(name);
        if (configured == null) {
            throw new IllegalArgumentException("Unknown runtime '" + name + "'. Available: " + available());
        }
        if (configured.getCommand() == null || configured.getCommand().isEmpty()) {
            throw new IllegalArgumentException("Runtime '" + name + "' has no command configured");
        }
        RuntimeProperties properties = configured.copy();
        if (debug) {
            properties.setDebug(true);
        }
        if (lifecycle != null) {
            properties.getConfig().put("lifecycle", lifecycle);
        }
        log.debug("Using runtime '{}': {}", name, properties.getCommand());
        return SubprocessExecutor.start(name, properties, mapper);
    }

    public Set<String> available() {
        var names = new TreeSet<>(runtimes.keySet());
        names.add(InProcessExecutor.NAME);
        return names;
    }
}
