package com.babeltest.runtime;

import com.babeltest.core.executor.ExecutionSettings;
import com.babeltest.core.executor.InProcessExecutor;
import com.babeltest.core.ir.IrJson;
import com.babeltest.core.logging.DebugLogging;
import com.babeltest.core.model.TestResult;
import com.babeltest.core.resolve.TargetRegistry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Child-side Java runtime: reads one JSON command per line from stdin and answers one JSON
 * line per command on stdout.
 *
 * <p>Targets come from the {@link com.babeltest.core.resolve.TargetRegistrar}s listed in
 * {@code META-INF/services}. Anything the code under test prints to {@code System.out} is
 * diverted to stderr so it cannot corrupt the protocol stream.
 */
public final class StdioRuntime {

    private static final Logger log = LoggerFactory.getLogger(StdioRuntime.class);

    private final TargetRegistry registry;
    private final ObjectMapper mapper;
    private InProcessExecutor executor;

    public StdioRuntime(TargetRegistry registry, ObjectMapper mapper) {
        this.registry = registry;
        this.mapper = mapper;
    }

    public static void main(String[] args) {
        PrintStream protocol = new PrintStream(new FileOutputStream(FileDescriptor.out), true, StandardCharsets.UTF_8);
        System.setOut(System.err);
        var registry = TargetRegistry.fromServiceLoader(Thread.currentThread().getContextClassLoader());
        var in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        try {
            new StdioRuntime(registry, IrJson.newMapper()).serve(in, protocol);
        } catch (IOException e) {
            log.error("stdin closed unexpectedly", e);
            System.exit(1);
        }
        System.exit(0);
    }

    /**
     * Serves commands until {@code exit} or end of input.
     */
    public void serve(BufferedReader in, PrintStream out) throws IOException {
        try {
            String line;
            while ((line = in.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                RuntimeCommand command;
                try {
                    command = mapper.readValue(line, RuntimeCommand.class);
                } catch (JsonProcessingException e) {
                    respond(out, RuntimeResponse.error("Invalid command: " + e.getOriginalMessage()));
                    continue;
                }
                if (!handle(command, out)) {
                    break;
                }
            }
        } finally {
            if (executor != null) {
                executor.close();
            }
        }
    }

    private boolean handle(RuntimeCommand command, PrintStream out) {
        configure(command.config());
        String action = command.action() == null ? "" : command.action();
        switch (action) {
            case RuntimeCommand.RUN -> {
                if (command.test() == null) {
                    respond(out, RuntimeResponse.error("run command without a test"));
                } else {
                    TestResult result = executor.run(command.test());
                    respond(out, RuntimeResponse.of(result));
                }
            }
            case RuntimeCommand.LIFECYCLE -> {
                lifecycle(command.lifecycle(), command.data());
                respond(out, RuntimeResponse.ok());
            }
            case RuntimeCommand.EXIT -> {
                respond(out, RuntimeResponse.ok());
                return false;
            }
            default -> respond(out, RuntimeResponse.error("Unknown action: " + command.action()));
        }
        return true;
    }

    private void configure(Map<String, Object> config) {
        if (executor != null) {
            return;
        }
        ExecutionSettings settings = config == null
                ? ExecutionSettings.defaults()
                : mapper.convertValue(config, ExecutionSettings.class);
        if (settings.debug()) {
            DebugLogging.enable();
        }
        log.debug("Configured with {}", settings);
        executor = new InProcessExecutor(registry, settings);
    }

    private void lifecycle(String event, Map<String, Object> data) {
        String subject = data != null && data.get("name") != null ? String.valueOf(data.get("name")) : "";
        switch (event == null ? "" : event) {
            case RuntimeCommand.SUITE_START -> executor.onSuiteStart(subject);
            case RuntimeCommand.SUITE_END -> executor.onSuiteEnd(subject);
            case RuntimeCommand.TEST_START -> executor.onTestStart(subject);
            case RuntimeCommand.TEST_END -> executor.onTestEnd(subject);
            case RuntimeCommand.CLEAR_CACHE -> executor.clearCache();
            default -> log.debug("Ignoring lifecycle event {}", event);
        }
    }

    private void respond(PrintStream out, RuntimeResponse response) {
        String json;
        try {
            json = mapper.writeValueAsString(response);
        } catch (JsonProcessingException e) {
            log.debug("Result values not serializable, sending their string form", e);
            try {
                json = mapper.writeValueAsString(response.stringified());
            } catch (JsonProcessingException again) {
                json = "{\"status\":\"error\",\"message\":\"Cannot encode result\"}";
            }
        }
        out.println(json);
        out.flush();
    }
}
