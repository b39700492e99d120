package com.babeltest.runtime;

import com.babeltest.core.diagnostics.ValueFormatter;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * A long-lived child runtime speaking newline-delimited JSON over stdin/stdout.
 *
 * <p>The process starts lazily on the first command and is restarted lazily when it has
 * died; every new process receives the runtime configuration with its first command.
 * stderr is drained into a bounded tail that is attached to crash reports, or inherited
 * in debug mode.
 */
public class RuntimeProcess implements RuntimeChannel {

    private static final Logger log = LoggerFactory.getLogger(RuntimeProcess.class);

    private final String name;
    private final RuntimeProperties properties;
    private final ObjectMapper mapper;
    private final StderrTail stderr = new StderrTail();

    private Process process;
    private ExecutorService reader;
    private BufferedWriter input;
    private BufferedReader output;
    private Thread drainer;
    private boolean configSent;
    private boolean closed;
    private int starts;

    public RuntimeProcess(String name, RuntimeProperties properties, ObjectMapper mapper) {
        this.name = name;
        this.properties = properties;
        this.mapper = mapper;
    }

    /**
     * Runs the runtime's build command, if it has one, and waits for it.
     *
     * @throws RuntimeStartupException when the build cannot run or exits non-zero
     */
    public static void build(String name, RuntimeProperties properties) {
        if (!properties.hasBuildCommand()) {
            return;
        }
        List<String> command = properties.getBuildCommand();
        log.info("Building runtime '{}': {}", name, command);
        var tail = new StderrTail();
        try {
            var process = new ProcessBuilder(command)
                    .directory(new File(properties.getWorkingDir()))
                    .redirectErrorStream(true)
                    .start();
            process.getOutputStream().close();
            try (var lines = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = lines.readLine()) != null) {
                    log.debug("[{} build] {}", name, line);
                    tail.append(line);
                }
            }
            int exitCode = process.waitFor();
            if (exitCode != 0) {
                throw new RuntimeStartupException("Build of runtime '%s' failed (exit %d):%n%s"
                        .formatted(name, exitCode, tail.text()));
            }
        } catch (IOException e) {
            throw new RuntimeStartupException("Cannot run build command for runtime '" + name + "': " + command, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeStartupException("Interrupted while building runtime '" + name + "'", e);
        }
    }

    @Override
    public synchronized RuntimeResponse send(RuntimeCommand command) {
        if (closed) {
            throw new ProtocolException("Runtime '" + name + "' is shut down");
        }
        ensureRunning();
        RuntimeCommand outbound = configSent ? command : command.withConfig(configPayload());
        configSent = true;
        write(outbound);
        String line = readLine();
        if (line == null || line.isBlank()) {
            throw crash("No response from runtime '" + name + "'", null);
        }
        try {
            return mapper.readValue(line, RuntimeResponse.class);
        } catch (JsonProcessingException e) {
            // the stream is out of step with our commands from here on
            discard();
            throw new ProtocolException("Invalid JSON from runtime '" + name + "': "
                    + ValueFormatter.format(line, 200), e);
        }
    }

    public synchronized boolean isAlive() {
        return process != null && process.isAlive();
    }

    /** Number of processes launched so far, restarts included. */
    public synchronized int starts() {
        return starts;
    }

    String stderrTail() {
        return stderr.text();
    }

    Map<String, Object> configPayload() {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("project_root", Path.of(properties.getWorkingDir()).toAbsolutePath().normalize().toString());
        if (properties.getFactories() != null) {
            config.put("factories", properties.getFactories());
        }
        config.put("debug", properties.isDebug());
        if (properties.getConfig() != null) {
            config.putAll(properties.getConfig());
        }
        return config;
    }

    // -- process management ----------------------------------------------

    private void ensureRunning() {
        if (process != null && process.isAlive()) {
            return;
        }
        if (process != null) {
            log.warn("Runtime '{}' exited with code {}; restarting", name, process.exitValue());
        }
        start();
    }

    private void start() {
        List<String> command = properties.getCommand();
        if (command == null || command.isEmpty()) {
            throw new RuntimeStartupException("No command configured for runtime '" + name + "'");
        }
        var builder = new ProcessBuilder(command).directory(new File(properties.getWorkingDir()));
        builder.redirectError(properties.isDebug() ? ProcessBuilder.Redirect.INHERIT : ProcessBuilder.Redirect.PIPE);
        try {
            process = builder.start();
        } catch (IOException e) {
            throw new RuntimeStartupException("Cannot start runtime '" + name + "': " + command, e);
        }
        input = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));
        output = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8));
        if (reader != null) {
            reader.shutdownNow();
        }
        reader = newReader(process.pid());
        stderr.clear();
        drainer = null;
        if (!properties.isDebug()) {
            drain(process.getErrorStream());
        }
        configSent = false;
        starts++;
        log.info("Started runtime '{}' (pid {}): {}", name, process.pid(), command);
    }

    private ExecutorService newReader(long pid) {
        return Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "babeltest-" + name + "-reader-" + pid);
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Kills the current process and waits for it, so the next command always starts a
     * fresh one. Closing the pipes releases a read still blocked on the old stdout.
     */
    private void discard() {
        Process dead = process;
        if (dead == null) {
            return;
        }
        dead.descendants().forEach(ProcessHandle::destroyForcibly);
        dead.destroyForcibly();
        try {
            if (!dead.waitFor(properties.getShutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
                log.warn("Runtime '{}' (pid {}) did not die within {} ms", name, dead.pid(),
                        properties.getShutdownTimeoutMs());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        closeQuietly(dead.getOutputStream());
        closeQuietly(dead.getInputStream());
        reader.shutdownNow();
        process = null;
        log.info("Discarded runtime '{}' (pid {})", name, dead.pid());
    }

    private void closeQuietly(Closeable stream) {
        try {
            stream.close();
        } catch (IOException e) {
            log.debug("Closing a pipe of runtime '{}' failed: {}", name, e.getMessage());
        }
    }

    private void drain(InputStream errorStream) {
        drainer = new Thread(() -> {
            try (var lines = new BufferedReader(new InputStreamReader(errorStream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = lines.readLine()) != null) {
                    stderr.append(line);
                    log.debug("[{}] {}", name, line);
                }
            } catch (IOException e) {
                log.debug("stderr of runtime '{}' closed: {}", name, e.getMessage());
            }
        }, "babeltest-" + name + "-stderr");
        drainer.setDaemon(true);
        drainer.start();
    }

    private void write(RuntimeCommand command) {
        try {
            input.write(mapper.writeValueAsString(command));
            input.newLine();
            input.flush();
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Cannot encode command '" + command.action() + "': " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw crash("Runtime '" + name + "' process died", e);
        }
    }

    private String readLine() {
        BufferedReader source = output;
        long timeoutMs = properties.getResponseTimeoutMs();
        try {
            if (timeoutMs <= 0) {
                return source.readLine();
            }
            Future<String> pending = reader.submit(source::readLine);
            try {
                return pending.get(timeoutMs, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                pending.cancel(true);
                discard();
                throw new ProtocolException("No response from runtime '" + name + "' within " + timeoutMs + " ms");
            } catch (ExecutionException e) {
                throw crash("Reading from runtime '" + name + "' failed", e.getCause());
            }
        } catch (IOException e) {
            throw crash("Reading from runtime '" + name + "' failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProtocolException("Interrupted while waiting for runtime '" + name + "'", e);
        }
    }

    private ProtocolException crash(String summary, Throwable cause) {
        var message = new StringBuilder(summary);
        try {
            if (process.waitFor(200, TimeUnit.MILLISECONDS)) {
                message.append(" (exit code ").append(process.exitValue()).append(')');
                if (drainer != null) {
                    drainer.join(500);
                }
            } else {
                discard();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        String tail = stderr.text();
        if (!tail.isEmpty()) {
            message.append(":\n").append(tail);
        }
        return new ProtocolException(message.toString(), cause);
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            if (process != null && process.isAlive()) {
                shutdown();
            }
        } finally {
            if (reader != null) {
                reader.shutdownNow();
            }
        }
    }

    private void shutdown() {
        long timeoutMs = properties.getShutdownTimeoutMs();
        try {
            write(RuntimeCommand.exit());
            input.close();
        } catch (ProtocolException | IOException e) {
            log.debug("Runtime '{}' did not accept exit: {}", name, e.getMessage());
        }
        try {
            if (!process.waitFor(timeoutMs, TimeUnit.MILLISECONDS)) {
                process.destroy();
                if (!process.waitFor(timeoutMs, TimeUnit.MILLISECONDS)) {
                    log.warn("Runtime '{}' did not exit within {} ms; killing it", name, timeoutMs);
                    process.destroyForcibly();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
        }
        log.info("Runtime '{}' stopped", name);
    }
}
