package com.babeltest.core.capture;

import com.babeltest.core.model.OutputBlock;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Redirects {@code System.out} and {@code System.err} while a test runs in-process.
 * A disabled capture is a no-op. {@link #stop()} restores the original streams and may
 * be called more than once.
 */
public class OutputCapture implements AutoCloseable {

    private final boolean enabled;
    private PrintStream originalOut;
    private PrintStream originalErr;
    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private List<OutputBlock> captured = List.of();

    private OutputCapture(boolean enabled) {
        this.enabled = enabled;
    }

    public static OutputCapture start(boolean enabled) {
        OutputCapture capture = new OutputCapture(enabled);
        if (enabled) {
            capture.redirect();
        }
        return capture;
    }

    private void redirect() {
        originalOut = System.out;
        originalErr = System.err;
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    /** Restores the streams and returns the non-empty captured blocks, stdout first. */
    public synchronized List<OutputBlock> stop() {
        if (!enabled || originalOut == null) {
            return captured;
        }
        System.out.flush();
        System.err.flush();
        System.setOut(originalOut);
        System.setErr(originalErr);
        originalOut = null;
        originalErr = null;

        List<OutputBlock> blocks = new ArrayList<>(2);
        String stdout = out.toString(StandardCharsets.UTF_8);
        String stderr = err.toString(StandardCharsets.UTF_8);
        if (!stdout.isEmpty()) {
            blocks.add(new OutputBlock(OutputBlock.STDOUT, stdout));
        }
        if (!stderr.isEmpty()) {
            blocks.add(new OutputBlock(OutputBlock.STDERR, stderr));
        }
        captured = List.copyOf(blocks);
        return captured;
    }

    public List<OutputBlock> captured() {
        return captured;
    }

    @Override
    public void close() {
        stop();
    }
}
