package com.babeltest.dispatch.cli;

import com.babeltest.core.engine.RunSummary;
import com.babeltest.core.events.RunEvent;
import com.babeltest.core.model.OutputBlock;
import com.babeltest.core.model.ResultStatus;
import com.babeltest.core.model.TestResult;
import picocli.CommandLine;

import java.util.List;
import java.util.Map;

/**
 * ANSI-colored terminal output utilities for the BabelTest CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [BABELTEST]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) ✓|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) ✗|@ " + message));
    }

    public static void detail(String message) {
        System.out.println("    " + message);
    }

    /**
     * Live progress: a header per suite and one line per finished test, printed as the
     * orchestrator publishes them.
     */
    public static void progress(RunEvent event) {
        switch (event.eventType()) {
            case RunEvent.SUITE_STARTED -> System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "@|bold " + event.suite() + "|@"));
            case RunEvent.TEST_COMPLETED -> System.out.println(progressLine(event.payload()));
            default -> { }
        }
    }

    static String progressLine(Map<String, Object> payload) {
        ResultStatus status = ResultStatus.fromWire(String.valueOf(payload.get("status")));
        return CommandLine.Help.Ansi.AUTO.string("  " + icon(status) + " " + payload.get("name")
                + " @|faint (" + payload.get("durationMs") + " ms)|@");
    }

    /**
     * Prints the message and captured output of every failure and error, then the summary line.
     *
     * @param showAllLogs also print passing tests that captured output
     */
    public static RunSummary results(List<TestResult> results, boolean showAllLogs) {
        List<TestResult> detailed = results.stream()
                .filter(result -> result.isUnsuccessful() || (showAllLogs && !result.output().isEmpty()))
                .toList();
        if (!detailed.isEmpty()) {
            System.out.println();
            for (TestResult result : detailed) {
                System.out.println(format(result, showAllLogs));
            }
        }
        RunSummary summary = RunSummary.of(results);
        String color = summary.successful() ? "fg(green)" : "fg(red)";
        System.out.println();
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold," + color + " " + summary + "|@"));
        return summary;
    }

    static String format(TestResult result, boolean showAllLogs) {
        StringBuilder line = new StringBuilder(CommandLine.Help.Ansi.AUTO.string(
                "  " + icon(result.status()) + " " + result.test().displayName()));
        if (result.isUnsuccessful() && result.message() != null) {
            for (String messageLine : result.message().split("\n")) {
                line.append("\n      ").append(messageLine);
            }
        }
        if (result.isUnsuccessful() || showAllLogs) {
            for (OutputBlock block : result.output()) {
                line.append("\n      ").append(block.stream()).append(':');
                for (String outputLine : block.text().stripTrailing().split("\n")) {
                    line.append("\n        ").append(outputLine);
                }
            }
        }
        return line.toString();
    }

    private static String icon(ResultStatus status) {
        return switch (status) {
            case PASSED -> "@|fg(green) ✓|@";
            case FAILED -> "@|fg(red) ✗|@";
            case ERROR -> "@|fg(yellow) !|@";
            case SKIPPED -> "@|faint -|@";
        };
    }
}
