package com.babeltest.dispatch.cli;

import com.babeltest.config.BabelTestProperties;
import com.babeltest.core.diagnostics.BabelTestException;
import com.babeltest.core.engine.RunSummary;
import com.babeltest.core.engine.TestOrchestrator;
import com.babeltest.core.events.EventBus;
import com.babeltest.core.executor.ExecutorFactory;
import com.babeltest.core.executor.TestExecutor;
import com.babeltest.core.ir.IrLoadException;
import com.babeltest.core.ir.IrLoader;
import com.babeltest.core.logging.DebugLogging;
import com.babeltest.core.metrics.RunMetrics;
import com.babeltest.core.model.IrDocument;
import com.babeltest.core.model.TestResult;
import com.babeltest.core.resolve.InstanceLifecycle;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: babeltest run &lt;ir.json&gt;
 * <p>
 * Executes every test in the IR file against the selected runtime, printing one line per
 * test as it completes, then failure details and a summary. Exits non-zero when any test failed or errored.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run tests from an IR JSON file")
@Component
public class RunCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "IR JSON file")
    private Path path;

    @Option(names = {"--runtime", "-r"},
            description = "Runtime to execute against: java (in-process) or a configured runtime name")
    private String runtime;

    @Option(names = "--debug", description = "Debug logging, and show captured output for every test")
    private boolean debug;

    @Option(names = "--show-logs", description = "Show captured output for passing tests too")
    private boolean showLogs;

    @Option(names = "--lifecycle", description = "Instance lifecycle: ${COMPLETION-CANDIDATES}")
    private InstanceLifecycle lifecycle;

    private final IrLoader irLoader;
    private final ExecutorFactory executorFactory;
    private final BabelTestProperties properties;
    private final EventBus eventBus;
    private final RunMetrics metrics;

    public RunCommand(IrLoader irLoader, ExecutorFactory executorFactory, BabelTestProperties properties,
                      EventBus eventBus, RunMetrics metrics) {
        this.irLoader = irLoader;
        this.executorFactory = executorFactory;
        this.properties = properties;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    @Override
    public Integer call() {
        if (debug) {
            DebugLogging.enable();
        }

        IrDocument document;
        try {
            document = irLoader.load(path);
        } catch (IrLoadException e) {
            ConsoleOutput.error("Error loading IR: " + e.getMessage());
            return 1;
        }

        String runtimeName = runtime != null ? runtime : properties.getDefaultRuntime();
        TestExecutor executor;
        try {
            executor = executorFactory.create(runtimeName, debug, lifecycle);
        } catch (IllegalArgumentException | BabelTestException e) {
            ConsoleOutput.error("Cannot start runtime '" + runtimeName + "': " + e.getMessage());
            return 1;
        }

        String runId = TestOrchestrator.generateRunId();
        ConsoleOutput.info("Run " + runId + ": tests from " + path + " (" + executor.name() + ")");
        List<TestResult> results;
        EventBus.Subscription progress = eventBus.subscribe(runId, ConsoleOutput::progress);
        try (TestOrchestrator orchestrator = new TestOrchestrator(executor, eventBus, metrics)) {
            results = orchestrator.run(runId, document);
        } finally {
            progress.unsubscribe();
        }

        RunSummary summary = ConsoleOutput.results(results, debug || showLogs);
        return summary.successful() ? 0 : 1;
    }
}
