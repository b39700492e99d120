package com.babeltest.dispatch.cli;

import com.babeltest.core.ir.IrLoadException;
import com.babeltest.core.ir.IrLoader;
import com.babeltest.core.ir.IrValidator;
import com.babeltest.core.model.IrDocument;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: babeltest check &lt;ir.json&gt;
 * <p>
 * Loads and validates an IR file without running anything.
 */
@Command(name = "check", mixinStandardHelpOptions = true, description = "Validate an IR JSON file without running tests")
@Component
public class CheckCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "IR JSON file")
    private Path path;

    private final IrLoader irLoader;
    private final IrValidator irValidator;

    public CheckCommand(IrLoader irLoader, IrValidator irValidator) {
        this.irLoader = irLoader;
        this.irValidator = irValidator;
    }

    @Override
    public Integer call() {
        IrDocument document;
        try {
            document = irLoader.load(path);
        } catch (IrLoadException e) {
            ConsoleOutput.error("Invalid IR: " + e.getMessage());
            return 1;
        }

        List<IrValidator.Problem> problems = irValidator.check(document);
        if (!problems.isEmpty()) {
            ConsoleOutput.error("Invalid IR: " + problems.size() + " problem(s)");
            problems.forEach(problem -> ConsoleOutput.detail(problem.toString()));
            return 1;
        }

        ConsoleOutput.success("Valid IR: " + document.testCount() + " tests in "
                + document.suites().size() + " suites");
        return 0;
    }
}
