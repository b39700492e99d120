package com.babeltest.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for BabelTest.
 * Routes to subcommands: run, check.
 */
@Command(
        name = "babeltest",
        mixinStandardHelpOptions = true,
        version = "BabelTest 0.1.0",
        description = "Runs language-neutral test specifications against real code",
        subcommands = {
                RunCommand.class,
                CheckCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class BabelTestCommand implements Runnable {

    @Override
    public void run() {
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
