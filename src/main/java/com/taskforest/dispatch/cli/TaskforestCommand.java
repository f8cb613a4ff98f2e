package com.taskforest.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for taskforest.
 * Routes to subcommands: reconstruct, inspect.
 */
@Command(
        name = "taskforest",
        mixinStandardHelpOptions = true,
        version = "Taskforest 0.1.0",
        description = "Rebuilds the parent/child forest of a task transcript corpus",
        subcommands = {
                ReconstructCommand.class,
                InspectCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class TaskforestCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
