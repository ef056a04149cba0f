package com.pawpal.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for PawPal.
 * Routes to subcommands: plan, conflicts, tasks.
 */
@Command(
        name = "pawpal",
        mixinStandardHelpOptions = true,
        version = "PawPal 0.1.0",
        description = "Pet care planner: fits prioritized care tasks into a daily time budget",
        subcommands = {
                PlanCommand.class,
                ConflictsCommand.class,
                TasksCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class PawPalCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
