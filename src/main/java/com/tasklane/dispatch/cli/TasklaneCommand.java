package com.tasklane.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Tasklane.
 */
@Command(
        name = "tasklane",
        mixinStandardHelpOptions = true,
        version = "Tasklane 0.1.0",
        description = "Wave-based task list execution engine",
        subcommands = {
                RunCommand.class,
                PlanCommand.class,
                StatusCommand.class,
                LogCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class TasklaneCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
