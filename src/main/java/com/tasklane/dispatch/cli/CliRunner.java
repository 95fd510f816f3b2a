package com.tasklane.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

import java.util.Arrays;

/**
 * Runs one {@code tasklane} subcommand inside the Spring context and hands its exit code back
 * to {@link com.tasklane.TasklaneApplication}. {@code serve} is left to the embedded web server.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final TasklaneCommand rootCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(TasklaneCommand rootCommand, IFactory factory) {
        this.rootCommand = rootCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        if (Arrays.asList(args).contains("serve")) {
            return;
        }
        exitCode = new CommandLine(rootCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
