package com.pawpal.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments and delegates to the appropriate command.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final PawPalCommand pawPalCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(PawPalCommand pawPalCommand, IFactory factory) {
        this.pawPalCommand = pawPalCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        exitCode = commandLine(pawPalCommand, factory).execute(args);
    }

    /**
     * The configured command line: enum option values such as {@code --sort priority}
     * match regardless of case.
     */
    static CommandLine commandLine(PawPalCommand root, IFactory factory) {
        return new CommandLine(root, factory)
                .setCaseInsensitiveEnumValuesAllowed(true);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
