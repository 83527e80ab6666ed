package com.plangraph.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Runs the {@code plangraph} command tree once at startup, with command
 * instances taken from the Spring context, and keeps the resulting status for
 * {@link com.plangraph.PlangraphApplication}'s exit.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final PlangraphCommand plangraphCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(PlangraphCommand plangraphCommand, IFactory factory) {
        this.plangraphCommand = plangraphCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        exitCode = new CommandLine(plangraphCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
