package com.plangraph.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for plangraph.
 * Routes to subcommands: validate, ready, outline, flowchart, dot.
 */
@Command(
        name = "plangraph",
        mixinStandardHelpOptions = true,
        version = "plangraph 0.1.0",
        description = "Dependency graph, ready tasks and renderings of epic/story/task plans",
        subcommands = {
                ValidateCommand.class,
                ReadyCommand.class,
                OutlineCommand.class,
                FlowchartCommand.class,
                DotCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class PlangraphCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // bare `plangraph` lists the subcommands
        spec.commandLine().usage(System.out);
    }
}
