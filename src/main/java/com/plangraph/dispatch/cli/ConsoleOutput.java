package com.plangraph.dispatch.cli;

import com.plangraph.core.parser.DroppedElement;
import com.plangraph.core.schema.PlanBuildException;
import picocli.CommandLine;

import java.util.List;

/**
 * ANSI-colored terminal output utilities for the plangraph CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) PLANGRAPH v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [PLANGRAPH]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void buildFailure(PlanBuildException e) {
        error("Build failed [" + e.getKind() + "]: " + e.getMessage());
    }

    public static void dropped(DroppedElement element) {
        String id = element.id().isEmpty() ? "<no id>" : element.id();
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(yellow) [DROPPED]|@ " + element.level().name().toLowerCase() + " " + id +
                " (" + element.reason() + (element.detail().isEmpty() ? "" : ": " + element.detail()) + ")"));
    }

    public static void readyTask(String taskId, String description) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(green) READY|@ " + taskId + (description.isEmpty() ? "" : " " + description)));
    }

    public static void blockedTask(String taskId, List<String> blockers) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(red) BLOCKED|@ " + taskId + " waiting on " + String.join(", ", blockers)));
    }
}
