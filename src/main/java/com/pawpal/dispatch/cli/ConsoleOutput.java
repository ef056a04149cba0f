package com.pawpal.dispatch.cli;

import com.pawpal.core.model.Task;
import com.pawpal.core.model.TimeOfDay;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the PawPal CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) PAWPAL v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [PAWPAL]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void warning(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void rationale(String entry) {
        String color = entry.startsWith("accepted") ? "fg(green)" : "fg(red)";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|" + color + " -|@ " + entry));
    }

    /**
     * One table row: time range, task, pet name.
     */
    public static void taskRow(Task task, String petName) {
        String when = task.scheduledTime().isPresent()
                ? TimeOfDay.format(task.scheduledTime().getAsInt())
                : "--:--";
        System.out.printf("  %-6s %-4s %-24s %-12s %-11s %4dmin  P%d  %s%n",
                when, task.isCompleted() ? "[x]" : "[ ]", task.name(), petName,
                task.category().label(), task.durationMinutes(), task.priority(), task.dueDate());
    }
}
