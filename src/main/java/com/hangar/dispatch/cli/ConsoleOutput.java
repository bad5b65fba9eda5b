package com.hangar.dispatch.cli;

import com.hangar.core.model.Project;
import com.hangar.core.model.ProjectStatus;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Hangar CLI.
 */
public class ConsoleOutput {

    static final String DIVIDER = "──────────────────────────────────";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) HANGAR v0.1.0|@"));
        System.out.println(DIVIDER);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [HANGAR]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void field(String label, Object value) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                String.format("  @|bold %-14s|@ %s", label + ":", value == null ? "-" : value)));
    }

    public static String status(ProjectStatus status) {
        String color = switch (status) {
            case RUNNING -> "fg(green)";
            case STOPPED -> "fg(yellow)";
            case ERROR -> "fg(red)";
            case DELETED -> "faint";
            default -> "fg(cyan)";
        };
        return CommandLine.Help.Ansi.AUTO.string("@|" + color + " " + status.value() + "|@");
    }

    public static void projectRow(Project project, String url) {
        System.out.println(String.format("  %-24s %-12s %-6d %s",
                project.getSlug(), status(project.getStatus()), project.getPort(), url));
    }
}
