package com.shellbridge.dispatch.cli;

import com.shellbridge.core.model.PerformanceMetrics;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the shellbridge CLI.
 * JSON result lines go to stdout unchanged; diagnostics go to stderr.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) SHELLBRIDGE v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void json(String line) {
        System.out.println(line);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [SHELLBRIDGE]|@ " + message));
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
        System.err.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void metrics(PerformanceMetrics m) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Performance|@"));
        System.out.println("  Commands: " + m.commandsExecuted());
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Success rate: @|fg(green) " + String.format("%.1f%%", m.successRate() * 100) + "|@"));
        System.out.println("  Duration: " + formatDuration(m.totalDuration().toMillis())
                + " (avg " + formatDuration(m.averageDuration().toMillis()) + ")");
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
