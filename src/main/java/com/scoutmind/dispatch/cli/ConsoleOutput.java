package com.scoutmind.dispatch.cli;

import com.scoutmind.core.progress.Progress;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Scoutmind CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) SCOUTMIND v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [SCOUTMIND]|@ " + message));
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

    public static void progress(Progress progress) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(blue) " + formatPercent(progress.percent()) + "|@ " + progress.description()));
    }

    public static void task(int index, String action, String outcome) {
        String color = "ok".equals(outcome) ? "fg(green)" : "fg(red)";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|" + color + " " + outcome + "|@ task " + index + " (" + action + ")"));
    }

    public static void report(String markdown) {
        System.out.println("──────────────────────────────────");
        System.out.println(markdown);
        System.out.println("──────────────────────────────────");
    }

    public static void duration(long ms) {
        info("Finished in " + formatDuration(ms));
    }

    static String formatPercent(int percent) {
        return String.format("[%3d%%]", percent);
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
