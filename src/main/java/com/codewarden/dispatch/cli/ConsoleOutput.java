package com.codewarden.dispatch.cli;

import com.codewarden.core.model.AnalysisReport;
import com.codewarden.core.model.Enrichment;
import com.codewarden.core.model.Issue;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Codewarden CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) CODEWARDEN v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [CODEWARDEN]|@ " + message));
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

    public static void issue(Issue issue) {
        String location = issue.line() != null ? "L" + issue.line() : "file";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|" + severityColor(issue) + " " + issue.severity().wireName().toUpperCase() + "|@ "
                        + "@|faint " + location + "|@ [" + issue.category().wireName() + "] "
                        + issue.message()));
        if (issue.suggestion() != null) {
            System.out.println("      → " + issue.suggestion());
        }
    }

    public static void report(String label, AnalysisReport report) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold " + label + "|@  score " + scoreText(report.score())
                        + "  (" + report.issues().size() + " issues)"));
        report.issues().forEach(ConsoleOutput::issue);
        if (report.isDegraded()) {
            warn("Skipped rules: " + String.join(", ", report.degradedRules()));
        }
        Enrichment enrichment = report.enrichment();
        switch (enrichment.status()) {
            case OK -> {
                System.out.println("──────────────────────────────────");
                System.out.println(enrichment.summary());
            }
            case TIMEOUT, FAILED -> warn("Assessment unavailable: " + enrichment.error());
            case SKIPPED -> { }
        }
    }

    private static String scoreText(int score) {
        String color = score >= 80 ? "fg(green)" : score >= 50 ? "fg(yellow)" : "fg(red)";
        return "@|bold," + color + " " + score + "/100|@";
    }

    private static String severityColor(Issue issue) {
        return switch (issue.severity()) {
            case CRITICAL -> "bold,fg(red)";
            case HIGH -> "fg(red)";
            case MEDIUM -> "fg(yellow)";
            case LOW -> "fg(cyan)";
        };
    }
}
