package com.taskforge.dispatch.cli;

import com.taskforge.core.audit.VerificationReport;
import com.taskforge.core.model.Intent;
import com.taskforge.core.model.TaskStep;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output for the Taskforge CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) TASKFORGE v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [TASKFORGE]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void step(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(blue) >|@ " + message));
    }

    public static void intent(Intent intent) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Intent|@ (" + intent.classifiedBy().name().toLowerCase()
                        + (intent.multiStep() ? ", multi-step" : "") + ")"));
        int n = 1;
        for (TaskStep step : intent.steps()) {
            String capabilities = step.requiredCapabilities().isEmpty()
                    ? "-" : String.join(", ", step.requiredCapabilities());
            System.out.printf("  %d. %-10s %s  (%s)%n", n++, step.action().wireName(), capabilities,
                    step.reasoning());
        }
    }

    public static void report(VerificationReport report) {
        if (report.ok()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(green),bold [ALLOW]|@ " + report.total() + " entries verified"));
        } else {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(red),bold [DENY]|@ " + report.reason()));
        }
        System.out.println("  Checks: " + String.join(", ", report.checks()));
        if (report.counters() != null) {
            var c = report.counters();
            System.out.println("  Unsigned: " + c.unsigned() + ", unverified: " + c.unverified()
                    + ", missing decision context: " + c.missingDecisionContext());
        }
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
