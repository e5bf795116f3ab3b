package com.auditlead.dispatch.cli;

import com.auditlead.core.model.AgentName;
import com.auditlead.core.model.RunReport;
import com.auditlead.core.model.TaskRecord;
import com.auditlead.core.model.TaskStatus;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Auditlead CLI.
 */
public class ConsoleOutput {

    static final String NO_AGENTS_HINT =
            "No agent implementations are registered. Agents are contributed as Agent beans on the classpath.";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) AUDITLEAD v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [AUDITLEAD]|@ " + message));
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

    public static void agentProgress(String agentName, Object percent, Object label) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(blue) [" + AgentName.displayNameOf(agentName) + "]|@ " + percent + "% " + label));
    }

    public static void agentCompleted(String agentName) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(green) [DONE]|@ " + AgentName.displayNameOf(agentName)));
    }

    public static void agentFailed(String agentName, Object error) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(red) [FAIL]|@ " + AgentName.displayNameOf(agentName) + ": " + error));
    }

    /**
     * Prints one line per agent and the overall outcome.
     */
    public static void summary(RunReport report) {
        System.out.println();
        System.out.println("RUN " + report.runId());
        System.out.println("Target: " + report.targetId());
        System.out.println("Mode: " + report.mode());
        System.out.println();
        if (report.records().isEmpty()) {
            warn(NO_AGENTS_HINT);
        }
        for (TaskRecord record : report.records()) {
            System.out.printf("  %-18s %-10s %3d%%  %s%n",
                    record.name(), record.status().wireName(), record.progressPercent(), detail(record));
        }
        System.out.println();
        String counts = String.format("%d completed, %d failed, %d skipped in %ds",
                report.count(TaskStatus.COMPLETED), report.failed().size(), report.skipped().size(),
                report.elapsed().toSeconds());
        switch (report.outcome()) {
            case SUCCEEDED -> success("Audit succeeded: " + counts);
            case PARTIAL -> warn("Audit partially succeeded: " + counts);
            case NO_OUTPUT -> error("No agent produced output: " + counts);
        }
        if (report.cancelled()) {
            warn("Run was cancelled before all agents finished");
        }
    }

    private static String detail(TaskRecord record) {
        return switch (record.status()) {
            case FAILED -> record.errorDetail();
            case PENDING -> "skipped";
            default -> "";
        };
    }
}
