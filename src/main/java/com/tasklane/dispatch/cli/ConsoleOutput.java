package com.tasklane.dispatch.cli;

import com.tasklane.core.events.EngineEvent;
import com.tasklane.core.model.RunStatus;
import com.tasklane.core.model.RunSummary;
import picocli.CommandLine;

import java.util.Map;

/**
 * ANSI-colored terminal output utilities for the Tasklane CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) TASKLANE v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [TASKLANE]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void wave(int waveNumber, Object taskIds) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) [WAVE " + waveNumber + "]|@ " + taskIds));
    }

    public static void waveComplete(int waveNumber, int completed, int failed, int skipped) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) [WAVE " + waveNumber + " DONE]|@ " +
                "@|fg(green) " + completed + " completed|@" +
                (failed > 0 ? ", @|fg(red) " + failed + " failed|@" : "") +
                (skipped > 0 ? ", " + skipped + " skipped" : "")));
    }

    public static void taskProgress(String taskId, String status) {
        String color = switch (status) {
            case "COMPLETED" -> "fg(green)";
            case "RETRYING", "BLOCKED" -> "fg(yellow)";
            case "STARTED" -> "fg(blue)";
            default -> "fg(red)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|" + color + " " + status + "|@ " + taskId));
    }

    /**
     * Prints a live engine event in a compact one-line form.
     */
    public static void event(EngineEvent event) {
        Map<String, Object> p = event.payload();
        switch (event.eventType()) {
            case "wave.started" -> wave(asInt(p.get("wave")), p.get("taskIds"));
            case "wave.completed" -> waveComplete(asInt(p.get("wave")), asInt(p.get("completed")),
                    asInt(p.get("failed")), asInt(p.get("skipped")));
            case "task.started" -> taskProgress(event.taskId() + " (attempt " + p.get("attempt") + ")", "STARTED");
            case "task.completed" -> taskProgress(event.taskId(), "COMPLETED");
            case "task.retrying" -> taskProgress(event.taskId() + ": " + p.get("lastError"), "RETRYING");
            case "task.failed" -> taskProgress(event.taskId() + ": " + p.get("lastError"), "FAILED");
            case "task.blocked" -> taskProgress(event.taskId() + " (blocked by " + p.get("blockedBy") + ")", "BLOCKED");
            case "task.escalated" -> taskProgress(event.taskId() + ": " + p.get("analysis"), "ESCALATED");
            case "task.cancelled" -> taskProgress(event.taskId(), "CANCELLED");
            case "worker.stuck" -> error("Worker " + p.get("workerId") + " stuck on " + event.taskId());
            default -> { }
        }
    }

    public static void watchEvent(String eventType, String data) {
        String prefix = switch (eventType) {
            case "run.started", "run.paused", "run.resumed" -> "@|fg(cyan) [RUN]|@";
            case "task.started", "task.completed", "task.progress" -> "@|fg(blue) [TASK]|@";
            case "task.failed", "task.escalated", "task.blocked" -> "@|fg(red) [TASK]|@";
            case "wave.ready", "wave.started", "wave.completed" -> "@|bold,fg(yellow) [WAVE]|@";
            case "run.completed" -> "@|fg(green),bold [COMPLETE]|@";
            case "run.failed", "run.cancelled" -> "@|fg(red),bold [" + eventType.substring(4).toUpperCase() + "]|@";
            default -> "@|fg(white) [" + eventType + "]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + data));
    }

    public static void summary(RunSummary summary) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Run " + summary.runId() + " (#" + summary.runNumber() + ")|@"));
        System.out.println("  Waves completed: " + summary.completedWaves());
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Tasks: @|fg(green) " + summary.completedTaskIds().size() + " completed|@"
                + (summary.failures().isEmpty() ? "" : ", @|fg(red) " + summary.failures().size() + " not completed|@")));
        for (var failure : summary.failures()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "    @|fg(red) -|@ " + failure.taskId() + " [" + failure.kind() + "] "
                    + (failure.detail() != null ? failure.detail() : "")));
        }
        if (summary.status() == RunStatus.COMPLETED) {
            success("Status: " + summary.status());
        } else {
            error("Status: " + summary.status()
                    + (summary.failureReason() != null ? " (" + summary.failureReason() + ")" : ""));
        }
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }

    private static int asInt(Object value) {
        return value instanceof Number n ? n.intValue() : 0;
    }
}
