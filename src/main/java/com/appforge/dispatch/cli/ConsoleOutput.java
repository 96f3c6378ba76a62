package com.appforge.dispatch.cli;

import com.appforge.core.events.GenerationEvent;
import com.appforge.core.model.GenerationOutcome;
import com.appforge.core.model.GenerationStatus;
import com.appforge.core.model.Task;
import com.appforge.core.model.TaskState;
import com.appforge.core.provider.ProviderHealth;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the AppForge CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) APPFORGE v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [APPFORGE]|@ " + message));
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

    public static void fileChange(String path) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "    @|fg(green) +|@ " + path));
    }

    public static void outcome(GenerationOutcome outcome) {
        if (outcome == null) {
            info("Generation still in progress");
            return;
        }
        switch (outcome) {
            case COMPLETED -> success("Generation complete.");
            case PARTIAL -> warn("Generation partially complete.");
            case FAILED -> error("Generation failed.");
            case CANCELLED -> info("Generation cancelled. Resume it with: appforge resume <id>");
        }
    }

    public static void status(GenerationStatus status, boolean showFiles) {
        System.out.println();
        System.out.println("GENERATION " + status.generationId());
        System.out.println("Requirement: " + status.requirement());
        System.out.println("Checkpoint: " + status.sequence() + (status.running() ? " (running)" : ""));
        if (status.degradedDurability()) {
            warn("Durability degraded: a checkpoint write was lost");
        }

        System.out.println();
        System.out.printf("  %-12s %-10s %-10s %-8s %s%n", "TASK", "STATE", "PROVIDER", "TRIES", "DETAIL");
        System.out.println("  " + "-".repeat(64));
        for (Task task : status.tasks()) {
            String detail = task.lastError() != null && task.state() != TaskState.SUCCEEDED
                    ? task.lastError().kind().id() + ": " + truncate(task.lastError().message(), 40)
                    : task.result() != null ? task.result().files().size() + " file(s)" : "-";
            System.out.printf("  %-12s %-10s %-10s %-8d %s%n", task.id(), task.state(),
                    task.assignedProvider() != null ? task.assignedProvider() : "-", task.attempts(), detail);
            if (showFiles && task.result() != null) {
                task.result().paths().forEach(ConsoleOutput::fileChange);
            }
        }
        System.out.println();
        outcome(status.outcome());
    }

    public static void providerHealth(ProviderHealth.Snapshot snapshot) {
        String color = switch (snapshot.circuitState()) {
            case CLOSED -> "fg(green)";
            case HALF_OPEN -> "fg(yellow)";
            case OPEN -> "fg(red)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(
                "  @|%s %-9s|@ %-12s failure rate %5.1f%%, %d call(s), avg %s, budget %d",
                color, snapshot.circuitState(), snapshot.provider(), snapshot.failureRate(),
                snapshot.totalCalls(), formatDuration(Math.round(snapshot.averageLatencyMs())),
                snapshot.remainingBudget())));
    }

    public static void event(GenerationEvent event) {
        String prefix = switch (event.eventType()) {
            case "generation.planned", "generation.started", "generation.resumed" -> "@|fg(cyan) [GENERATION]|@";
            case "task.started", "task.resumed", "task.succeeded" -> "@|fg(blue) [TASK]|@";
            case "task.retrying" -> "@|fg(yellow) [RETRY]|@";
            case "task.failed", "task.skipped", "task.aborted" -> "@|fg(red) [TASK]|@";
            case "checkpoint.degraded" -> "@|fg(red),bold [CHECKPOINT]|@";
            case "generation.completed" -> "@|fg(green),bold [COMPLETE]|@";
            case "generation.partial" -> "@|fg(yellow),bold [PARTIAL]|@";
            case "generation.failed", "generation.aborted" -> "@|fg(red),bold [FAILED]|@";
            default -> "@|fg(white) [" + event.eventType() + "]|@";
        };
        String subject = event.taskId() != null ? event.taskId() + " " : "";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                prefix + " " + subject + event.eventType() + " " + event.payload()));
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
