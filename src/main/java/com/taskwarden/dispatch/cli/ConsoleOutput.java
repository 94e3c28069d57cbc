package com.taskwarden.dispatch.cli;

import com.taskwarden.agent.TaskOutcome;
import com.taskwarden.pool.PoolSnapshot;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output for the Taskwarden CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) TASKWARDEN v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [TASKWARDEN]|@ " + message));
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

    public static void agent(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(blue) [AGENT]|@ " + message));
    }

    public static void continuation(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(magenta) [CONTINUE]|@ " + message));
    }

    public static void poolSnapshot(PoolSnapshot s) {
        String state = s.disposed() ? "@|fg(red) disposed|@"
                : !s.enabled() ? "@|fg(yellow) disabled|@"
                : s.warmupSuspended() ? "@|fg(red) warmups suspended|@"
                : "@|fg(green) active|@";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Pool " + s.name() + "|@ (" + state + ")"));
        System.out.println("  Workers: " + s.total() + "/" + s.maxTotal()
                + " (" + s.idle() + " idle, " + s.inUse() + " in use, " + s.starting() + " starting)");
        System.out.println("  Min idle: " + s.minIdle() + ", warming: " + s.warming());
        if (s.warmupFailureStreak() > 0) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(yellow) Warmup failure streak " + s.warmupFailureStreak()
                            + ", next retry in " + formatDuration(s.backoffRemainingMs()) + "|@"));
        }
    }

    public static void outcome(TaskOutcome outcome) {
        System.out.println("──────────────────────────────────");
        String status = switch (outcome.status()) {
            case COMPLETED -> "@|fg(green),bold COMPLETED|@";
            case BLOCKED -> "@|fg(yellow),bold BLOCKED|@";
            case MAX_RETRIES -> "@|fg(red),bold MAX RETRIES|@";
            case ERROR -> "@|fg(red),bold ERROR|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string("Task " + outcome.taskId() + ": " + status));
        System.out.println("  Server: " + outcome.leaseSource()
                + ", continuations: " + outcome.continuationAttempts()
                + ", final state: " + outcome.finalState());
        if (outcome.summary() != null && !outcome.summary().isBlank()) {
            System.out.println("  Summary: " + outcome.summary());
        }
        if (outcome.error() != null) {
            error(outcome.error());
        }
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
