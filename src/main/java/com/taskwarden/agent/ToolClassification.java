package com.taskwarden.agent;

import java.util.List;

/**
 * Sorts agent tools into task work and bookkeeping. Bookkeeping tools alone never make a
 * turn count as task work. Tool names may carry a server prefix ({@code <server>_<name>}).
 */
public final class ToolClassification {

    private static final List<String> BOOKKEEPING_TOOLS = List.of(
            "discard", "extract", "context_info", "prune", "distill",
            "todowrite", "complete_task", "AskUserQuestion",
            "report_checkpoint", "report_thought", "request_file_permission",
            "skill", "start_task");

    private ToolClassification() {}

    public static boolean countsForContinuation(String toolName) {
        if (toolName == null) {
            return true;
        }
        return BOOKKEEPING_TOOLS.stream().noneMatch(base -> matches(toolName, base));
    }

    public static boolean isCompleteTask(String toolName) {
        return matches(toolName, "complete_task");
    }

    public static boolean isTodoWrite(String toolName) {
        return matches(toolName, "todowrite");
    }

    public static boolean isStartTask(String toolName) {
        return matches(toolName, "start_task");
    }

    static boolean matches(String toolName, String baseName) {
        return toolName != null && (toolName.equals(baseName) || toolName.endsWith("_" + baseName));
    }
}
