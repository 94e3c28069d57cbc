package com.taskwarden.completion;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Prompt texts sent back to the agent when it stops short of a valid completion.
 */
public final class ContinuationPrompts {

    private ContinuationPrompts() {}

    /**
     * Sent when the agent ended a task turn without calling {@code complete_task}.
     */
    public static String reminder() {
        return """
                REMINDER: You must call complete_task when finished.

                Before going further, check: "Have I actually finished everything the user asked for?"

                - If NO, keep working on the task
                - If YES and every part is done, call complete_task with status: "success"
                - If something outside your control stops you, call complete_task with status: "blocked"
                - If only some parts are done, call complete_task with status: "partial"

                Do NOT call complete_task before the user's request is really complete.""";
    }

    /**
     * Sent after a genuine partial declaration.
     */
    public static String partialCompletion(String remainingWork, String originalRequest, String completedSummary) {
        return """
                You called complete_task with status="partial" but the task is not done yet.

                ## Original Request
                "%s"

                ## What You Completed
                %s

                ## What You Said Remains
                %s

                ## REQUIRED: Create a Continuation Plan

                Before continuing you MUST:

                1. **Re-read the original request** and list every requirement
                2. **Write a TODO list** separating finished items from open ones:

                **Continuation Plan:**
                ✓ [Items already completed]
                □ [Next step] → verify: [how you will confirm it is done]
                □ [Following step] → verify: [how you will confirm it is done]

                3. **Work through the plan** one step at a time
                4. **Call complete_task(success)** only when ALL original requirements are met

                ## IMPORTANT RULES

                - Do NOT call complete_task with "partial" again unless you hit a real TECHNICAL blocker
                - For a real blocker (login wall, CAPTCHA, rate limit, site error) use "blocked"
                - "partial" is NOT an acceptable final status
                - Do NOT ask the user whether to continue, just continue

                Write your continuation plan now and resume the remaining work."""
                .formatted(orDefault(originalRequest, "(not provided)"),
                        orDefault(completedSummary, "(not provided)"),
                        orDefault(remainingWork, "(not specified)"));
    }

    /**
     * Sent when a success declaration was downgraded because todo items are still open.
     *
     * @param incompleteTodos pre-rendered bullet list, see {@link #formatTodos(List)}
     */
    public static String unresolvedTodos(String incompleteTodos) {
        return """
                Your complete_task call was rejected because these todo items are still marked incomplete:

                %s

                Call todowrite to mark each item as "completed" or "cancelled", then call complete_task with status="success".

                If any items are not done yet, complete them first.""".formatted(incompleteTodos);
    }

    /** Renders todo items as {@code - content} lines. */
    public static String formatTodos(List<TodoItem> todos) {
        return todos.stream()
                .map(todo -> "- " + todo.content())
                .collect(Collectors.joining("\n"));
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
