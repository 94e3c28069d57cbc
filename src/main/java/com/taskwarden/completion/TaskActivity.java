package com.taskwarden.completion;

/**
 * Tool-usage flags that decide whether a turn was purely conversational.
 *
 * <p>{@code toolsUsedEver} and {@code requiresCompletion} are sticky for the life of the
 * task; {@code toolsUsedThisTurn} is cleared whenever a continuation turn begins.
 *
 * @param toolsUsedThisTurn  any tool was called in the current turn, bookkeeping tools included
 * @param toolsUsedEver      a task tool was called at some point in this task
 * @param requiresCompletion the task declared a plan or todo list and must finish with
 *                           an explicit completion declaration
 */
public record TaskActivity(
    boolean toolsUsedThisTurn,
    boolean toolsUsedEver,
    boolean requiresCompletion
) {

    public static TaskActivity initial() {
        return new TaskActivity(false, false, false);
    }

    /**
     * @param countsForContinuation false for bookkeeping tools; they mark the current turn
     *                              but leave the sticky flag alone
     */
    public TaskActivity withToolCall(boolean countsForContinuation) {
        return new TaskActivity(true, toolsUsedEver || countsForContinuation, requiresCompletion);
    }

    public TaskActivity withRequiresCompletion() {
        return new TaskActivity(toolsUsedThisTurn, toolsUsedEver, true);
    }

    public TaskActivity nextTurn() {
        return new TaskActivity(false, toolsUsedEver, requiresCompletion);
    }

    public TurnKind classify() {
        boolean conversational = !toolsUsedThisTurn && !toolsUsedEver && !requiresCompletion;
        return conversational ? TurnKind.CONVERSATIONAL : TurnKind.TASK;
    }
}
