package com.taskwarden.completion;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Decides, at every turn boundary of an agent task, whether the agent is still working,
 * owes a continuation prompt, or is finished.
 *
 * <p>Guards against two failure modes: agents that stop without ever calling
 * {@code complete_task}, and agents that declare success while their own todo list still
 * has open items. Continuations are bounded by {@code maxContinuationAttempts}; once the
 * budget is spent the task is finalized as {@link CompletionFlowState#MAX_RETRIES_REACHED}.
 *
 * <p>One instance per task. Not thread-safe; the task driver feeds it from a single thread.
 * {@link #reset()} prepares it for the next task.
 */
public class CompletionEnforcer {

    private static final Logger log = LoggerFactory.getLogger(CompletionEnforcer.class);

    public static final int DEFAULT_MAX_CONTINUATION_ATTEMPTS = 10;

    private static final List<String> TURN_END_REASONS = List.of("stop", "end_turn");

    private final CompletionCallbacks callbacks;
    private final CompletionState state;

    private List<TodoItem> currentTodos = List.of();
    private TaskActivity activity = TaskActivity.initial();
    private boolean inContinuation;
    private boolean declarationAccepted;
    private boolean downgradedByTodos;

    public CompletionEnforcer(CompletionCallbacks callbacks) {
        this(callbacks, DEFAULT_MAX_CONTINUATION_ATTEMPTS);
    }

    /**
     * @param maxContinuationAttempts continuation prompts allowed per task; 0 finalizes a task
     *                                as {@link CompletionFlowState#MAX_RETRIES_REACHED} the first
     *                                time it would need one
     */
    public CompletionEnforcer(CompletionCallbacks callbacks, int maxContinuationAttempts) {
        if (callbacks == null) {
            throw new IllegalArgumentException("callbacks must not be null");
        }
        if (maxContinuationAttempts < 0) {
            throw new IllegalArgumentException("maxContinuationAttempts must be >= 0, got " + maxContinuationAttempts);
        }
        this.callbacks = callbacks;
        this.state = new CompletionState(maxContinuationAttempts);
    }

    /**
     * Stores the agent's latest todo list. A non-empty list means the task must end with an
     * explicit completion declaration.
     */
    public void updateTodos(List<TodoItem> todos) {
        currentTodos = todos == null ? List.of() : List.copyOf(todos);
        if (!currentTodos.isEmpty()) {
            activity = activity.withRequiresCompletion();
        }
        debug("todo_update", "Todo list updated (" + currentTodos.size() + " items, "
                + incompleteTodos().size() + " incomplete)", Map.of("todos", currentTodos));
    }

    public void markToolsUsed() {
        markToolsUsed(true);
    }

    /**
     * @param countsForContinuation false for bookkeeping tools; the current turn still counts
     *                              as task work, later turns do not
     */
    public void markToolsUsed(boolean countsForContinuation) {
        activity = activity.withToolCall(countsForContinuation);
    }

    /** Set when the agent started a planned task; sticky until {@link #reset()}. */
    public void markTaskRequiresCompletion() {
        activity = activity.withRequiresCompletion();
    }

    /**
     * Processes a {@code complete_task} call.
     *
     * @param declaration the parsed call, or null when the tool input could not be read
     * @return true if the declaration was acted upon, false for a duplicate in the same turn
     */
    public boolean handleCompleteTaskDetection(CompletionDeclaration declaration) {
        if (declarationAccepted) {
            debug("complete_task", "Ignoring duplicate complete_task call", Map.of("state", state.state().name()));
            return false;
        }
        CompletionDeclaration effective = declaration != null ? declaration : CompletionDeclaration.unknown();
        if (effective.status() == DeclarationStatus.UNKNOWN) {
            log.warn("complete_task called without a recognised status, treating the task as blocked");
        }

        List<TodoItem> open = incompleteTodos();
        downgradedByTodos = false;
        if (effective.status() == DeclarationStatus.SUCCESS && !open.isEmpty()) {
            String remaining = ContinuationPrompts.formatTodos(open);
            debug("incomplete_todos", "complete_task(success) rejected, " + open.size() + " todo item(s) still open",
                    Map.of("incompleteTodos", remaining));
            effective = effective.downgradedToPartial(remaining);
            downgradedByTodos = true;
        }

        state.recordDeclaration(effective);
        declarationAccepted = true;
        if (state.isDone()) {
            inContinuation = false;
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("status", effective.status().wireName());
        data.put("summary", effective.summary());
        if (effective.remainingWork() != null) data.put("remainingWork", effective.remainingWork());
        if (effective.blocker() != null) data.put("blocker", effective.blocker());
        data.put("state", state.state().name());
        debug("complete_task", "complete_task(" + effective.status().wireName() + ") -> " + state.state(), data);
        return true;
    }

    /**
     * Called at each {@code step_finish} event.
     *
     * @param reason the agent's end reason; only "stop" and "end_turn" end a turn
     */
    public StepFinishAction handleStepFinish(String reason) {
        if (reason == null || !TURN_END_REASONS.contains(reason)) {
            return StepFinishAction.CONTINUE;
        }
        if (state.isPendingPartialContinuation()) {
            return StepFinishAction.PENDING;
        }
        if (activity.classify() == TurnKind.CONVERSATIONAL) {
            debug("skip_continuation", "No tools used, treating the turn as conversational",
                    Map.of("reason", reason));
            return StepFinishAction.COMPLETE;
        }
        if (state.isDone()) {
            return StepFinishAction.COMPLETE;
        }
        if (state.scheduleContinuation()) {
            debug("continuation", "Scheduled continuation prompt (attempt " + state.continuationAttempts() + ")",
                    Map.of("attempt", state.continuationAttempts()));
            return StepFinishAction.PENDING;
        }
        log.warn("Agent stopped without complete_task after {} continuation attempts, giving up",
                state.maxContinuationAttempts());
        debug("max_retries", "Continuation limit reached",
                Map.of("attempts", state.continuationAttempts(), "max", state.maxContinuationAttempts()));
        return StepFinishAction.COMPLETE;
    }

    /**
     * Called once the agent process for the current turn has exited. Either dispatches a
     * continuation through {@link CompletionCallbacks#onStartContinuation(String)} or
     * finalizes the task through {@link CompletionCallbacks#onComplete()}.
     */
    public CompletableFuture<Void> handleProcessExit(int exitCode) {
        if (exitCode != 0) {
            debug("process_exit", "Agent process exited with code " + exitCode + ", finalizing",
                    Map.of("exitCode", exitCode));
            return finish();
        }

        if (state.isPendingPartialContinuation()) {
            CompletionDeclaration declaration = state.declaration();
            List<TodoItem> open = incompleteTodos();
            boolean todoDriven = downgradedByTodos && !open.isEmpty();
            String prompt = todoDriven
                    ? ContinuationPrompts.unresolvedTodos(ContinuationPrompts.formatTodos(open))
                    : ContinuationPrompts.partialCompletion(declaration.remainingWork(),
                            declaration.originalRequestSummary(), declaration.summary());

            if (!state.startPartialContinuation()) {
                log.warn("Partial completion after {} continuation attempts, giving up",
                        state.maxContinuationAttempts());
                debug("max_retries", "Continuation limit reached on partial completion",
                        Map.of("attempts", state.continuationAttempts(), "max", state.maxContinuationAttempts()));
                return finish();
            }

            Map<String, Object> data = new LinkedHashMap<>();
            data.put("kind", todoDriven ? "todo" : "partial");
            data.put("summary", declaration.summary());
            if (declaration.remainingWork() != null) data.put("remainingWork", declaration.remainingWork());
            data.put("continuationPrompt", prompt);
            debug("partial_continuation",
                    "Starting partial continuation (attempt " + state.continuationAttempts() + ")", data);
            return dispatchContinuation(prompt);
        }

        if (state.isPendingContinuation()) {
            state.startContinuation();
            debug("continuation", "Starting continuation task (attempt " + state.continuationAttempts() + ")",
                    Map.of("kind", "reminder", "attempt", state.continuationAttempts()));
            return dispatchContinuation(ContinuationPrompts.reminder());
        }

        return finish();
    }

    /** True once the task resolved to DONE, BLOCKED or MAX_RETRIES_REACHED. */
    public boolean shouldComplete() {
        return state.isDone();
    }

    public boolean isInContinuation() {
        return inContinuation;
    }

    public void reset() {
        state.reset();
        currentTodos = List.of();
        activity = TaskActivity.initial();
        inContinuation = false;
        declarationAccepted = false;
        downgradedByTodos = false;
    }

    public CompletionFlowState getState() {
        return state.state();
    }

    public int getContinuationAttempts() {
        return state.continuationAttempts();
    }

    public int getMaxContinuationAttempts() {
        return state.maxContinuationAttempts();
    }

    public List<TodoItem> getTodos() {
        return currentTodos;
    }

    TaskActivity getActivity() {
        return activity;
    }

    /** The last accepted declaration (after any todo-driven downgrade), or null. */
    public CompletionDeclaration getDeclaration() {
        return state.declaration();
    }

    private List<TodoItem> incompleteTodos() {
        return currentTodos.stream()
                .filter(todo -> !todo.status().isResolved())
                .toList();
    }

    private CompletableFuture<Void> dispatchContinuation(String prompt) {
        activity = activity.nextTurn();
        inContinuation = true;
        declarationAccepted = false;
        downgradedByTodos = false;
        try {
            CompletableFuture<Void> started = callbacks.onStartContinuation(prompt);
            return started != null ? started : CompletableFuture.completedFuture(null);
        } catch (RuntimeException e) {
            log.error("Failed to start continuation: {}", e.getMessage(), e);
            return CompletableFuture.failedFuture(e);
        }
    }

    private CompletableFuture<Void> finish() {
        try {
            callbacks.onComplete();
            return CompletableFuture.completedFuture(null);
        } catch (RuntimeException e) {
            log.error("Completion callback failed: {}", e.getMessage(), e);
            return CompletableFuture.failedFuture(e);
        }
    }

    private void debug(String category, String message, Map<String, Object> data) {
        log.debug("[{}] {}", category, message);
        try {
            callbacks.onDebug(category, message, data);
        } catch (RuntimeException e) {
            log.debug("Debug callback threw for {}: {}", category, e.getMessage());
        }
    }
}
