package com.taskwarden.completion;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Hooks through which a {@link CompletionEnforcer} drives the task it supervises.
 */
public interface CompletionCallbacks {

    /**
     * Restart the agent with {@code prompt}. The returned future completes once the
     * continuation has been dispatched.
     */
    CompletableFuture<Void> onStartContinuation(String prompt);

    /** Finalize the task. */
    void onComplete();

    /**
     * Instrumentation for every state transition. Not used for control flow.
     *
     * @param category short tag, e.g. "complete_task", "continuation"
     */
    default void onDebug(String category, String message, Map<String, Object> data) {
    }
}
