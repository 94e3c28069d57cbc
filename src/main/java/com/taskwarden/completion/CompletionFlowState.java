package com.taskwarden.completion;

/**
 * Per-task completion state.
 *
 * <pre>
 * IDLE -> DONE | BLOCKED | PARTIAL_CONTINUATION_PENDING | CONTINUATION_PENDING
 * PARTIAL_CONTINUATION_PENDING | CONTINUATION_PENDING -> IDLE (continuation dispatched) | MAX_RETRIES_REACHED
 * </pre>
 */
public enum CompletionFlowState {
    IDLE,
    BLOCKED,
    PARTIAL_CONTINUATION_PENDING,
    CONTINUATION_PENDING,
    MAX_RETRIES_REACHED,
    DONE;

    public boolean isTerminal() {
        return this == DONE || this == BLOCKED || this == MAX_RETRIES_REACHED;
    }
}
