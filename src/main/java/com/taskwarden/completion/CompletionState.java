package com.taskwarden.completion;

/**
 * Transition table of {@link CompletionFlowState} plus the continuation attempt counter.
 * Not thread-safe; owned by one {@link CompletionEnforcer}.
 */
class CompletionState {

    private final int maxContinuationAttempts;
    private CompletionFlowState state = CompletionFlowState.IDLE;
    private int continuationAttempts;
    private CompletionDeclaration declaration;

    CompletionState(int maxContinuationAttempts) {
        this.maxContinuationAttempts = maxContinuationAttempts;
    }

    CompletionFlowState state() {
        return state;
    }

    int continuationAttempts() {
        return continuationAttempts;
    }

    int maxContinuationAttempts() {
        return maxContinuationAttempts;
    }

    CompletionDeclaration declaration() {
        return declaration;
    }

    void recordDeclaration(CompletionDeclaration accepted) {
        this.declaration = accepted;
        state = switch (accepted.status()) {
            case SUCCESS -> CompletionFlowState.DONE;
            case PARTIAL -> CompletionFlowState.PARTIAL_CONTINUATION_PENDING;
            case BLOCKED, UNKNOWN -> CompletionFlowState.BLOCKED;
        };
    }

    /**
     * Owes the agent a reminder prompt.
     *
     * @return false when the attempt budget is spent (state becomes MAX_RETRIES_REACHED)
     *         or the task is no longer in a state that takes reminders
     */
    boolean scheduleContinuation() {
        if (state != CompletionFlowState.IDLE && state != CompletionFlowState.CONTINUATION_PENDING) {
            return false;
        }
        continuationAttempts++;
        if (continuationAttempts > maxContinuationAttempts) {
            state = CompletionFlowState.MAX_RETRIES_REACHED;
            return false;
        }
        state = CompletionFlowState.CONTINUATION_PENDING;
        return true;
    }

    void startContinuation() {
        if (state == CompletionFlowState.CONTINUATION_PENDING) {
            state = CompletionFlowState.IDLE;
        }
    }

    /**
     * Consumes one attempt for a partial-completion continuation.
     *
     * @return false when the attempt budget is spent (state becomes MAX_RETRIES_REACHED)
     */
    boolean startPartialContinuation() {
        if (state != CompletionFlowState.PARTIAL_CONTINUATION_PENDING) {
            return false;
        }
        continuationAttempts++;
        if (continuationAttempts > maxContinuationAttempts) {
            state = CompletionFlowState.MAX_RETRIES_REACHED;
            return false;
        }
        state = CompletionFlowState.IDLE;
        return true;
    }

    boolean isPendingContinuation() {
        return state == CompletionFlowState.CONTINUATION_PENDING;
    }

    boolean isPendingPartialContinuation() {
        return state == CompletionFlowState.PARTIAL_CONTINUATION_PENDING;
    }

    boolean isDone() {
        return state.isTerminal();
    }

    void reset() {
        state = CompletionFlowState.IDLE;
        continuationAttempts = 0;
        declaration = null;
    }
}
