package com.taskwarden.agent;

import com.taskwarden.completion.CompletionFlowState;

/**
 * Result of driving one task to completion.
 *
 * @param taskId               task identifier
 * @param status               final classification
 * @param finalState           enforcer state when the task was finalized
 * @param continuationAttempts continuation prompts used
 * @param leaseSource          "warm", "cold" or "direct" (no pooled server)
 * @param sessionId            agent session id, if the agent reported one
 * @param summary              the agent's completion summary, if it declared one
 * @param error                error message for {@link TaskStatus#ERROR}, otherwise null
 */
public record TaskOutcome(
    String taskId,
    TaskStatus status,
    CompletionFlowState finalState,
    int continuationAttempts,
    String leaseSource,
    String sessionId,
    String summary,
    String error
) {

    public boolean isSuccess() {
        return status == TaskStatus.COMPLETED;
    }
}
