package com.taskwarden.agent;

/**
 * @param prompt    prompt passed to the agent
 * @param sessionId session to resume, or null for a new session
 * @param attachUrl base URL of a pooled server to attach to, or null to run standalone
 */
public record AgentRunRequest(String prompt, String sessionId, String attachUrl) {

    public AgentRunRequest {
        if (prompt == null) {
            throw new IllegalArgumentException("prompt must not be null");
        }
    }
}
