package com.taskwarden.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

/**
 * One parsed line of agent output. Fields not carried by a given {@link AgentEventType}
 * are null.
 *
 * @param type       message type
 * @param sessionId  agent session the message belongs to
 * @param text       text content (TEXT) or error message (ERROR)
 * @param tool       tool name (TOOL_CALL, TOOL_USE)
 * @param input      tool input object, never null ({@link NullNode} when absent)
 * @param toolStatus tool execution status reported by TOOL_USE, e.g. "completed"
 * @param reason     end reason (STEP_FINISH), e.g. "stop", "tool_use", "error"
 */
public record AgentEvent(
    AgentEventType type,
    String sessionId,
    String text,
    String tool,
    JsonNode input,
    String toolStatus,
    String reason
) {

    public AgentEvent {
        if (input == null) input = NullNode.getInstance();
    }

    public static AgentEvent stepStart(String sessionId) {
        return new AgentEvent(AgentEventType.STEP_START, sessionId, null, null, null, null, null);
    }

    public static AgentEvent text(String sessionId, String text) {
        return new AgentEvent(AgentEventType.TEXT, sessionId, text, null, null, null, null);
    }

    public static AgentEvent toolCall(String sessionId, String tool, JsonNode input) {
        return new AgentEvent(AgentEventType.TOOL_CALL, sessionId, null, tool, input, null, null);
    }

    public static AgentEvent toolUse(String sessionId, String tool, JsonNode input, String status) {
        return new AgentEvent(AgentEventType.TOOL_USE, sessionId, null, tool, input, status, null);
    }

    public static AgentEvent stepFinish(String sessionId, String reason) {
        return new AgentEvent(AgentEventType.STEP_FINISH, sessionId, null, null, null, null, reason);
    }

    public static AgentEvent error(String sessionId, String message) {
        return new AgentEvent(AgentEventType.ERROR, sessionId, message, null, null, null, null);
    }

    public boolean isToolInvocation() {
        return type == AgentEventType.TOOL_CALL || type == AgentEventType.TOOL_USE;
    }
}
