package com.taskwarden.agent;

import java.util.Optional;

/**
 * Message types of the agent CLI's {@code --format json} output that the driver understands.
 */
public enum AgentEventType {
    STEP_START("step_start"),
    TEXT("text"),
    TOOL_CALL("tool_call"),
    TOOL_USE("tool_use"),
    STEP_FINISH("step_finish"),
    ERROR("error");

    private final String wireName;

    AgentEventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<AgentEventType> fromWireName(String value) {
        for (AgentEventType type : values()) {
            if (type.wireName.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
