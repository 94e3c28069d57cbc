package com.taskwarden.completion;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One entry of the agent's own todo list. Read-only for the enforcer.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TodoItem(
    String id,
    String content,
    TodoStatus status,
    String priority
) {

    public TodoItem {
        if (content == null) content = "";
        if (status == null) status = TodoStatus.PENDING;
        if (priority == null || priority.isBlank()) priority = "medium";
    }
}
