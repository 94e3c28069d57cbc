package com.taskwarden.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskwarden.completion.CompletionDeclaration;
import com.taskwarden.completion.CompletionEnforcer;
import com.taskwarden.completion.DeclarationStatus;
import com.taskwarden.completion.StepFinishAction;
import com.taskwarden.completion.TodoItem;
import com.taskwarden.completion.TodoStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Feeds one task's agent events into its {@link CompletionEnforcer} and remembers the
 * session id and any error the agent reported.
 */
public class CompletionSignalRouter {

    private static final Logger log = LoggerFactory.getLogger(CompletionSignalRouter.class);

    private final CompletionEnforcer enforcer;
    private String sessionId;
    private String errorMessage;

    public CompletionSignalRouter(CompletionEnforcer enforcer) {
        this.enforcer = enforcer;
    }

    /**
     * @return the enforcer's decision for STEP_FINISH events, {@link StepFinishAction#COMPLETE}
     *         when the agent reported an error, {@link StepFinishAction#CONTINUE} otherwise
     */
    public StepFinishAction route(AgentEvent event) {
        if (event.sessionId() != null && (sessionId == null || event.type() == AgentEventType.STEP_START)) {
            sessionId = event.sessionId();
        }

        if (event.isToolInvocation()) {
            handleToolCall(event.tool(), event.input());
            return StepFinishAction.CONTINUE;
        }

        return switch (event.type()) {
            case STEP_FINISH -> {
                if ("error".equals(event.reason())) {
                    recordError("Task failed");
                    yield StepFinishAction.COMPLETE;
                }
                yield enforcer.handleStepFinish(event.reason());
            }
            case ERROR -> {
                recordError(event.text());
                yield StepFinishAction.COMPLETE;
            }
            case STEP_START, TEXT, TOOL_CALL, TOOL_USE -> StepFinishAction.CONTINUE;
        };
    }

    public String sessionId() {
        return sessionId;
    }

    public boolean hasError() {
        return errorMessage != null;
    }

    public String errorMessage() {
        return errorMessage;
    }

    private void handleToolCall(String tool, JsonNode input) {
        log.debug("Tool call: {}", tool);

        if (ToolClassification.isStartTask(tool) && input.path("needs_planning").asBoolean(false)) {
            enforcer.markTaskRequiresCompletion();
            List<TodoItem> steps = stepsToTodos(input.path("steps"));
            if (!steps.isEmpty()) {
                enforcer.updateTodos(steps);
            }
        }

        enforcer.markToolsUsed(ToolClassification.countsForContinuation(tool));

        if (ToolClassification.isCompleteTask(tool)) {
            enforcer.handleCompleteTaskDetection(toDeclaration(input));
        }

        if (ToolClassification.isTodoWrite(tool)) {
            List<TodoItem> todos = toTodos(input.path("todos"));
            if (!todos.isEmpty()) {
                enforcer.updateTodos(todos);
            }
        }
    }

    private void recordError(String message) {
        if (errorMessage == null) {
            errorMessage = message != null ? message : "Unknown error";
            log.warn("Agent reported an error: {}", errorMessage);
        }
    }

    static CompletionDeclaration toDeclaration(JsonNode input) {
        if (input == null || !input.isObject()) {
            return null;
        }
        return new CompletionDeclaration(
                DeclarationStatus.from(textOrNull(input, "status")),
                textOrNull(input, "summary"),
                textOrNull(input, "original_request_summary"),
                textOrNull(input, "remaining_work"),
                textOrNull(input, "blocker"));
    }

    static List<TodoItem> toTodos(JsonNode todos) {
        if (!todos.isArray()) {
            return List.of();
        }
        List<TodoItem> result = new ArrayList<>();
        for (JsonNode todo : todos) {
            String id = textOrNull(todo, "id");
            result.add(new TodoItem(
                    id != null ? id : UUID.randomUUID().toString(),
                    todo.path("content").asText(""),
                    TodoStatus.from(textOrNull(todo, "status")),
                    textOrNull(todo, "priority")));
        }
        return result;
    }

    static List<TodoItem> stepsToTodos(JsonNode steps) {
        if (!steps.isArray()) {
            return List.of();
        }
        List<TodoItem> result = new ArrayList<>();
        int index = 0;
        for (JsonNode step : steps) {
            result.add(new TodoItem(String.valueOf(index + 1), step.asText(""),
                    index == 0 ? TodoStatus.IN_PROGRESS : TodoStatus.PENDING, "medium"));
            index++;
        }
        return result;
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isTextual() ? value.asText() : null;
    }
}
