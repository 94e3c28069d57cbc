package com.taskwarden.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Parses the agent CLI's JSON-lines output.
 *
 * <p>Expected shape: {@code {"type": "...", "part": {...}}}. Lines that are blank, not JSON,
 * or of a type the driver does not handle yield {@link Optional#empty()}.
 */
@Component
public class AgentEventParser {

    private static final Logger log = LoggerFactory.getLogger(AgentEventParser.class);

    private final ObjectMapper objectMapper;

    public AgentEventParser() {
        this(new ObjectMapper());
    }

    public AgentEventParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Optional<AgentEvent> parse(String line) {
        if (line == null || line.isBlank()) {
            return Optional.empty();
        }
        String trimmed = line.trim();
        if (!trimmed.startsWith("{")) {
            log.trace("Skipping non-JSON output: {}", trimmed);
            return Optional.empty();
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(trimmed);
        } catch (JsonProcessingException e) {
            log.debug("Skipping unparseable output line: {}", e.getOriginalMessage());
            return Optional.empty();
        }

        Optional<AgentEventType> type = AgentEventType.fromWireName(root.path("type").asText(""));
        if (type.isEmpty()) {
            log.trace("Ignoring agent message type '{}'", root.path("type").asText());
            return Optional.empty();
        }

        JsonNode part = root.path("part");
        String sessionId = textOrNull(part.path("sessionID"));
        if (sessionId == null) {
            sessionId = textOrNull(root.path("sessionID"));
        }

        return Optional.of(switch (type.get()) {
            case STEP_START -> AgentEvent.stepStart(sessionId);
            case TEXT -> AgentEvent.text(sessionId, part.path("text").asText(""));
            case TOOL_CALL -> AgentEvent.toolCall(sessionId, toolName(part), part.path("input"));
            case TOOL_USE -> AgentEvent.toolUse(sessionId, toolName(part),
                    part.path("state").path("input"), textOrNull(part.path("state").path("status")));
            case STEP_FINISH -> AgentEvent.stepFinish(sessionId, textOrNull(part.path("reason")));
            case ERROR -> AgentEvent.error(sessionId, errorMessage(root.path("error")));
        });
    }

    private static String toolName(JsonNode part) {
        String tool = textOrNull(part.path("tool"));
        return tool != null ? tool : "unknown";
    }

    private static String errorMessage(JsonNode error) {
        if (error.isMissingNode() || error.isNull()) {
            return "Unknown error";
        }
        if (error.isTextual()) {
            return error.asText();
        }
        JsonNode message = error.path("data").path("message");
        if (message.isTextual()) {
            return message.asText();
        }
        message = error.path("message");
        if (message.isTextual()) {
            return message.asText();
        }
        return error.path("name").asText(error.toString());
    }

    private static String textOrNull(JsonNode node) {
        return node.isTextual() ? node.asText() : null;
    }
}
