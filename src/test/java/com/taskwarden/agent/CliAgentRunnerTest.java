package com.taskwarden.agent;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CliAgentRunnerTest {

    @Test
    @DisplayName("standalone run passes only the prompt")
    void standalone() {
        var command = CliAgentRunner.buildCommand("opencode", List.of(),
                new AgentRunRequest("fix the build", null, null));

        assertEquals(List.of("opencode", "run", "--format", "json", "fix the build"), command);
    }

    @Test
    @DisplayName("attached continuation resumes the session")
    void attachedContinuation() {
        var command = CliAgentRunner.buildCommand("opencode", List.of("--print-logs"),
                new AgentRunRequest("REMINDER", "ses_1", "http://127.0.0.1:4100"));

        assertEquals(List.of("opencode", "--print-logs", "run", "--format", "json",
                "--attach", "http://127.0.0.1:4100", "--session", "ses_1", "REMINDER"), command);
    }

    @Test
    @DisplayName("null base args are tolerated")
    void nullArgs() {
        var command = CliAgentRunner.buildCommand("opencode", null, new AgentRunRequest("hi", null, null));
        assertEquals("hi", command.get(command.size() - 1));
    }

    @Test
    @DisplayName("prompt is required")
    void promptRequired() {
        assertThrows(IllegalArgumentException.class, () -> new AgentRunRequest(null, null, null));
    }
}
