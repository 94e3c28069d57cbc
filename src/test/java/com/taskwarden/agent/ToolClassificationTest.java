package com.taskwarden.agent;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class ToolClassificationTest {

    @ParameterizedTest
    @ValueSource(strings = {"todowrite", "complete_task", "AskUserQuestion", "start_task",
            "report_checkpoint", "mcp_complete_task", "dcp_prune"})
    @DisplayName("bookkeeping tools do not count as task work")
    void bookkeeping(String tool) {
        assertFalse(ToolClassification.countsForContinuation(tool));
    }

    @ParameterizedTest
    @ValueSource(strings = {"bash", "read", "edit", "webfetch", "complete_task_helper", "todowriter"})
    @DisplayName("other tools count as task work")
    void taskTools(String tool) {
        assertTrue(ToolClassification.countsForContinuation(tool));
    }

    @Test
    @DisplayName("unnamed tools count as task work")
    void nullTool() {
        assertTrue(ToolClassification.countsForContinuation(null));
    }

    @Test
    @DisplayName("special tools match with or without a server prefix")
    void specialTools() {
        assertTrue(ToolClassification.isCompleteTask("complete_task"));
        assertTrue(ToolClassification.isCompleteTask("agent_complete_task"));
        assertFalse(ToolClassification.isCompleteTask("completetask"));
        assertTrue(ToolClassification.isTodoWrite("todowrite"));
        assertTrue(ToolClassification.isStartTask("tools_start_task"));
        assertFalse(ToolClassification.isStartTask(null));
    }
}
