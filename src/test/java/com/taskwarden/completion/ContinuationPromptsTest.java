package com.taskwarden.completion;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ContinuationPromptsTest {

    @Test
    @DisplayName("partial prompt fills in placeholders for blank fields")
    void partialDefaults() {
        String prompt = ContinuationPrompts.partialCompletion(null, " ", "");

        assertTrue(prompt.startsWith("You called complete_task with status=\"partial\""));
        assertTrue(prompt.contains("\"(not provided)\""));
        assertTrue(prompt.contains("## What You Said Remains\n(not specified)"));
        assertFalse(prompt.contains("%s"));
    }

    @Test
    @DisplayName("partial prompt keeps the sections in order")
    void partialSections() {
        String prompt = ContinuationPrompts.partialCompletion("deploy", "ship it", "built it");

        int original = prompt.indexOf("## Original Request");
        int completed = prompt.indexOf("## What You Completed");
        int remains = prompt.indexOf("## What You Said Remains");
        int plan = prompt.indexOf("## REQUIRED: Create a Continuation Plan");
        int rules = prompt.indexOf("## IMPORTANT RULES");
        assertTrue(original < completed && completed < remains && remains < plan && plan < rules);
        assertTrue(prompt.contains("\"ship it\""));
    }

    @Test
    @DisplayName("todo prompt lists the open items")
    void unresolvedTodos() {
        String list = ContinuationPrompts.formatTodos(List.of(
                new TodoItem("1", "Write tests", TodoStatus.PENDING, null),
                new TodoItem("2", "Fix lint", TodoStatus.IN_PROGRESS, null)));

        assertEquals("- Write tests\n- Fix lint", list);
        String prompt = ContinuationPrompts.unresolvedTodos(list);
        assertTrue(prompt.contains(list));
        assertTrue(prompt.contains("status=\"success\""));
    }

    @Test
    @DisplayName("empty todo list renders as empty text")
    void formatEmpty() {
        assertEquals("", ContinuationPrompts.formatTodos(List.of()));
    }
}
