package com.taskwarden.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setTask and setWorker put correlation keys in MDC")
    void setKeys() {
        MdcContext.setTask("task-42");
        MdcContext.setWorker("linux", 3);
        MdcContext.setAttempt(2);

        assertEquals("task-42", MDC.get("taskId"));
        assertEquals("linux", MDC.get("pool"));
        assertEquals("3", MDC.get("workerId"));
        assertEquals("2", MDC.get("attempt"));
    }

    @Test
    @DisplayName("clear removes every key")
    void clear() {
        MdcContext.setTask("task-42");
        MdcContext.setWorker("linux", 3);

        MdcContext.clear();

        assertNull(MDC.get("taskId"));
        assertNull(MDC.get("pool"));
        assertNull(MDC.get("workerId"));
    }
}
