package com.taskwarden.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Taskwarden-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setTask(String taskId) {
        MDC.put("taskId", taskId);
    }

    public static void setWorker(String poolName, int workerId) {
        MDC.put("pool", poolName);
        MDC.put("workerId", String.valueOf(workerId));
    }

    public static void setAttempt(int attempt) {
        MDC.put("attempt", String.valueOf(attempt));
    }

    public static void clear() {
        MDC.remove("taskId");
        MDC.remove("pool");
        MDC.remove("workerId");
        MDC.remove("attempt");
    }
}
