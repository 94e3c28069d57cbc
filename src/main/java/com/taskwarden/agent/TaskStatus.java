package com.taskwarden.agent;

public enum TaskStatus {
    COMPLETED,
    BLOCKED,
    MAX_RETRIES,
    ERROR
}
