package com.taskwarden.completion;

public enum TurnKind {
    /** The agent answered without doing task work; no completion declaration is required. */
    CONVERSATIONAL,
    TASK
}
