package com.taskwarden.pool;

/**
 * Lifecycle of a pooled agent server process.
 */
public enum WorkerState {
    /** Spawned for the idle queue, readiness probe not yet passed. */
    STARTING,
    IDLE,
    IN_USE
}
