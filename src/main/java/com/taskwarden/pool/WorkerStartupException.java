package com.taskwarden.pool;

/**
 * Thrown when a worker process could not be launched or never became ready.
 */
public class WorkerStartupException extends PoolException {

    public WorkerStartupException(String message) {
        super(message);
    }

    public WorkerStartupException(String message, Throwable cause) {
        super(message, cause);
    }
}
