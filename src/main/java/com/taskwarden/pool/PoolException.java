package com.taskwarden.pool;

/**
 * Base class for failures raised by {@link ServerPool}.
 */
public class PoolException extends RuntimeException {

    public PoolException(String message) {
        super(message);
    }

    public PoolException(String message, Throwable cause) {
        super(message, cause);
    }
}
