package com.taskwarden.pool;

/**
 * Readiness check for a spawned worker.
 */
@FunctionalInterface
public interface HealthProbe {

    /**
     * @return true when the worker at {@code baseUrl} answers and is ready for use
     */
    boolean isReady(String baseUrl);
}
