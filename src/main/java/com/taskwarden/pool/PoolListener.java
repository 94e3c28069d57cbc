package com.taskwarden.pool;

/**
 * Observer for pool lifecycle moments. Used for metrics and event publishing, never for
 * control flow; exceptions thrown by a listener are logged and dropped by the pool.
 */
public interface PoolListener {

    PoolListener NONE = new PoolListener() {};

    default void leaseAcquired(String poolName, String source) {}

    default void workerReady(String poolName, int workerId, String url, long startupMs) {}

    default void workerExited(String poolName, int workerId, Integer exitCode, WorkerState lastState) {}

    default void warmupFailed(String poolName, int failureStreak, long backoffMs, Throwable error) {}

    default void warmupSuspended(String poolName, int consecutiveFailures) {}
}
