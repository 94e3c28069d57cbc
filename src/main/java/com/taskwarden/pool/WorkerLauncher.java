package com.taskwarden.pool;

/**
 * Starts agent server processes for the pool.
 * Implementations: {@link ProcessWorkerLauncher} (local OS processes).
 */
public interface WorkerLauncher {

    /**
     * Starts a process without waiting for it to become ready.
     *
     * @throws WorkerStartupException if the process could not be started at all
     */
    LaunchedWorker launch(WorkerLaunchRequest request);
}
