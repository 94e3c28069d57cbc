package com.taskwarden.pool;

import java.util.concurrent.CompletableFuture;

/**
 * A started worker process as seen by the pool.
 *
 * <p>Exit and spawn-error notifications arrive through {@link #onExit()}, so the pool's
 * bookkeeping never touches the OS process API directly.
 */
public interface LaunchedWorker {

    /**
     * Completes with the exit code when the process terminates, or exceptionally when
     * the process failed at the OS level (e.g. the executable could not be started).
     */
    CompletableFuture<Integer> onExit();

    /**
     * Terminates the process. Safe to call more than once.
     *
     * @param forcibly {@code true} to kill without giving the process a chance to clean up
     */
    void kill(boolean forcibly);
}
