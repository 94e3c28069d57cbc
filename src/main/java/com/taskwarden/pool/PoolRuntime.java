package com.taskwarden.pool;

import java.nio.file.Path;
import java.util.Map;

/**
 * Supplies everything the pool needs to launch one agent server process.
 * Implemented by the task-execution layer; replaceable at runtime through
 * {@link ServerPool#updateConfig(PoolRuntime, PoolOptions)}.
 */
public interface PoolRuntime {

    /**
     * The agent CLI to launch. Server-mode arguments are appended by the pool.
     */
    CliCommand cliCommand();

    /**
     * Working directory for spawned processes.
     */
    Path workingDirectory();

    /**
     * Variables layered over the parent environment for a spawn.
     * Called once per spawn, so implementations may refresh credentials here.
     */
    Map<String, String> buildEnvironment();

    /**
     * Hook invoked before every spawn, e.g. to write config files the server reads at startup.
     */
    default void beforeStart() {
    }
}
