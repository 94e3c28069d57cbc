package com.taskwarden.pool;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Fully resolved command line and environment for one worker process.
 */
public record WorkerLaunchRequest(
    String command,
    List<String> args,
    Path workingDirectory,
    Map<String, String> environment
) {

    public WorkerLaunchRequest {
        args = List.copyOf(args);
        environment = Map.copyOf(environment);
    }

    /**
     * Returns the value following {@code flag} in {@link #args()}, or {@code null}.
     */
    public String argumentAfter(String flag) {
        int index = args.indexOf(flag);
        return index >= 0 && index + 1 < args.size() ? args.get(index + 1) : null;
    }
}
