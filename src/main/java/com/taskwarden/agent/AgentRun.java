package com.taskwarden.agent;

import java.util.stream.Stream;

/**
 * One running invocation of the agent CLI.
 */
public interface AgentRun extends AutoCloseable {

    /** Output lines in order; the stream ends when the process closes its output. */
    Stream<String> lines();

    /** Blocks until the process exits. */
    int waitFor();

    /** Stops the process if it is still running. */
    @Override
    void close();
}
