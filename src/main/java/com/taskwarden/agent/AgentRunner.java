package com.taskwarden.agent;

public interface AgentRunner {

    /**
     * @throws AgentRunException if the process could not be started
     */
    AgentRun start(AgentRunRequest request);
}
