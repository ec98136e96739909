package com.stagehand.orchestrator.agent;

/**
 * Runs a coding agent to completion.
 */
public interface AgentRunner {

    /**
     * Blocks until the agent exits, is cancelled, or times out.
     *
     * @throws AgentRunnerException if the agent could not be started or its output read
     */
    AgentResult run(AgentRequest request);

    /**
     * Stops the agent working on {@code executionId}.
     *
     * @return false if no such agent is running
     */
    boolean cancel(String executionId);
}
