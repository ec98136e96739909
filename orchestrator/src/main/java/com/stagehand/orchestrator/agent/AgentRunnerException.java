package com.stagehand.orchestrator.agent;

/**
 * Thrown when the agent process cannot be spawned or its output cannot be read.
 */
public class AgentRunnerException extends RuntimeException {

    public AgentRunnerException(String message) {
        super(message);
    }

    public AgentRunnerException(String message, Throwable cause) {
        super(message, cause);
    }
}
