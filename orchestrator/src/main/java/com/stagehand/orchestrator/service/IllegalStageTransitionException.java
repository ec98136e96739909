package com.stagehand.orchestrator.service;

/**
 * An operation was attempted from a state that does not allow it, e.g.
 * approving an execution that is still running or starting a second attempt
 * while the first is active.
 */
public class IllegalStageTransitionException extends RuntimeException {

    public IllegalStageTransitionException(String message) {
        super(message);
    }
}
