package com.stagehand.orchestrator.service;

import com.stagehand.orchestrator.model.GateRule;

/**
 * The user's decision does not satisfy the stage's gate rule. The execution
 * stays awaiting_user; the caller should correct the decision and retry.
 */
public class GateViolationException extends RuntimeException {

    private final GateRule rule;

    public GateViolationException(GateRule rule, String message) {
        super(message);
        this.rule = rule;
    }

    public GateRule getRule() { return rule; }
}
