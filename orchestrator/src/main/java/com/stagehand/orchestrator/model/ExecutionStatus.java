package com.stagehand.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of one StageExecution attempt.
 *
 * Transitions:
 *   PENDING       → RUNNING | FAILED
 *   RUNNING       → AWAITING_USER | APPROVED | FAILED
 *   AWAITING_USER → APPROVED | FAILED
 *
 * APPROVED and FAILED are terminal for the attempt; a FAILED attempt may be
 * followed by a new attempt with attempt_number + 1.
 */
public enum ExecutionStatus {
    PENDING("pending"),
    RUNNING("running"),
    AWAITING_USER("awaiting_user"),
    APPROVED("approved"),
    FAILED("failed");

    private final String dbValue;

    ExecutionStatus(String dbValue) {
        this.dbValue = dbValue;
    }

    @JsonValue
    public String dbValue() { return dbValue; }

    public boolean isTerminal() {
        return this == APPROVED || this == FAILED;
    }

    public boolean canTransitionTo(ExecutionStatus next) {
        return switch (this) {
            case PENDING       -> next == RUNNING || next == FAILED;
            case RUNNING       -> next == AWAITING_USER || next == APPROVED || next == FAILED;
            case AWAITING_USER -> next == APPROVED || next == FAILED;
            case APPROVED, FAILED -> false;
        };
    }

    public static ExecutionStatus fromDb(String value) {
        for (ExecutionStatus s : values()) {
            if (s.dbValue.equals(value)) return s;
        }
        throw new IllegalArgumentException("Unknown execution status: " + value);
    }
}
