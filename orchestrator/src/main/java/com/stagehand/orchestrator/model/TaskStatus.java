package com.stagehand.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Aggregate status of a Task.
 *
 * Transitions:
 *   PENDING     → IN_PROGRESS | SPLIT
 *   IN_PROGRESS → IN_PROGRESS | COMPLETED | FAILED | SPLIT
 *   FAILED      → IN_PROGRESS   (a new attempt was started)
 *
 * COMPLETED and SPLIT are terminal.
 */
public enum TaskStatus {
    PENDING("pending"),
    IN_PROGRESS("in_progress"),
    COMPLETED("completed"),
    FAILED("failed"),
    SPLIT("split");

    private final String dbValue;

    TaskStatus(String dbValue) {
        this.dbValue = dbValue;
    }

    @JsonValue
    public String dbValue() { return dbValue; }

    public boolean isTerminal() {
        return this == COMPLETED || this == SPLIT;
    }

    public boolean canTransitionTo(TaskStatus next) {
        return switch (this) {
            case PENDING     -> next == IN_PROGRESS || next == SPLIT;
            case IN_PROGRESS -> next == IN_PROGRESS || next == COMPLETED || next == FAILED || next == SPLIT;
            case FAILED      -> next == IN_PROGRESS;
            case COMPLETED, SPLIT -> false;
        };
    }

    public static TaskStatus fromDb(String value) {
        for (TaskStatus s : values()) {
            if (s.dbValue.equals(value)) return s;
        }
        throw new IllegalArgumentException("Unknown task status: " + value);
    }
}
