package com.stagehand.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How an approved stage's output folds into the context handed to later stages.
 *
 *   REPLACE:     the stage's own output becomes the context
 *   APPEND:      the stage's contribution is appended to the prior context
 *   PASSTHROUGH: the prior context is forwarded untouched (own output if none)
 */
public enum ResultMode {
    REPLACE("replace"),
    APPEND("append"),
    PASSTHROUGH("passthrough");

    public static final String SEPARATOR = "\n\n---\n\n";

    private final String dbValue;

    ResultMode(String dbValue) {
        this.dbValue = dbValue;
    }

    @JsonValue
    public String dbValue() { return dbValue; }

    public String compose(String previous, String own) {
        boolean hasPrevious = previous != null && !previous.isEmpty();
        return switch (this) {
            case REPLACE     -> own;
            case APPEND      -> hasPrevious ? previous + SEPARATOR + own : own;
            case PASSTHROUGH -> hasPrevious ? previous : own;
        };
    }

    public static ResultMode fromDb(String value) {
        if (value == null) return REPLACE;
        for (ResultMode m : values()) {
            if (m.dbValue.equals(value)) return m;
        }
        throw new IllegalArgumentException("Unknown result mode: " + value);
    }
}
