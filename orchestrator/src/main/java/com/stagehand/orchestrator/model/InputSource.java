package com.stagehand.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Where a stage takes its input from. */
public enum InputSource {
    USER("user"),
    PREVIOUS_STAGE("previous_stage"),
    BOTH("both");

    private final String dbValue;

    InputSource(String dbValue) {
        this.dbValue = dbValue;
    }

    @JsonValue
    public String dbValue() { return dbValue; }

    public boolean needsUser() {
        return this == USER || this == BOTH;
    }

    public static InputSource fromDb(String value) {
        for (InputSource s : values()) {
            if (s.dbValue.equals(value)) return s;
        }
        throw new IllegalArgumentException("Unknown input source: " + value);
    }
}
