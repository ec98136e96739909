package com.stagehand.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Progress of fixing one PR reviewer comment. */
public enum FixStatus {
    PENDING("pending"),
    FIXING("fixing"),
    FIXED("fixed"),
    SKIPPED("skipped");

    private final String dbValue;

    FixStatus(String dbValue) {
        this.dbValue = dbValue;
    }

    @JsonValue
    public String dbValue() { return dbValue; }

    public static FixStatus fromDb(String value) {
        for (FixStatus s : values()) {
            if (s.dbValue.equals(value)) return s;
        }
        throw new IllegalArgumentException("Unknown fix status: " + value);
    }
}
