package com.stagehand.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum GateRuleType {
    REQUIRE_APPROVAL("require_approval"),
    REQUIRE_SELECTION("require_selection"),
    REQUIRE_ALL_CHECKED("require_all_checked"),
    REQUIRE_FIELDS("require_fields");

    private final String wireName;

    GateRuleType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() { return wireName; }

    @JsonCreator
    public static GateRuleType fromWire(String value) {
        for (GateRuleType t : values()) {
            if (t.wireName.equals(value)) return t;
        }
        throw new IllegalArgumentException("Unknown gate rule type: " + value);
    }
}
