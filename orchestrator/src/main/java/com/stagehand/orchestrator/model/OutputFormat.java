package com.stagehand.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.stagehand.orchestrator.model.output.*;

import java.util.List;
import java.util.Optional;

/**
 * Closed vocabulary of stage output shapes.
 *
 * Each format names the payload record its parsed output must bind to (none for
 * free-text and interactive formats) and the gate rule family it implies.
 */
public enum OutputFormat {
    TEXT                ("text",                 null,                      GateRule.approval()),
    OPTIONS             ("options",              OptionsOutput.class,       GateRule.selection(1, 1)),
    CHECKLIST           ("checklist",            ChecklistOutput.class,     GateRule.allChecked()),
    STRUCTURED          ("structured",           StructuredOutput.class,    GateRule.fields(List.of())),
    RESEARCH            ("research",             ResearchOutput.class,      GateRule.approval()),
    FINDINGS            ("findings",             FindingsOutput.class,      GateRule.approval()),
    PLAN                ("plan",                 PlanOutput.class,          GateRule.approval()),
    PR_PREPARATION      ("pr_preparation",       StructuredOutput.class,    GateRule.fields(List.of("title", "description"))),
    PR_REVIEW           ("pr_review",            null,                      GateRule.approval()),
    MERGE               ("merge",                null,                      GateRule.approval()),
    TASK_SPLITTING      ("task_splitting",       TaskSplittingOutput.class, GateRule.selection(1, 20)),
    INTERACTIVE_TERMINAL("interactive_terminal", null,                      GateRule.approval());

    private final String dbValue;
    private final Class<? extends StageOutputPayload> payloadType;
    private final GateRule defaultGate;

    OutputFormat(String dbValue, Class<? extends StageOutputPayload> payloadType, GateRule defaultGate) {
        this.dbValue     = dbValue;
        this.payloadType = payloadType;
        this.defaultGate = defaultGate;
    }

    @JsonValue
    public String dbValue() { return dbValue; }

    /** Payload record for structured formats; empty for free-text ones. */
    public Optional<Class<? extends StageOutputPayload>> payloadType() {
        return Optional.ofNullable(payloadType);
    }

    public boolean isStructured() {
        return payloadType != null;
    }

    public GateRule defaultGate() { return defaultGate; }

    /** Formats that are driven by a human session or an external action, never auto-started. */
    public boolean isManual() {
        return this == MERGE || this == INTERACTIVE_TERMINAL;
    }

    public static OutputFormat fromDb(String value) {
        for (OutputFormat f : values()) {
            if (f.dbValue.equals(value)) return f;
        }
        throw new IllegalArgumentException("Unknown output format: " + value);
    }
}
