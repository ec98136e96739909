package com.stagehand.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Objects;

/**
 * Policy deciding when a stage's output is accepted.
 *
 * Stored as JSON in stage_templates.gate_rules, e.g.
 * <pre>
 *   {"type":"require_approval"}
 *   {"type":"require_selection","min":1,"max":1}
 *   {"type":"require_all_checked"}
 *   {"type":"require_fields","fields":["title","description"]}
 * </pre>
 * {@code min}/{@code max} are only meaningful for REQUIRE_SELECTION and
 * {@code fields} only for REQUIRE_FIELDS; they are null otherwise.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record GateRule(GateRuleType type, Integer min, Integer max, List<String> fields) {

    public GateRule {
        Objects.requireNonNull(type, "type");
        switch (type) {
            case REQUIRE_SELECTION -> {
                if (min == null || max == null) {
                    throw new IllegalArgumentException("require_selection needs min and max");
                }
                if (min < 0 || max < min) {
                    throw new IllegalArgumentException(
                            "require_selection bounds out of range: min=%d max=%d".formatted(min, max));
                }
                fields = null;
            }
            case REQUIRE_FIELDS -> {
                fields = fields == null ? List.of() : List.copyOf(fields);
                min = null;
                max = null;
            }
            case REQUIRE_APPROVAL, REQUIRE_ALL_CHECKED -> {
                min = null;
                max = null;
                fields = null;
            }
        }
    }

    public static GateRule approval() {
        return new GateRule(GateRuleType.REQUIRE_APPROVAL, null, null, null);
    }

    public static GateRule selection(int min, int max) {
        return new GateRule(GateRuleType.REQUIRE_SELECTION, min, max, null);
    }

    public static GateRule allChecked() {
        return new GateRule(GateRuleType.REQUIRE_ALL_CHECKED, null, null, null);
    }

    public static GateRule fields(List<String> names) {
        return new GateRule(GateRuleType.REQUIRE_FIELDS, null, null, names);
    }
}
