package com.stagehand.orchestrator.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.stagehand.orchestrator.model.GateRule;
import org.springframework.stereotype.Component;

/**
 * Checks a user's decision against a stage's gate rule.
 *
 *   require_approval     always satisfied
 *   require_selection    JSON array with min..max entries; non-JSON text counts as exactly one pick
 *   require_all_checked  JSON array whose items all have a truthy "checked"
 *   require_fields       JSON object whose named fields are all non-blank
 */
@Component
public class GateValidator {

    private final OutputParser parser;

    public GateValidator(OutputParser parser) {
        this.parser = parser;
    }

    /** @throws GateViolationException if the decision does not satisfy the rule */
    public void check(GateRule rule, String decision) {
        if (!isSatisfied(rule, decision)) {
            throw new GateViolationException(rule, describe(rule));
        }
    }

    public boolean isSatisfied(GateRule rule, String decision) {
        if (rule == null) return true;
        switch (rule.type()) {
            case REQUIRE_APPROVAL:
                return true;
            case REQUIRE_SELECTION: {
                if (isEmpty(decision)) return false;
                JsonNode selected = parser.tryReadTree(decision);
                if (selected == null) return rule.min() <= 1 && rule.max() >= 1;
                if (!selected.isArray()) return false;
                return selected.size() >= rule.min() && selected.size() <= rule.max();
            }
            case REQUIRE_ALL_CHECKED: {
                if (isEmpty(decision)) return false;
                JsonNode items = parser.tryReadTree(decision);
                if (items == null || !items.isArray()) return false;
                for (JsonNode item : items) {
                    if (!truthy(item.get("checked"))) return false;
                }
                return true;
            }
            case REQUIRE_FIELDS: {
                if (isEmpty(decision)) return false;
                JsonNode fields = parser.tryReadTree(decision);
                if (fields == null) return false;
                for (String name : rule.fields()) {
                    JsonNode value = fields.get(name);
                    if (!truthy(value) || text(value).trim().isEmpty()) return false;
                }
                return true;
            }
            default:
                return true;
        }
    }

    private static String describe(GateRule rule) {
        return switch (rule.type()) {
            case REQUIRE_APPROVAL    -> "Approval required";
            case REQUIRE_SELECTION   -> rule.min().equals(rule.max())
                    ? "Select exactly %d item(s)".formatted(rule.min())
                    : "Select between %d and %d items".formatted(rule.min(), rule.max());
            case REQUIRE_ALL_CHECKED -> "All checklist items must be checked";
            case REQUIRE_FIELDS      -> "Required fields missing: " + String.join(", ", rule.fields());
        };
    }

    private static boolean isEmpty(String s) {
        return s == null || s.isEmpty();
    }

    /** Loose truthiness: absent, null, false, 0 and "" are false. */
    static boolean truthy(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return false;
        if (node.isBoolean()) return node.booleanValue();
        if (node.isNumber())  return node.doubleValue() != 0;
        if (node.isTextual()) return !node.textValue().isEmpty();
        return true;
    }

    private static String text(JsonNode node) {
        return node.isValueNode() ? node.asText() : node.toString();
    }
}
