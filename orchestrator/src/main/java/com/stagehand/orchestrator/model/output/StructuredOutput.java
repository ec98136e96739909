package com.stagehand.orchestrator.model.output;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Named fields, used by the structured and pr_preparation formats.
 *
 * Bound from a flat JSON object. Non-text values are kept as their JSON text;
 * null values are dropped.
 */
public record StructuredOutput(Map<String, String> fields) implements StageOutputPayload {
    public StructuredOutput {
        Objects.requireNonNull(fields, "fields");
        fields = Map.copyOf(fields);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static StructuredOutput fromJson(Map<String, JsonNode> raw) {
        Map<String, String> fields = new LinkedHashMap<>();
        raw.forEach((name, value) -> {
            if (value == null || value.isNull()) return;
            fields.put(name, value.isTextual() ? value.textValue() : value.toString());
        });
        return new StructuredOutput(fields);
    }

    public String field(String name) {
        return fields.get(name);
    }
}
