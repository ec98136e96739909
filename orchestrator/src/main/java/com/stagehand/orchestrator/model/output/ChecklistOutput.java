package com.stagehand.orchestrator.model.output;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ChecklistOutput(List<ChecklistItem> items) implements StageOutputPayload {
    public ChecklistOutput {
        Objects.requireNonNull(items, "items");
        items = List.copyOf(items);
    }
}
