package com.stagehand.orchestrator.model.output;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ChecklistItem(String id, String text, boolean checked) {
    public ChecklistItem {
        Objects.requireNonNull(text, "items.text");
    }
}
