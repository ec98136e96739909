package com.stagehand.orchestrator.model.output;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ProposedTask(String id, String title, String description, boolean selected) {
    public ProposedTask {
        Objects.requireNonNull(title, "proposed_tasks.title");
        description = description == null ? "" : description;
    }
}
