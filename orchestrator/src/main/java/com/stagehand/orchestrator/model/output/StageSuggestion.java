package com.stagehand.orchestrator.model.output;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StageSuggestion(String name, String reason) {
    public StageSuggestion {
        Objects.requireNonNull(name, "suggested_stages.name");
    }
}
