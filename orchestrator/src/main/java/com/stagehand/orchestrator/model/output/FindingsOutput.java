package com.stagehand.orchestrator.model.output;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public record FindingsOutput(String summary, List<Finding> findings) implements StageOutputPayload {
    public FindingsOutput {
        Objects.requireNonNull(summary, "summary");
        Objects.requireNonNull(findings, "findings");
        findings = List.copyOf(findings);
    }
}
