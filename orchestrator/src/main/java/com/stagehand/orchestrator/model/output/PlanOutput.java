package com.stagehand.orchestrator.model.output;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PlanOutput(String plan, List<Question> questions) implements StageOutputPayload {
    public PlanOutput {
        Objects.requireNonNull(plan, "plan");
        questions = questions == null ? List.of() : List.copyOf(questions);
    }
}
