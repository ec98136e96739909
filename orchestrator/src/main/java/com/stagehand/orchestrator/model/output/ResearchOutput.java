package com.stagehand.orchestrator.model.output;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ResearchOutput(
        String research,
        List<Question> questions,
        @JsonProperty("suggested_stages") List<StageSuggestion> suggestedStages
) implements StageOutputPayload {
    public ResearchOutput {
        Objects.requireNonNull(research, "research");
        questions       = questions == null ? List.of() : List.copyOf(questions);
        suggestedStages = suggestedStages == null ? List.of() : List.copyOf(suggestedStages);
    }
}
