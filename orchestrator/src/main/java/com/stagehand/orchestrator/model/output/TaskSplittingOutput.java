package com.stagehand.orchestrator.model.output;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TaskSplittingOutput(
        String reasoning,
        @JsonProperty("proposed_tasks") List<ProposedTask> proposedTasks
) implements StageOutputPayload {
    public TaskSplittingOutput {
        Objects.requireNonNull(reasoning, "reasoning");
        Objects.requireNonNull(proposedTasks, "proposed_tasks");
        proposedTasks = List.copyOf(proposedTasks);
    }
}
