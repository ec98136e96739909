package com.stagehand.orchestrator.model.output;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Objects;

/**
 * Either a set of approaches to choose from, or (when the agent still needs
 * answers) an empty option list plus questions.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record OptionsOutput(List<ApproachOption> options, List<Question> questions) implements StageOutputPayload {
    public OptionsOutput {
        Objects.requireNonNull(options, "options");
        options   = List.copyOf(options);
        questions = questions == null ? List.of() : List.copyOf(questions);
    }
}
