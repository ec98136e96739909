package com.stagehand.orchestrator.model.output;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/** A clarifying question the agent wants the developer to answer before it continues. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Question(
        String id,
        String question,
        @JsonProperty("proposed_answer") String proposedAnswer,
        List<String> options
) {
    public Question {
        Objects.requireNonNull(id, "question.id");
        Objects.requireNonNull(question, "question.question");
        options = options == null ? List.of() : List.copyOf(options);
    }
}
