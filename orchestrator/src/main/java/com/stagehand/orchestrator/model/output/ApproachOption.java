package com.stagehand.orchestrator.model.output;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Objects;

/** One candidate implementation approach offered by an options stage. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ApproachOption(String id, String title, String description, List<String> pros, List<String> cons) {
    public ApproachOption {
        Objects.requireNonNull(title, "options.title");
        description = description == null ? "" : description;
        pros = pros == null ? List.of() : List.copyOf(pros);
        cons = cons == null ? List.of() : List.copyOf(cons);
    }
}
