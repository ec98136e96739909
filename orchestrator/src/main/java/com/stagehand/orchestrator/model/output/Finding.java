package com.stagehand.orchestrator.model.output;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** A review finding; {@code selected} is the agent's recommendation, the developer has the final say. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Finding(
        String id,
        String title,
        String description,
        String severity,
        String category,
        @JsonProperty("file_path") String filePath,
        boolean selected
) {
    public Finding {
        Objects.requireNonNull(id, "findings.id");
        Objects.requireNonNull(title, "findings.title");
        description = description == null ? "" : description;
    }
}
