package com.stagehand.orchestrator.api.dto;

import com.stagehand.orchestrator.model.Project;

import java.time.Instant;

public record ProjectResponse(
        String  id,
        String  name,
        String  path,
        boolean archived,
        Instant createdAt,
        Instant updatedAt
) {
    public static ProjectResponse from(Project p) {
        return new ProjectResponse(p.getId(), p.getName(), p.getPath(), p.isArchived(),
                p.getCreatedAt(), p.getUpdatedAt());
    }
}
