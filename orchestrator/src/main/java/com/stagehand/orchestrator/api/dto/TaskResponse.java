package com.stagehand.orchestrator.api.dto;

import com.stagehand.orchestrator.model.Task;

import java.time.Instant;

public record TaskResponse(
        String  id,
        String  projectId,
        String  title,
        String  description,
        String  currentStageId,
        String  status,
        boolean archived,
        String  branchName,
        String  prUrl,
        String  worktreePath,
        boolean ejected,
        String  parentTaskId,
        Instant createdAt,
        Instant updatedAt
) {
    public static TaskResponse from(Task t) {
        return new TaskResponse(
                t.getId(), t.getProjectId(), t.getTitle(), t.getDescription(), t.getCurrentStageId(),
                t.getStatus().dbValue(), t.isArchived(), t.getBranchName(), t.getPrUrl(),
                t.getWorktreePath(), t.isEjected(), t.getParentTaskId(), t.getCreatedAt(), t.getUpdatedAt());
    }
}
