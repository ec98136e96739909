package com.stagehand.orchestrator.events;

import java.time.Instant;

/**
 * A status change published on the {@link PipelineEventBus}.
 *
 * {@code executionId} is null for task-level events.
 */
public record PipelineEvent(
        Type    type,
        String  projectId,
        String  taskId,
        String  executionId,
        String  fromStatus,
        String  toStatus,
        Instant at
) {

    public enum Type {
        STAGE_STATUS_CHANGED,
        TASK_STATUS_CHANGED
    }

    public static PipelineEvent stage(String projectId, String taskId, String executionId,
                                      String from, String to) {
        return new PipelineEvent(Type.STAGE_STATUS_CHANGED, projectId, taskId, executionId,
                from, to, Instant.now());
    }

    public static PipelineEvent task(String projectId, String taskId, String from, String to) {
        return new PipelineEvent(Type.TASK_STATUS_CHANGED, projectId, taskId, null,
                from, to, Instant.now());
    }
}
