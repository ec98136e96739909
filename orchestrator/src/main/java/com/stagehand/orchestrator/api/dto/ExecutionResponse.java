package com.stagehand.orchestrator.api.dto;

import com.stagehand.orchestrator.model.ExecutionTelemetry;
import com.stagehand.orchestrator.model.StageExecution;

import java.time.Instant;

/**
 * One stage attempt. {@code rawOutput} is the agent's full stream and can be
 * large; {@code parsedOutput} is what the UI renders.
 */
public record ExecutionResponse(
        String             id,
        String             taskId,
        String             stageTemplateId,
        int                attemptNumber,
        String             status,
        String             inputPrompt,
        String             userInput,
        String             rawOutput,
        String             parsedOutput,
        String             userDecision,
        String             errorMessage,
        String             thinkingOutput,
        String             stageResult,
        String             stageSummary,
        ExecutionTelemetry telemetry,
        Instant            startedAt,
        Instant            completedAt
) {
    public static ExecutionResponse from(StageExecution e) {
        return new ExecutionResponse(
                e.getId(), e.getTaskId(), e.getStageTemplateId(), e.getAttemptNumber(),
                e.getStatus().dbValue(), e.getInputPrompt(), e.getUserInput(), e.getRawOutput(),
                e.getParsedOutput(), e.getUserDecision(), e.getErrorMessage(), e.getThinkingOutput(),
                e.getStageResult(), e.getStageSummary(), e.getTelemetry(), e.getStartedAt(), e.getCompletedAt());
    }
}
