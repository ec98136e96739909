package com.stagehand.orchestrator.model;

/**
 * Usage reported by the agent runner for one attempt. Any field may be null
 * when the runner does not report it.
 */
public record ExecutionTelemetry(
        Long    inputTokens,
        Long    outputTokens,
        Long    cacheCreationInputTokens,
        Long    cacheReadInputTokens,
        Double  totalCostUsd,
        Long    durationMs,
        Integer numTurns
) {
    public static ExecutionTelemetry empty() {
        return new ExecutionTelemetry(null, null, null, null, null, null, null);
    }
}
