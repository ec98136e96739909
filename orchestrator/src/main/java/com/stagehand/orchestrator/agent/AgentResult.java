package com.stagehand.orchestrator.agent;

import com.stagehand.orchestrator.model.ExecutionTelemetry;

/**
 * Outcome of a finished agent process.
 *
 * {@code rawOutput} is the full stdout; {@code resultText} is the final answer
 * (structured output when a schema was requested); {@code thinking} collects
 * the assistant text emitted before the final result.
 */
public record AgentResult(
        int                exitCode,
        boolean            killed,
        String             rawOutput,
        String             resultText,
        String             thinking,
        ExecutionTelemetry telemetry,
        String             sessionId
) {
    public boolean succeeded() {
        return !killed && exitCode == 0;
    }
}
