package com.stagehand.orchestrator.agent;

import java.nio.file.Path;
import java.util.List;

/**
 * One agent invocation.
 *
 * @param allowedTools null means every tool; an empty list means none
 * @param jsonSchema   output schema for structured formats, or null
 */
public record AgentRequest(
        String       executionId,
        String       prompt,
        Path         workingDirectory,
        List<String> allowedTools,
        String       jsonSchema,
        String       systemPrompt,
        String       model,
        String       sessionId
) {
    public AgentRequest {
        allowedTools = allowedTools == null ? null : List.copyOf(allowedTools);
    }
}
