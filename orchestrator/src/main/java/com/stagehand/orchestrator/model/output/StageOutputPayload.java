package com.stagehand.orchestrator.model.output;

/**
 * Typed body of a structured stage output. One implementation per
 * {@link com.stagehand.orchestrator.model.OutputFormat} that carries structure.
 */
public interface StageOutputPayload {
}
