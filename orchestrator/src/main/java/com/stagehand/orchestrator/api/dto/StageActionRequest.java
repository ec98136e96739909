package com.stagehand.orchestrator.api.dto;

/**
 * Body for the stage run/approve/reject/redo endpoints.
 *
 *   run     uses userInput
 *   approve uses decision (selection JSON, checklist JSON, field values, or plain text)
 *   reject  uses feedback
 *   redo    uses feedback as the new attempt's input and decision as the selection from the last one
 */
public record StageActionRequest(String userInput, String decision, String feedback) {

    public static StageActionRequest empty() {
        return new StageActionRequest(null, null, null);
    }
}
