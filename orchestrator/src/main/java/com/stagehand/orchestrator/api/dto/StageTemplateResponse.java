package com.stagehand.orchestrator.api.dto;

import com.stagehand.orchestrator.model.GateRule;
import com.stagehand.orchestrator.model.StageTemplate;

import java.util.List;

/**
 * View of a stage template returned by the stages endpoints. Enum fields are
 * rendered as their stored names ("research", "require_approval", ...).
 */
public record StageTemplateResponse(
        String       id,
        String       name,
        String       description,
        int          sortOrder,
        String       promptTemplate,
        String       inputSource,
        String       outputFormat,
        String       outputSchema,
        GateRule     gateRules,
        String       personaName,
        String       personaSystemPrompt,
        String       personaModel,
        String       preparationPrompt,
        List<String> allowedTools,
        String       resultMode,
        boolean      commitsChanges,
        String       commitPrefix,
        boolean      createsPr,
        boolean      terminal,
        boolean      triggersStageSelection,
        boolean      requiresUserInput,
        boolean      autoStart
) {
    public static StageTemplateResponse from(StageTemplate t, boolean autoStart) {
        return new StageTemplateResponse(
                t.getId(), t.getName(), t.getDescription(), t.getSortOrder(), t.getPromptTemplate(),
                t.getInputSource().dbValue(), t.getOutputFormat().dbValue(), t.getOutputSchema(),
                t.getGateRule(), t.getPersonaName(), t.getPersonaSystemPrompt(), t.getPersonaModel(),
                t.getPreparationPrompt(), t.getAllowedTools(), t.getResultMode().dbValue(),
                t.isCommitsChanges(), t.getCommitPrefix(), t.isCreatesPr(), t.isTerminal(),
                t.isTriggersStageSelection(), t.isRequiresUserInput(), autoStart);
    }
}
