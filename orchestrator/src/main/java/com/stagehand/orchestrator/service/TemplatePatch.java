package com.stagehand.orchestrator.service;

import java.util.List;

/**
 * Partial update of a stage template. Null fields are left unchanged.
 *
 * Enum-valued fields arrive as their stored strings and {@code gateRules} as
 * JSON text; {@link StageTemplateService} validates them before anything is
 * written. {@code clearAllowedTools} resets the tool list to "all tools".
 */
public record TemplatePatch(
        String       name,
        String       description,
        String       promptTemplate,
        String       inputSource,
        String       outputFormat,
        String       outputSchema,
        String       gateRules,
        String       personaName,
        String       personaSystemPrompt,
        String       personaModel,
        String       preparationPrompt,
        List<String> allowedTools,
        Boolean      clearAllowedTools,
        String       resultMode,
        Boolean      commitsChanges,
        String       commitPrefix,
        Boolean      createsPr,
        Boolean      terminal,
        Boolean      triggersStageSelection,
        Boolean      requiresUserInput
) {}
