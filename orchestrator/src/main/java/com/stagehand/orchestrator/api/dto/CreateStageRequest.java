package com.stagehand.orchestrator.api.dto;

/**
 * Request body for POST /projects/{id}/stages.
 *
 * With {@code preset = "task_splitting"} the other fields are ignored and the
 * built-in task-splitting stage is appended. Otherwise {@code name} and
 * {@code promptTemplate} are required and the gate defaults to the output
 * format's usual rule.
 */
public record CreateStageRequest(
        String preset,
        String name,
        String description,
        String promptTemplate,
        String inputSource,
        String outputFormat,
        String outputSchema,
        String gateRules,
        String resultMode
) {}
