package com.stagehand.orchestrator.api.dto;

/** Request body for POST /projects/{id}/tasks. Only {@code title} is required. */
public record CreateTaskRequest(String title, String description, String parentTaskId, String branchName) {}
