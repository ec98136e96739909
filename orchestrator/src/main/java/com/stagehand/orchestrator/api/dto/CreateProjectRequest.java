package com.stagehand.orchestrator.api.dto;

/** Request body for POST /projects. {@code path} must be an existing directory. */
public record CreateProjectRequest(String name, String path) {}
