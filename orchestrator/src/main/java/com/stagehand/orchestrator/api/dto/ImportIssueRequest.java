package com.stagehand.orchestrator.api.dto;

public record ImportIssueRequest(String issueId) {}
