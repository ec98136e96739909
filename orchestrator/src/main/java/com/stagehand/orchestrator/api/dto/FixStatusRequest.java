package com.stagehand.orchestrator.api.dto;

/** {@code status} is one of pending, fixing, fixed, skipped. */
public record FixStatusRequest(String status, String commitHash) {}
