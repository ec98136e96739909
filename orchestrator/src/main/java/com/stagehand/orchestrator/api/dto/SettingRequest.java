package com.stagehand.orchestrator.api.dto;

/** Request body for PUT .../settings/{key}. A null value removes the setting. */
public record SettingRequest(String value) {}
