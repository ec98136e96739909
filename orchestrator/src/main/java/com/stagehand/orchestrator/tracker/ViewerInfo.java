package com.stagehand.orchestrator.tracker;

/** Who an API key belongs to. */
public record ViewerInfo(String name, String organizationName) {}
