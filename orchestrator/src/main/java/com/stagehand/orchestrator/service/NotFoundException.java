package com.stagehand.orchestrator.service;

/**
 * Thrown when a project, stage template, task or execution does not exist.
 */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String kind, String id) {
        super(kind + " not found: " + id);
    }
}
