package com.stagehand.orchestrator.tracker;

/** One row of the assigned-issues listing. */
public record TrackerIssue(
        String id,
        String identifier,
        String title,
        String description,
        String status,
        int    priority,
        String url,
        String branchName
) {}
