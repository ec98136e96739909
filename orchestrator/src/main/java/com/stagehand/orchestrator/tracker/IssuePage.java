package com.stagehand.orchestrator.tracker;

import java.util.List;

/** A page of issues; pass {@code endCursor} back to fetch the next one. */
public record IssuePage(List<TrackerIssue> issues, boolean hasNextPage, String endCursor) {
    public IssuePage {
        issues = List.copyOf(issues);
    }
}
