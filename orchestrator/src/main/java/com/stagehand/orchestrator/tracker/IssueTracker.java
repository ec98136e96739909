package com.stagehand.orchestrator.tracker;

/**
 * Read-only view of an external issue tracker. All calls take the caller's
 * API key; nothing is cached.
 */
public interface IssueTracker {

    /** @throws IssueTrackerException with message "Invalid API key" on 401 */
    ViewerInfo verifyApiKey(String apiKey);

    /** Open issues assigned to the key's owner. {@code cursor} may be null for the first page. */
    IssuePage fetchAssignedIssues(String apiKey, String cursor);

    IssueDetail fetchIssueDetail(String apiKey, String issueId);
}
