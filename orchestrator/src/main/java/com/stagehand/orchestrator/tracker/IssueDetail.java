package com.stagehand.orchestrator.tracker;

import java.util.List;

/**
 * Full issue used when importing it as a task.
 *
 * @param comments "Author: body" lines, oldest first
 */
public record IssueDetail(
        String       id,
        String       identifier,
        String       title,
        String       description,
        String       branchName,
        List<String> comments
) {
    public IssueDetail {
        comments = comments == null ? List.of() : List.copyOf(comments);
    }
}
