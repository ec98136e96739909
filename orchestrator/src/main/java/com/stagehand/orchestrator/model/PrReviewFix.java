package com.stagehand.orchestrator.model;

/**
 * A reviewer comment collected by a PR Review stage and the state of its fix.
 *
 * DB table: pr_review_fixes, unique per (executionId, commentId, commentType).
 */
public record PrReviewFix(
        String    id,
        String    executionId,
        long      commentId,
        String    commentType,
        String    author,
        String    authorAvatarUrl,
        String    body,
        String    filePath,
        Integer   line,
        String    diffHunk,
        String    state,
        FixStatus fixStatus,
        String    fixCommitHash
) {}
