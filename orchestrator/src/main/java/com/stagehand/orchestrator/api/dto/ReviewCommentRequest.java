package com.stagehand.orchestrator.api.dto;

import com.stagehand.orchestrator.model.FixStatus;
import com.stagehand.orchestrator.model.PrReviewFix;

/** One reviewer comment as fetched from the pull request. */
public record ReviewCommentRequest(
        long    commentId,
        String  commentType,
        String  author,
        String  authorAvatarUrl,
        String  body,
        String  filePath,
        Integer line,
        String  diffHunk,
        String  state
) {
    public PrReviewFix toFix(String executionId) {
        return new PrReviewFix(null, executionId, commentId, commentType, author, authorAvatarUrl,
                body, filePath, line, diffHunk, state, FixStatus.PENDING, null);
    }
}
