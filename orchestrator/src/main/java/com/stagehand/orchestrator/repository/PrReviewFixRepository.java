package com.stagehand.orchestrator.repository;

import com.stagehand.orchestrator.model.FixStatus;
import com.stagehand.orchestrator.model.PrReviewFix;
import com.stagehand.orchestrator.store.StoreRegistry;
import com.stagehand.orchestrator.store.Timestamps;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Reviewer comments collected by a PR Review execution and the progress of
 * fixing each one. A comment is identified by (execution, comment id, type)
 * since GitHub numbers inline and top-level comments independently.
 */
@Repository
public class PrReviewFixRepository {

    private static final RowMapper<PrReviewFix> ROW = (rs, i) -> new PrReviewFix(
            rs.getString("id"),
            rs.getString("execution_id"),
            rs.getLong("comment_id"),
            rs.getString("comment_type"),
            rs.getString("author"),
            rs.getString("author_avatar_url"),
            rs.getString("body"),
            rs.getString("file_path"),
            rs.getObject("line") == null ? null : rs.getInt("line"),
            rs.getString("diff_hunk"),
            rs.getString("state"),
            FixStatus.fromDb(rs.getString("fix_status")),
            rs.getString("fix_commit_hash"));

    private final StoreRegistry stores;

    public PrReviewFixRepository(StoreRegistry stores) {
        this.stores = stores;
    }

    /**
     * Inserts new comments and refreshes the text of known ones. Fix status and
     * commit hash of known comments are kept.
     */
    public void upsertComments(String projectId, List<PrReviewFix> comments) {
        stores.project(projectId).inTransaction(db -> {
            String now = Timestamps.now();
            for (PrReviewFix c : comments) {
                db.update("""
                        INSERT INTO pr_review_fixes (id, execution_id, comment_id, comment_type, author,
                          author_avatar_url, body, file_path, line, diff_hunk, state, fix_status,
                          created_at, updated_at)
                        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, 'pending', ?, ?)
                        ON CONFLICT(execution_id, comment_id, comment_type) DO UPDATE SET
                          body = excluded.body, state = excluded.state, diff_hunk = excluded.diff_hunk,
                          updated_at = excluded.updated_at""",
                        c.id() != null ? c.id() : UUID.randomUUID().toString(),
                        c.executionId(), c.commentId(), c.commentType(), c.author(), c.authorAvatarUrl(),
                        c.body(), c.filePath(), c.line(), c.diffHunk(), c.state(), now, now);
            }
            return null;
        });
    }

    public List<PrReviewFix> findByExecution(String projectId, String executionId) {
        return stores.project(projectId).call(db -> db.query(
                "SELECT * FROM pr_review_fixes WHERE execution_id = ? ORDER BY created_at, comment_id",
                ROW, executionId));
    }

    /** @return false if no such fix row exists */
    public boolean updateFixStatus(String projectId, String fixId, FixStatus status, String commitHash) {
        int n = stores.project(projectId).call(db -> db.update(
                "UPDATE pr_review_fixes SET fix_status = ?, fix_commit_hash = COALESCE(?, fix_commit_hash), "
                        + "updated_at = ? WHERE id = ?",
                status.dbValue(), commitHash, Timestamps.now(), fixId));
        return n > 0;
    }
}
