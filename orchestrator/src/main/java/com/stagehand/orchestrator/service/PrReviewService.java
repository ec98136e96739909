package com.stagehand.orchestrator.service;

import com.stagehand.orchestrator.model.FixStatus;
import com.stagehand.orchestrator.model.PrReviewFix;
import com.stagehand.orchestrator.repository.PrReviewFixRepository;
import com.stagehand.orchestrator.repository.StageExecutionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Tracks reviewer comments gathered by a PR Review execution and which of
 * them have been fixed.
 */
@Service
public class PrReviewService {

    private static final Logger log = LoggerFactory.getLogger(PrReviewService.class);

    private final PrReviewFixRepository    fixes;
    private final StageExecutionRepository executions;
    private final ProjectService           projects;

    public PrReviewService(PrReviewFixRepository fixes,
                           StageExecutionRepository executions,
                           ProjectService projects) {
        this.fixes      = fixes;
        this.executions = executions;
        this.projects   = projects;
    }

    /** Stores newly fetched comments; comments seen before keep their fix status. */
    public List<PrReviewFix> recordComments(String projectId, String executionId, List<PrReviewFix> comments) {
        requireExecution(projectId, executionId);
        List<PrReviewFix> scoped = comments.stream()
                .map(c -> new PrReviewFix(c.id(), executionId, c.commentId(), c.commentType(), c.author(),
                        c.authorAvatarUrl(), c.body(), c.filePath(), c.line(), c.diffHunk(), c.state(),
                        FixStatus.PENDING, null))
                .toList();
        fixes.upsertComments(projectId, scoped);
        log.info("Recorded {} review comment(s) for execution {}", scoped.size(), executionId);
        return fixes.findByExecution(projectId, executionId);
    }

    public List<PrReviewFix> listFixes(String projectId, String executionId) {
        requireExecution(projectId, executionId);
        return fixes.findByExecution(projectId, executionId);
    }

    public void updateFixStatus(String projectId, String fixId, FixStatus status, String commitHash) {
        projects.requireProject(projectId);
        if (!fixes.updateFixStatus(projectId, fixId, status, commitHash)) {
            throw new NotFoundException("Review fix", fixId);
        }
        log.info("Review fix {} -> {}", fixId, status.dbValue());
    }

    private void requireExecution(String projectId, String executionId) {
        projects.requireProject(projectId);
        executions.findById(projectId, executionId)
                .orElseThrow(() -> new NotFoundException("Execution", executionId));
    }
}
