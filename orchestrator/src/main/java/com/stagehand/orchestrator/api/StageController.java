package com.stagehand.orchestrator.api;

import com.stagehand.orchestrator.api.dto.ExecutionResponse;
import com.stagehand.orchestrator.api.dto.FixStatusRequest;
import com.stagehand.orchestrator.api.dto.ReviewCommentRequest;
import com.stagehand.orchestrator.api.dto.StageActionRequest;
import com.stagehand.orchestrator.model.FixStatus;
import com.stagehand.orchestrator.model.PrReviewFix;
import com.stagehand.orchestrator.service.PrReviewService;
import com.stagehand.orchestrator.service.StageExecutionService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API driving the stage state machine.
 *
 * POST /projects/{id}/tasks/{taskId}/stages/{stageId}/run         start an attempt (202, runs async)
 * POST /projects/{id}/tasks/{taskId}/stages/{stageId}/approve     accept with a decision
 * POST /projects/{id}/tasks/{taskId}/stages/{stageId}/reject      fail with feedback
 * POST /projects/{id}/tasks/{taskId}/stages/{stageId}/redo        new attempt with feedback and an optional selection
 * POST /projects/{id}/executions/{executionId}/cancel
 * GET  /projects/{id}/executions/{executionId}/review-fixes
 * POST /projects/{id}/executions/{executionId}/review-fixes       record fetched comments
 * POST /projects/{id}/review-fixes/{fixId}/status
 */
@RestController
@RequestMapping("/projects/{projectId}")
public class StageController {

    private final StageExecutionService stageService;
    private final PrReviewService       reviewService;

    public StageController(StageExecutionService stageService, PrReviewService reviewService) {
        this.stageService  = stageService;
        this.reviewService = reviewService;
    }

    @PostMapping("/tasks/{taskId}/stages/{stageId}/run")
    public ResponseEntity<ExecutionResponse> run(@PathVariable String projectId, @PathVariable String taskId,
                                                 @PathVariable String stageId,
                                                 @RequestBody(required = false) StageActionRequest req) {
        StageActionRequest body = req == null ? StageActionRequest.empty() : req;
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ExecutionResponse.from(
                stageService.startStage(projectId, taskId, stageId, body.userInput())));
    }

    @PostMapping("/tasks/{taskId}/stages/{stageId}/approve")
    public ExecutionResponse approve(@PathVariable String projectId, @PathVariable String taskId,
                                     @PathVariable String stageId,
                                     @RequestBody(required = false) StageActionRequest req) {
        StageActionRequest body = req == null ? StageActionRequest.empty() : req;
        return ExecutionResponse.from(stageService.approveStage(projectId, taskId, stageId, body.decision()));
    }

    @PostMapping("/tasks/{taskId}/stages/{stageId}/reject")
    public ExecutionResponse reject(@PathVariable String projectId, @PathVariable String taskId,
                                    @PathVariable String stageId,
                                    @RequestBody(required = false) StageActionRequest req) {
        StageActionRequest body = req == null ? StageActionRequest.empty() : req;
        return ExecutionResponse.from(stageService.rejectStage(projectId, taskId, stageId, body.feedback()));
    }

    @PostMapping("/tasks/{taskId}/stages/{stageId}/redo")
    public ResponseEntity<ExecutionResponse> redo(@PathVariable String projectId, @PathVariable String taskId,
                                                  @PathVariable String stageId,
                                                  @RequestBody(required = false) StageActionRequest req) {
        StageActionRequest body = req == null ? StageActionRequest.empty() : req;
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ExecutionResponse.from(
                stageService.redoStage(projectId, taskId, stageId, body.feedback(), body.decision())));
    }

    @PostMapping("/executions/{executionId}/cancel")
    public ExecutionResponse cancel(@PathVariable String projectId, @PathVariable String executionId) {
        return ExecutionResponse.from(stageService.cancelStage(projectId, executionId));
    }

    @GetMapping("/executions/{executionId}/review-fixes")
    public List<PrReviewFix> reviewFixes(@PathVariable String projectId, @PathVariable String executionId) {
        return reviewService.listFixes(projectId, executionId);
    }

    @PostMapping("/executions/{executionId}/review-fixes")
    public List<PrReviewFix> recordReviewComments(@PathVariable String projectId,
                                                  @PathVariable String executionId,
                                                  @RequestBody List<ReviewCommentRequest> comments) {
        return reviewService.recordComments(projectId, executionId,
                comments.stream().map(c -> c.toFix(executionId)).toList());
    }

    @PostMapping("/review-fixes/{fixId}/status")
    public ResponseEntity<Void> updateFixStatus(@PathVariable String projectId, @PathVariable String fixId,
                                                @RequestBody FixStatusRequest req) {
        reviewService.updateFixStatus(projectId, fixId, FixStatus.fromDb(req.status()), req.commitHash());
        return ResponseEntity.noContent().build();
    }
}
