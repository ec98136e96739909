package com.stagehand.orchestrator.api;

import com.stagehand.orchestrator.api.dto.CreateStageRequest;
import com.stagehand.orchestrator.api.dto.StageTemplateResponse;
import com.stagehand.orchestrator.model.StageTemplate;
import com.stagehand.orchestrator.service.StageExecutionService;
import com.stagehand.orchestrator.service.StageTemplateService;
import com.stagehand.orchestrator.service.TemplatePatch;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for a project's stage templates.
 *
 * GET   /projects/{id}/stages
 * POST  /projects/{id}/stages                append a custom stage or a preset
 * PATCH /projects/{id}/stages/{stageId}      partial update, validated
 */
@RestController
@RequestMapping("/projects/{projectId}/stages")
public class StageTemplateController {

    private final StageTemplateService templateService;

    public StageTemplateController(StageTemplateService templateService) {
        this.templateService = templateService;
    }

    @GetMapping
    public List<StageTemplateResponse> list(@PathVariable String projectId) {
        return templateService.listTemplates(projectId).stream()
                .map(StageTemplateController::toResponse)
                .toList();
    }

    @PostMapping
    public ResponseEntity<StageTemplateResponse> create(@PathVariable String projectId,
                                                        @RequestBody CreateStageRequest req) {
        StageTemplate created;
        if (StageTemplateService.TASK_SPLITTING_PRESET.equals(req.preset())) {
            created = templateService.addTaskSplittingStage(projectId);
        } else if (req.preset() != null) {
            throw new IllegalArgumentException("Unknown stage preset: " + req.preset());
        } else {
            created = templateService.createTemplate(projectId, new TemplatePatch(
                    req.name(), req.description(), req.promptTemplate(), req.inputSource(), req.outputFormat(),
                    req.outputSchema(), req.gateRules(), null, null, null, null, null, null,
                    req.resultMode(), null, null, null, null, null, null));
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(created));
    }

    @PatchMapping("/{stageId}")
    public StageTemplateResponse update(@PathVariable String projectId, @PathVariable String stageId,
                                        @RequestBody TemplatePatch patch) {
        return toResponse(templateService.updateTemplate(projectId, stageId, patch));
    }

    private static StageTemplateResponse toResponse(StageTemplate t) {
        return StageTemplateResponse.from(t, StageExecutionService.shouldAutoStart(t));
    }
}
