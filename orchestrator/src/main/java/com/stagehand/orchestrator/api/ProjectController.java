package com.stagehand.orchestrator.api;

import com.stagehand.orchestrator.api.dto.CreateProjectRequest;
import com.stagehand.orchestrator.api.dto.ProjectResponse;
import com.stagehand.orchestrator.api.dto.SettingRequest;
import com.stagehand.orchestrator.service.NotFoundException;
import com.stagehand.orchestrator.service.ProjectService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST API for projects and their settings.
 *
 * POST /projects                            register a repository and seed its pipeline
 * GET  /projects                            list projects (?includeArchived=true for all)
 * POST /projects/{id}/archive|unarchive
 * GET  /projects/{id}/settings/{key}
 * PUT  /projects/{id}/settings/{key}
 */
@RestController
@RequestMapping("/projects")
public class ProjectController {

    private final ProjectService projectService;

    public ProjectController(ProjectService projectService) {
        this.projectService = projectService;
    }

    @PostMapping
    public ResponseEntity<ProjectResponse> create(@RequestBody CreateProjectRequest req) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ProjectResponse.from(projectService.createProject(req.name(), req.path())));
    }

    @GetMapping
    public List<ProjectResponse> list(@RequestParam(defaultValue = "false") boolean includeArchived) {
        return projectService.listProjects(includeArchived).stream()
                .map(ProjectResponse::from)
                .toList();
    }

    @GetMapping("/{id}")
    public ProjectResponse get(@PathVariable String id) {
        return ProjectResponse.from(projectService.requireProject(id));
    }

    @PostMapping("/{id}/archive")
    public ProjectResponse archive(@PathVariable String id) {
        return ProjectResponse.from(projectService.archiveProject(id));
    }

    @PostMapping("/{id}/unarchive")
    public ProjectResponse unarchive(@PathVariable String id) {
        return ProjectResponse.from(projectService.unarchiveProject(id));
    }

    /** Secrets are write-only: reading {@code linear_api_key} only reports whether it is set. */
    @GetMapping("/{id}/settings/{key}")
    public Map<String, Object> getSetting(@PathVariable String id, @PathVariable String key) {
        String value = projectService.getProjectSetting(id, key)
                .orElseThrow(() -> new NotFoundException("Setting", key));
        if (key.endsWith("_api_key")) {
            return Map.of("key", key, "configured", true);
        }
        return Map.of("key", key, "value", value);
    }

    @PutMapping("/{id}/settings/{key}")
    public ResponseEntity<Void> putSetting(@PathVariable String id, @PathVariable String key,
                                           @RequestBody SettingRequest req) {
        projectService.putProjectSetting(id, key, req.value());
        return ResponseEntity.noContent().build();
    }
}
