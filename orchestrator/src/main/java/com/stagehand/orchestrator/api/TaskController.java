package com.stagehand.orchestrator.api;

import com.stagehand.orchestrator.api.dto.CreateTaskRequest;
import com.stagehand.orchestrator.api.dto.ExecutionResponse;
import com.stagehand.orchestrator.api.dto.ImportIssueRequest;
import com.stagehand.orchestrator.api.dto.TaskResponse;
import com.stagehand.orchestrator.service.TaskService;
import com.stagehand.orchestrator.tracker.IssuePage;
import com.stagehand.orchestrator.tracker.ViewerInfo;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for tasks.
 *
 * POST /projects/{id}/tasks                         create a task
 * POST /projects/{id}/tasks/import                  import a Linear issue as a task
 * GET  /projects/{id}/tasks                         unarchived tasks, newest first
 * GET  /projects/{id}/tasks/{taskId}
 * GET  /projects/{id}/tasks/{taskId}/subtasks
 * GET  /projects/{id}/tasks/{taskId}/executions     every attempt of every stage
 * POST /projects/{id}/tasks/{taskId}/archive
 * GET  /projects/{id}/tracker/issues                assigned Linear issues (?cursor=)
 * POST /projects/{id}/tracker/verify                check the configured API key
 */
@RestController
@RequestMapping("/projects/{projectId}")
public class TaskController {

    private final TaskService taskService;

    public TaskController(TaskService taskService) {
        this.taskService = taskService;
    }

    @PostMapping("/tasks")
    public ResponseEntity<TaskResponse> create(@PathVariable String projectId, @RequestBody CreateTaskRequest req) {
        return ResponseEntity.status(HttpStatus.CREATED).body(TaskResponse.from(taskService.createTask(
                projectId, req.title(), req.description(), req.parentTaskId(), req.branchName())));
    }

    @PostMapping("/tasks/import")
    public ResponseEntity<TaskResponse> importIssue(@PathVariable String projectId,
                                                    @RequestBody ImportIssueRequest req) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(TaskResponse.from(taskService.importIssue(projectId, req.issueId())));
    }

    @GetMapping("/tasks")
    public List<TaskResponse> list(@PathVariable String projectId) {
        return taskService.listTasks(projectId).stream().map(TaskResponse::from).toList();
    }

    @GetMapping("/tasks/{taskId}")
    public TaskResponse get(@PathVariable String projectId, @PathVariable String taskId) {
        return TaskResponse.from(taskService.getTask(projectId, taskId));
    }

    @GetMapping("/tasks/{taskId}/subtasks")
    public List<TaskResponse> subtasks(@PathVariable String projectId, @PathVariable String taskId) {
        return taskService.listSubtasks(projectId, taskId).stream().map(TaskResponse::from).toList();
    }

    @GetMapping("/tasks/{taskId}/executions")
    public List<ExecutionResponse> executions(@PathVariable String projectId, @PathVariable String taskId) {
        return taskService.listExecutions(projectId, taskId).stream().map(ExecutionResponse::from).toList();
    }

    @PostMapping("/tasks/{taskId}/archive")
    public TaskResponse archive(@PathVariable String projectId, @PathVariable String taskId) {
        return TaskResponse.from(taskService.archiveTask(projectId, taskId));
    }

    @GetMapping("/tracker/issues")
    public IssuePage trackerIssues(@PathVariable String projectId,
                                   @RequestParam(required = false) String cursor) {
        return taskService.listAssignedIssues(projectId, cursor);
    }

    @PostMapping("/tracker/verify")
    public ViewerInfo verifyTracker(@PathVariable String projectId) {
        return taskService.verifyTrackerKey(projectId);
    }
}
