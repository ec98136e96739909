package com.stagehand.orchestrator.api;

import com.stagehand.orchestrator.model.Task;
import com.stagehand.orchestrator.model.TaskStatus;
import com.stagehand.orchestrator.service.TaskService;
import com.stagehand.orchestrator.tracker.IssuePage;
import com.stagehand.orchestrator.tracker.IssueTrackerException;
import com.stagehand.orchestrator.tracker.TrackerIssue;
import com.stagehand.orchestrator.tracker.ViewerInfo;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(TaskController.class)
class TaskControllerTest {

    @Autowired   MockMvc     mockMvc;
    @MockitoBean TaskService taskService;

    private static Task task(String id, TaskStatus status) {
        Task t = new Task(id, "p1", "Add SSO");
        t.setStatus(status);
        t.setCurrentStageId("stage-research");
        return t;
    }

    @Test
    void create_returns201() throws Exception {
        when(taskService.createTask("p1", "Add SSO", "Okta", null, null)).thenReturn(task("t1", TaskStatus.PENDING));

        mockMvc.perform(post("/projects/{id}/tasks", "p1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"title":"Add SSO","description":"Okta"}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("t1"))
                .andExpect(jsonPath("$.status").value("pending"))
                .andExpect(jsonPath("$.currentStageId").value("stage-research"));
    }

    @Test
    void archive_terminalOnlyRule_returns409() throws Exception {
        when(taskService.archiveTask("p1", "t1"))
                .thenThrow(new IllegalStateException("Task t1 is already archived"));

        mockMvc.perform(post("/projects/{id}/tasks/{taskId}/archive", "p1", "t1"))
                .andExpect(status().isConflict());
    }

    @Test
    void importIssue_returns201() throws Exception {
        when(taskService.importIssue("p1", "iss-1")).thenReturn(task("t2", TaskStatus.PENDING));

        mockMvc.perform(post("/projects/{id}/tasks/import", "p1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"issueId":"iss-1"}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("t2"));
    }

    @Test
    void trackerIssues_returnsPage() throws Exception {
        IssuePage page = new IssuePage(List.of(new TrackerIssue("iss-1", "ENG-1", "Fix login", null,
                "Todo", 2, "https://linear.app/x/ENG-1", "eng-1-fix-login")), true, "cur-2");
        when(taskService.listAssignedIssues(any(), isNull())).thenReturn(page);

        mockMvc.perform(get("/projects/{id}/tracker/issues", "p1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.issues[0].identifier").value("ENG-1"))
                .andExpect(jsonPath("$.hasNextPage").value(true))
                .andExpect(jsonPath("$.endCursor").value("cur-2"));
    }

    @Test
    void verifyTracker_badKey_returns401() throws Exception {
        when(taskService.verifyTrackerKey("p1")).thenThrow(new IssueTrackerException("Invalid Linear API key", 401));

        mockMvc.perform(post("/projects/{id}/tracker/verify", "p1"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.message").value("Invalid Linear API key"));
    }

    @Test
    void verifyTracker_upstreamDown_returns502() throws Exception {
        when(taskService.verifyTrackerKey("p1")).thenThrow(new IssueTrackerException("Linear API returned 503", 503));

        mockMvc.perform(post("/projects/{id}/tracker/verify", "p1"))
                .andExpect(status().isBadGateway());
    }

    @Test
    void verifyTracker_ok_returnsViewer() throws Exception {
        when(taskService.verifyTrackerKey("p1")).thenReturn(new ViewerInfo("Ada", "Acme"));

        mockMvc.perform(post("/projects/{id}/tracker/verify", "p1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.organizationName").value("Acme"));
    }
}
