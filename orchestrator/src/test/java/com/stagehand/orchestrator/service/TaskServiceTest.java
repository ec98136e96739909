package com.stagehand.orchestrator.service;

import com.stagehand.orchestrator.events.PipelineEvent;
import com.stagehand.orchestrator.model.Project;
import com.stagehand.orchestrator.model.StageTemplate;
import com.stagehand.orchestrator.model.Task;
import com.stagehand.orchestrator.model.TaskStatus;
import com.stagehand.orchestrator.tracker.IssueDetail;
import com.stagehand.orchestrator.tracker.IssueTracker;
import com.stagehand.orchestrator.vcs.VersionControl;
import com.stagehand.orchestrator.vcs.VersionControlException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TaskServiceTest {

    @TempDir
    Path dir;

    @Mock IssueTracker   tracker;
    @Mock VersionControl vcs;

    private ServiceFixture fx;
    private Project project;
    private String projectId;

    @BeforeEach
    void setUp() {
        fx = new ServiceFixture(dir, tracker, vcs);
        project   = fx.newProject("web");
        projectId = project.getId();
    }

    @AfterEach
    void tearDown() {
        fx.close();
    }

    private StageTemplate byName(String name) {
        return fx.templates.listTemplates(projectId).stream()
                .filter(t -> t.getName().equals(name))
                .findFirst()
                .orElseThrow();
    }

    // ------------------------------------------------------------------
    // createTask
    // ------------------------------------------------------------------

    @Test
    void createTask_startsPendingAtFirstStage() {
        Task task = fx.tasks.createTask(projectId, "  Add dark mode ", "Use CSS vars", null, null);

        Task stored = fx.tasks.getTask(projectId, task.getId());
        assertThat(stored.getTitle()).isEqualTo("Add dark mode");
        assertThat(stored.getStatus()).isEqualTo(TaskStatus.PENDING);
        assertThat(stored.getCurrentStageId()).isEqualTo(byName("Research").getId());
        assertThat(fx.tasks.concreteStages(projectId, task.getId())).hasSize(8);
    }

    @Test
    void createTask_blankTitle_throws() {
        assertThatThrownBy(() -> fx.tasks.createTask(projectId, "", null, null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void getTask_unknown_throwsNotFound() {
        assertThatThrownBy(() -> fx.tasks.getTask(projectId, "missing"))
                .isInstanceOf(NotFoundException.class);
    }

    // ------------------------------------------------------------------
    // Tracker import
    // ------------------------------------------------------------------

    @Test
    void importIssue_buildsTitleAndDescriptionFromIssue() {
        fx.projects.putProjectSetting(projectId, TaskService.LINEAR_API_KEY, "lin_key");
        when(tracker.fetchIssueDetail("lin_key", "issue-1")).thenReturn(new IssueDetail(
                "issue-1", "ENG-42", "Fix login", "Users cannot log in.", "eng-42-fix-login",
                List.of("Ann: Repro on Safari", "Bo: Also Firefox")));

        Task task = fx.tasks.importIssue(projectId, "issue-1");

        assertThat(task.getTitle()).isEqualTo("[ENG-42] Fix login");
        assertThat(task.getBranchName()).isEqualTo("eng-42-fix-login");
        assertThat(task.getDescription()).isEqualTo("""
                Linear ticket: ENG-42 — Fix login

                ## Description
                Users cannot log in.

                ## Comments
                Ann: Repro on Safari

                Bo: Also Firefox""");
    }

    @Test
    void importIssue_withoutApiKey_throwsIllegalState() {
        assertThatThrownBy(() -> fx.tasks.importIssue(projectId, "issue-1"))
                .isInstanceOf(IllegalStateException.class);
    }

    // ------------------------------------------------------------------
    // moveTo
    // ------------------------------------------------------------------

    @Test
    void moveTo_publishesTaskEvent() {
        Task task = fx.tasks.createTask(projectId, "t", null, null, null);
        List<PipelineEvent> seen = new ArrayList<>();
        fx.events.subscribe(task.getId(), seen::add);

        fx.tasks.moveTo(task, TaskStatus.IN_PROGRESS);
        fx.tasks.moveTo(task, TaskStatus.IN_PROGRESS);

        assertThat(seen).hasSize(1);
        assertThat(seen.get(0).type()).isEqualTo(PipelineEvent.Type.TASK_STATUS_CHANGED);
        assertThat(seen.get(0).toStatus()).isEqualTo("in_progress");
        assertThat(fx.tasks.getTask(projectId, task.getId()).getStatus()).isEqualTo(TaskStatus.IN_PROGRESS);
    }

    @Test
    void moveTo_fromTerminalStatus_throws() {
        Task task = fx.tasks.createTask(projectId, "t", null, null, null);
        fx.tasks.moveTo(task, TaskStatus.IN_PROGRESS);
        fx.tasks.moveTo(task, TaskStatus.COMPLETED);

        assertThatThrownBy(() -> fx.tasks.moveTo(task, TaskStatus.IN_PROGRESS))
                .isInstanceOf(IllegalStageTransitionException.class);
    }

    // ------------------------------------------------------------------
    // applyStageSelection
    // ------------------------------------------------------------------

    @Test
    void applyStageSelection_keepsMandatoryAndNamedStages() {
        Task task = fx.tasks.createTask(projectId, "t", null, null, null);

        List<StageTemplate> chosen = fx.tasks.applyStageSelection(projectId, task, byName("Research"),
                "[\"  implementation \", {\"name\":\"PR Preparation\"}, \"Nonexistent\"]", null);

        assertThat(chosen).extracting(StageTemplate::getName)
                .containsExactly("Research", "Implementation", "PR Preparation");
        assertThat(fx.tasks.concreteStages(projectId, task.getId())).extracting(StageTemplate::getName)
                .containsExactly("Research", "Implementation", "PR Preparation");
    }

    @Test
    void applyStageSelection_fallsBackToSuggestedStages() {
        Task task = fx.tasks.createTask(projectId, "t", null, null, null);
        String parsed = "{\"research\":\"r\",\"suggested_stages\":[{\"name\":\"Planning\",\"reason\":\"x\"}]}";

        List<StageTemplate> chosen = fx.tasks.applyStageSelection(projectId, task, byName("Research"),
                "looks good", parsed);

        assertThat(chosen).extracting(StageTemplate::getName).containsExactly("Research", "Planning");
    }

    @Test
    void applyStageSelection_nothingMatches_keepsFullPipeline() {
        Task task = fx.tasks.createTask(projectId, "t", null, null, null);

        List<StageTemplate> chosen = fx.tasks.applyStageSelection(projectId, task, byName("Research"),
                "[\"Deploy\"]", null);

        assertThat(chosen).hasSize(8);
    }

    // ------------------------------------------------------------------
    // splitTask
    // ------------------------------------------------------------------

    @Test
    void splitTask_fromDecision_createsChildrenAndMarksParentSplit() {
        Task parent = fx.tasks.createTask(projectId, "Big", null, null, null);
        fx.tasks.moveTo(parent, TaskStatus.IN_PROGRESS);

        List<Task> children = fx.tasks.splitTask(projectId, parent,
                "[{\"title\":\"Part A\",\"description\":\"a\"},{\"title\":\"Part B\"}]", null);

        assertThat(children).extracting(Task::getTitle).containsExactly("Part A", "Part B");
        assertThat(fx.tasks.listSubtasks(projectId, parent.getId())).extracting(Task::getTitle)
                .containsExactlyInAnyOrder("Part A", "Part B");
        assertThat(fx.tasks.getTask(projectId, parent.getId()).getStatus()).isEqualTo(TaskStatus.SPLIT);
    }

    @Test
    void splitTask_fromOutput_usesOnlySelectedProposals() {
        Task parent = fx.tasks.createTask(projectId, "Big", null, null, null);
        String parsed = """
                {"reasoning":"r","proposed_tasks":[
                  {"title":"Keep","selected":true},
                  {"title":"Drop","selected":false}]}
                """;

        List<Task> children = fx.tasks.splitTask(projectId, parent, null, parsed);

        assertThat(children).extracting(Task::getTitle).containsExactly("Keep");
        assertThat(children.get(0).getParentTaskId()).isEqualTo(parent.getId());
    }

    @Test
    void splitTask_nothingSelected_throws() {
        Task parent = fx.tasks.createTask(projectId, "Big", null, null, null);

        assertThatThrownBy(() -> fx.tasks.splitTask(projectId, parent, "[]", null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(fx.tasks.getTask(projectId, parent.getId()).getStatus()).isEqualTo(TaskStatus.PENDING);
    }

    // ------------------------------------------------------------------
    // archiveTask
    // ------------------------------------------------------------------

    @Test
    void archiveTask_removesWorktreeAndBranch() {
        Task task = fx.tasks.createTask(projectId, "t", null, null, "feature/t");
        task.setWorktreePath(dir.resolve("wt").toString());
        fx.tasks.save(task);
        Path repo = Path.of(project.getPath());
        when(vcs.branchExists(repo, "feature/t")).thenReturn(true);

        fx.tasks.archiveTask(projectId, task.getId());

        verify(vcs).removeWorktree(repo, dir.resolve("wt"));
        verify(vcs).deleteBranch(repo, "feature/t");
        assertThat(fx.tasks.listTasks(projectId)).isEmpty();
    }

    @Test
    void archiveTask_ejectedWithoutWorktree_leavesBranchFirst() {
        Task task = fx.tasks.createTask(projectId, "t", null, null, "feature/t");
        task.setEjected(true);
        fx.tasks.save(task);
        Path repo = Path.of(project.getPath());
        when(vcs.defaultBranch(repo)).thenReturn(Optional.of("main"));
        when(vcs.branchExists(repo, "feature/t")).thenReturn(false);

        fx.tasks.archiveTask(projectId, task.getId());

        verify(vcs).checkoutBranch(repo, "main");
        verify(vcs, never()).deleteBranch(any(), any());
    }

    @Test
    void archiveTask_cleanupFailure_stillArchives() {
        Task task = fx.tasks.createTask(projectId, "t", null, null, "feature/t");
        Path repo = Path.of(project.getPath());
        when(vcs.branchExists(repo, "feature/t")).thenReturn(true);
        doThrow(new VersionControlException("branch is checked out", 1)).when(vcs).deleteBranch(repo, "feature/t");

        Task archived = fx.tasks.archiveTask(projectId, task.getId());

        assertThat(archived.isArchived()).isTrue();
        assertThat(fx.tasks.getTask(projectId, task.getId()).isArchived()).isTrue();
    }
}
