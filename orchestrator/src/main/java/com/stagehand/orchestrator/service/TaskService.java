package com.stagehand.orchestrator.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.stagehand.orchestrator.events.PipelineEvent;
import com.stagehand.orchestrator.events.PipelineEventBus;
import com.stagehand.orchestrator.model.Project;
import com.stagehand.orchestrator.model.StageExecution;
import com.stagehand.orchestrator.model.StageTemplate;
import com.stagehand.orchestrator.model.Task;
import com.stagehand.orchestrator.model.TaskStatus;
import com.stagehand.orchestrator.repository.StageExecutionRepository;
import com.stagehand.orchestrator.repository.StageTemplateRepository;
import com.stagehand.orchestrator.repository.TaskRepository;
import com.stagehand.orchestrator.repository.TaskStageRepository;
import com.stagehand.orchestrator.tracker.IssueDetail;
import com.stagehand.orchestrator.tracker.IssuePage;
import com.stagehand.orchestrator.tracker.IssueTracker;
import com.stagehand.orchestrator.tracker.ViewerInfo;
import com.stagehand.orchestrator.vcs.VersionControl;
import com.stagehand.orchestrator.vcs.VersionControlException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

/**
 * Task lifecycle outside a single stage: creation, import, the concrete stage
 * list, splitting and archival.
 */
@Service
public class TaskService {

    private static final Logger log = LoggerFactory.getLogger(TaskService.class);

    public static final String LINEAR_API_KEY = "linear_api_key";

    private final TaskRepository           tasks;
    private final TaskStageRepository      taskStages;
    private final StageTemplateRepository  templates;
    private final StageExecutionRepository executions;
    private final ProjectService           projects;
    private final IssueTracker             tracker;
    private final VersionControl           vcs;
    private final OutputParser             parser;
    private final PipelineEventBus         events;

    public TaskService(TaskRepository tasks,
                       TaskStageRepository taskStages,
                       StageTemplateRepository templates,
                       StageExecutionRepository executions,
                       ProjectService projects,
                       IssueTracker tracker,
                       VersionControl vcs,
                       OutputParser parser,
                       PipelineEventBus events) {
        this.tasks      = tasks;
        this.taskStages = taskStages;
        this.templates  = templates;
        this.executions = executions;
        this.projects   = projects;
        this.tracker    = tracker;
        this.vcs        = vcs;
        this.parser     = parser;
        this.events     = events;
    }

    // ------------------------------------------------------------------
    // Creation
    // ------------------------------------------------------------------

    /**
     * A new task starts {@code pending} at the first template, with no stage
     * selection, so every template is part of its pipeline.
     */
    public Task createTask(String projectId, String title, String description,
                           String parentTaskId, String branchName) {
        projects.requireProject(projectId);
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("Task title is required");
        }
        List<StageTemplate> all = templates.findAll(projectId);
        if (all.isEmpty()) {
            throw new IllegalStageTransitionException("Project " + projectId + " has no stage templates");
        }

        Task task = new Task(UUID.randomUUID().toString(), projectId, title.trim());
        task.setDescription(description);
        task.setParentTaskId(parentTaskId);
        task.setBranchName(branchName);
        task.setCurrentStageId(all.get(0).getId());
        tasks.insert(task);
        log.info("Created task {} '{}' in project {}", task.getId(), task.getTitle(), projectId);
        return task;
    }

    /** Imports a tracker issue, with its description and comments, as a new task. */
    public Task importIssue(String projectId, String issueId) {
        IssueDetail issue = tracker.fetchIssueDetail(trackerKey(projectId), issueId);

        List<String> parts = new ArrayList<>();
        parts.add("Linear ticket: %s — %s".formatted(issue.identifier(), issue.title()));
        if (issue.description() != null && !issue.description().isBlank()) {
            parts.add("\n## Description\n" + issue.description());
        }
        if (!issue.comments().isEmpty()) {
            parts.add("\n## Comments\n" + String.join("\n\n", issue.comments()));
        }
        String title = "[%s] %s".formatted(issue.identifier(), issue.title());
        return createTask(projectId, title, String.join("\n", parts), null, issue.branchName());
    }

    /** Open issues assigned to the owner of the project's tracker key. */
    public IssuePage listAssignedIssues(String projectId, String cursor) {
        return tracker.fetchAssignedIssues(trackerKey(projectId), cursor);
    }

    public ViewerInfo verifyTrackerKey(String projectId) {
        return tracker.verifyApiKey(trackerKey(projectId));
    }

    private String trackerKey(String projectId) {
        return projects.getProjectSetting(projectId, LINEAR_API_KEY)
                .orElseThrow(() -> new IllegalStateException("No Linear API key configured for project " + projectId));
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    public Task getTask(String projectId, String taskId) {
        projects.requireProject(projectId);
        return tasks.findById(projectId, taskId)
                .orElseThrow(() -> new NotFoundException("Task", taskId));
    }

    /** Unarchived tasks, newest first. */
    public List<Task> listTasks(String projectId) {
        projects.requireProject(projectId);
        return tasks.findAll(projectId, false);
    }

    public List<Task> listSubtasks(String projectId, String parentTaskId) {
        getTask(projectId, parentTaskId);
        return tasks.findChildren(projectId, parentTaskId);
    }

    public List<StageExecution> listExecutions(String projectId, String taskId) {
        getTask(projectId, taskId);
        return executions.findByTask(projectId, taskId);
    }

    /**
     * The stages this task actually runs, in sort order: its selection if one
     * was made, otherwise every project template.
     */
    public List<StageTemplate> concreteStages(String projectId, String taskId) {
        List<StageTemplate> all = templates.findAll(projectId);
        Set<String> selected = new HashSet<>(taskStages.findStageIds(projectId, taskId));
        if (selected.isEmpty()) return all;
        return all.stream().filter(t -> selected.contains(t.getId())).toList();
    }

    // ------------------------------------------------------------------
    // Status
    // ------------------------------------------------------------------

    /**
     * Moves the task to {@code next}, publishing the change. Moving to the
     * current status is a no-op.
     *
     * @throws IllegalStageTransitionException if the task status table forbids it
     */
    public void moveTo(Task task, TaskStatus next) {
        TaskStatus from = task.getStatus();
        if (from == next) return;
        if (!from.canTransitionTo(next)) {
            throw new IllegalStageTransitionException(
                    "Task %s cannot move from %s to %s".formatted(task.getId(), from.dbValue(), next.dbValue()));
        }
        task.setStatus(next);
        tasks.update(task);
        log.info("Task {} {} -> {}", task.getId(), from.dbValue(), next.dbValue());
        events.publish(PipelineEvent.task(task.getProjectId(), task.getId(), from.dbValue(), next.dbValue()));
    }

    public void save(Task task) {
        tasks.update(task);
    }

    // ------------------------------------------------------------------
    // Stage selection and splitting
    // ------------------------------------------------------------------

    /**
     * Narrows the task's pipeline to the mandatory stages plus the named ones.
     *
     * Names come from {@code decision} when it is a JSON array (of strings, or
     * of objects with a "name"), otherwise from the selecting stage's
     * {@code suggested_stages}. Matching is trimmed and case-insensitive;
     * unknown names are ignored. When nothing matches the selection is left
     * as it was.
     *
     * @return the resulting concrete stage list
     */
    public List<StageTemplate> applyStageSelection(String projectId, Task task, StageTemplate selector,
                                                   String decision, String parsedOutput) {
        Set<String> wanted = new HashSet<>();
        JsonNode names = parser.tryReadTree(decision);
        if (names == null || !names.isArray()) {
            JsonNode output = parser.tryReadTree(parsedOutput);
            names = output == null ? null : output.path("suggested_stages");
        }
        if (names != null && names.isArray()) {
            for (JsonNode n : names) {
                String name = n.isTextual() ? n.asText() : n.path("name").asText("");
                if (!name.isBlank()) wanted.add(normalize(name));
            }
        }

        List<StageTemplate> all = templates.findAll(projectId);
        boolean matched = all.stream().anyMatch(t -> wanted.contains(normalize(t.getName())));
        if (!matched) {
            log.info("Stage selection for task {} matched no templates; keeping the full pipeline", task.getId());
            return concreteStages(projectId, task.getId());
        }

        List<StageTemplate> chosen = all.stream()
                .filter(t -> isMandatory(t, selector) || wanted.contains(normalize(t.getName())))
                .toList();
        taskStages.replace(projectId, task.getId(), chosen);
        log.info("Task {} pipeline narrowed to {}", task.getId(),
                chosen.stream().map(StageTemplate::getName).toList());
        return chosen;
    }

    /** A subtask the parent will be split into. */
    public record SubtaskProposal(String title, String description) {}

    /**
     * Resolves the subtasks a split would create without touching the store.
     * Proposals come from {@code decision} (a JSON array of {title,
     * description}) or, when absent, from the proposals flagged selected in
     * the stage output. Proposals without a title are skipped.
     *
     * @throws IllegalArgumentException if nothing is selected
     */
    public List<SubtaskProposal> splitProposals(Task parent, String decision, String parsedOutput) {
        JsonNode proposals = parser.tryReadTree(decision);
        boolean fromOutput = proposals == null || !proposals.isArray();
        if (fromOutput) {
            JsonNode output = parser.tryReadTree(parsedOutput);
            proposals = output == null ? null : output.path("proposed_tasks");
        }
        List<SubtaskProposal> selected = new ArrayList<>();
        if (proposals != null && proposals.isArray()) {
            for (JsonNode p : proposals) {
                if (fromOutput && !GateValidator.truthy(p.get("selected"))) continue;
                String title = p.path("title").asText("");
                if (title.isBlank()) continue;
                selected.add(new SubtaskProposal(title, p.path("description").asText("")));
            }
        }
        if (selected.isEmpty()) {
            throw new IllegalArgumentException("No subtasks selected for task " + parent.getId());
        }
        return selected;
    }

    /**
     * Creates one child task per selected proposal and marks the parent
     * {@code split}.
     *
     * @see #splitProposals
     */
    public List<Task> splitTask(String projectId, Task parent, String decision, String parsedOutput) {
        return splitTask(projectId, parent, splitProposals(parent, decision, parsedOutput));
    }

    public List<Task> splitTask(String projectId, Task parent, List<SubtaskProposal> proposals) {
        if (proposals.isEmpty()) {
            throw new IllegalArgumentException("No subtasks selected for task " + parent.getId());
        }
        List<Task> children = new ArrayList<>();
        for (SubtaskProposal p : proposals) {
            children.add(createTask(projectId, p.title(), p.description(), parent.getId(), null));
        }
        moveTo(parent, TaskStatus.SPLIT);
        log.info("Task {} split into {} subtask(s)", parent.getId(), children.size());
        return children;
    }

    // ------------------------------------------------------------------
    // Archival
    // ------------------------------------------------------------------

    /**
     * Archives the task, then removes its worktree and branch. Cleanup is best
     * effort: failures are logged and the task stays archived.
     */
    public Task archiveTask(String projectId, String taskId) {
        Task task = getTask(projectId, taskId);
        task.setArchived(true);
        tasks.update(task);
        log.info("Archived task {}", taskId);

        Project project = projects.requireProject(projectId);
        Path repo = Path.of(project.getPath());
        cleanup(task, repo);
        return task;
    }

    private void cleanup(Task task, Path repo) {
        if (task.isEjected() && task.getWorktreePath() == null) {
            try {
                vcs.defaultBranch(repo).ifPresent(main -> vcs.checkoutBranch(repo, main));
            } catch (VersionControlException e) {
                log.warn("Could not leave branch {} before deleting it: {}", task.getBranchName(), e.getMessage());
            }
        }
        if (task.getWorktreePath() != null) {
            try {
                vcs.removeWorktree(repo, Path.of(task.getWorktreePath()));
            } catch (VersionControlException e) {
                log.warn("Could not remove worktree {} for task {}: {}",
                        task.getWorktreePath(), task.getId(), e.getMessage());
            }
        }
        if (task.getBranchName() != null) {
            try {
                if (vcs.branchExists(repo, task.getBranchName())) {
                    vcs.deleteBranch(repo, task.getBranchName());
                }
            } catch (VersionControlException e) {
                log.warn("Could not delete branch {} for task {}: {}",
                        task.getBranchName(), task.getId(), e.getMessage());
            }
        }
    }

    // ------------------------------------------------------------------

    /** Stages at or before the selecting stage, and the selecting stage itself, always run. */
    private static boolean isMandatory(StageTemplate t, StageTemplate selector) {
        return t.isTriggersStageSelection() || t.getSortOrder() <= selector.getSortOrder();
    }

    private static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
