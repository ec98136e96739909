package com.stagehand.orchestrator.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.stagehand.orchestrator.agent.AgentRequest;
import com.stagehand.orchestrator.agent.AgentResult;
import com.stagehand.orchestrator.events.PipelineEvent;
import com.stagehand.orchestrator.events.PipelineEventBus;
import com.stagehand.orchestrator.model.ExecutionStatus;
import com.stagehand.orchestrator.model.InputSource;
import com.stagehand.orchestrator.model.OutputFormat;
import com.stagehand.orchestrator.model.ResultMode;
import com.stagehand.orchestrator.model.StageExecution;
import com.stagehand.orchestrator.model.StageTemplate;
import com.stagehand.orchestrator.model.Task;
import com.stagehand.orchestrator.model.TaskStatus;
import com.stagehand.orchestrator.prompt.PromptContext;
import com.stagehand.orchestrator.prompt.PromptRenderer;
import com.stagehand.orchestrator.repository.StageExecutionRepository;
import com.stagehand.orchestrator.vcs.VersionControl;
import com.stagehand.orchestrator.vcs.VersionControlException;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * The stage execution state machine.
 *
 * A stage attempt runs the agent, waits for a human decision, and on approval
 * folds its output into the task's accumulated result and moves the task to
 * its next concrete stage. Every status change is checked against
 * {@link ExecutionStatus#canTransitionTo}, counted, and published.
 *
 * Operations on one task are serialized on a monitor picked from a fixed
 * stripe by task id, so an agent callback and a concurrent HTTP request
 * cannot interleave their updates.
 */
@Service
public class StageExecutionService {

    private static final Logger log = LoggerFactory.getLogger(StageExecutionService.class);

    static final String FOLLOW_UP_HEADER = "\n\n---\n\nAnswers to follow-up questions:\n";
    static final String STOPPED_BY_USER  = "Stopped by user";

    private final TaskService              taskService;
    private final StageTemplateService     templateService;
    private final ProjectService           projects;
    private final StageExecutionRepository executions;
    private final OutputParser             parser;
    private final GateValidator            gates;
    private final StageResultExtractor     extractor;
    private final AgentDispatcher          dispatcher;
    private final VersionControl           vcs;
    private final PipelineEventBus         events;
    private final MeterRegistry            meters;

    static final int LOCK_STRIPES = 64;

    private final Object[] taskLocks = new Object[LOCK_STRIPES];

    public StageExecutionService(TaskService taskService,
                                 StageTemplateService templateService,
                                 ProjectService projects,
                                 StageExecutionRepository executions,
                                 OutputParser parser,
                                 GateValidator gates,
                                 StageResultExtractor extractor,
                                 AgentDispatcher dispatcher,
                                 VersionControl vcs,
                                 PipelineEventBus events,
                                 MeterRegistry meters) {
        this.taskService     = taskService;
        this.templateService = templateService;
        this.projects        = projects;
        this.executions      = executions;
        this.parser          = parser;
        this.gates           = gates;
        this.extractor       = extractor;
        this.dispatcher      = dispatcher;
        this.vcs             = vcs;
        this.events          = events;
        this.meters          = meters;
        for (int i = 0; i < LOCK_STRIPES; i++) taskLocks[i] = new Object();
    }

    // ------------------------------------------------------------------
    // Start
    // ------------------------------------------------------------------

    /**
     * Starts a new attempt of the task's current stage.
     *
     * Agent-driven stages are dispatched asynchronously and return while still
     * {@code running}. Merge and interactive-terminal stages have no agent run;
     * their attempt goes straight to {@code awaiting_user}.
     *
     * @throws IllegalStageTransitionException if the stage is not current, the
     *         task is finished, or an attempt is already active
     */
    public StageExecution startStage(String projectId, String taskId, String stageId, String userInput) {
        synchronized (lockFor(taskId)) {
            Task task = taskService.getTask(projectId, taskId);
            StageTemplate stage = templateService.getTemplate(projectId, stageId);
            requireRunnable(task, stage);

            List<StageExecution> attempts = executions.findAttempts(projectId, taskId, stageId);
            for (StageExecution a : attempts) {
                if (!a.getStatus().isTerminal()) {
                    throw new IllegalStageTransitionException(
                            "Stage '%s' already has an active attempt (%s)".formatted(stage.getName(), a.getId()));
                }
            }
            StageExecution latest = attempts.isEmpty() ? null : attempts.get(attempts.size() - 1);

            List<StageTemplate> pipeline = taskService.concreteStages(projectId, taskId);
            Optional<Approved> previous = previousApproved(projectId, taskId, pipeline, stage);
            String previousOutput = previous.map(Approved::result).orElse(null);

            String effectiveInput = effectiveUserInput(attempts, userInput);
            PromptContext context = PromptContext.forTask(task.promptDescription())
                    .previousOutput(previousOutput)
                    .userInput(effectiveInput)
                    .userDecision(previous.map(p -> p.execution().getUserDecision()).orElse(null))
                    .priorAttemptOutput(priorAttemptOutput(stage, latest))
                    .stageSummaries(stageSummaries(projectId, taskId, pipeline, stage))
                    .allStageOutputs(allStageOutputs(projectId, taskId, pipeline, stage))
                    .availableStages(templateService.availableStagesListing(projectId))
                    .stageOutputs(stageOutputs(projectId, taskId, pipeline, stage))
                    .build();

            StageExecution e = new StageExecution(UUID.randomUUID().toString(), taskId, stageId, attempts.size() + 1);
            e.setInputPrompt(PromptRenderer.render(stage.getPromptTemplate(), context));
            e.setUserInput(stage.getInputSource() == InputSource.PREVIOUS_STAGE ? previousOutput : userInput);
            e.setSessionId(UUID.randomUUID().toString());
            e.setStartedAt(Instant.now());
            transition(e, ExecutionStatus.RUNNING);
            executions.insert(projectId, e);
            publish(projectId, e, ExecutionStatus.PENDING);

            taskService.moveTo(task, TaskStatus.IN_PROGRESS);
            log.info("Started stage '{}' attempt {} for task {} (execution {})",
                    stage.getName(), e.getAttemptNumber(), taskId, e.getId());

            if (stage.getOutputFormat().isManual()) {
                ExecutionStatus from = transition(e, ExecutionStatus.AWAITING_USER);
                executions.update(projectId, e);
                publish(projectId, e, from);
                return e;
            }

            dispatcher.dispatch(projectId, taskId, agentRequest(projectId, task, stage, e), new AgentDispatcher.Callback() {
                @Override
                public void completed(AgentResult result) {
                    completeExecution(projectId, e.getId(), result);
                }

                @Override
                public void failed(String message) {
                    failExecution(projectId, e.getId(), message);
                }
            });
            return e;
        }
    }

    private AgentRequest agentRequest(String projectId, Task task, StageTemplate stage, StageExecution e) {
        Path workDir = task.getWorktreePath() != null
                ? Path.of(task.getWorktreePath())
                : Path.of(projects.requireProject(projectId).getPath());
        String schema = stage.getOutputFormat().isStructured() ? stage.getOutputSchema() : null;
        return new AgentRequest(e.getId(), e.getInputPrompt(), workDir, stage.getAllowedTools(), schema,
                stage.getPersonaSystemPrompt(), stage.getPersonaModel(), e.getSessionId());
    }

    // ------------------------------------------------------------------
    // Agent outcome
    // ------------------------------------------------------------------

    /**
     * Records a finished agent run. Killed and non-zero exits fail the
     * attempt; structured output that does not match its format fails it too.
     * Anything else waits for the user.
     */
    public StageExecution completeExecution(String projectId, String executionId, AgentResult result) {
        StageExecution e = requireExecution(projectId, executionId);
        synchronized (lockFor(e.getTaskId())) {
            e = requireExecution(projectId, executionId);
            if (e.getStatus() != ExecutionStatus.RUNNING) {
                log.warn("Ignoring agent result for execution {} in status {}", executionId, e.getStatus().dbValue());
                return e;
            }
            e.setRawOutput(result.rawOutput());
            e.setThinkingOutput(result.thinking());
            e.setTelemetry(result.telemetry());
            if (result.sessionId() != null) e.setSessionId(result.sessionId());

            if (result.killed()) {
                return fail(projectId, e, STOPPED_BY_USER);
            }
            if (result.exitCode() != 0) {
                return fail(projectId, e, "Process exited with code " + result.exitCode());
            }

            StageTemplate stage = templateService.getTemplate(projectId, e.getStageTemplateId());
            String text = result.resultText();
            if (!stage.getOutputFormat().isStructured()) {
                e.setParsedOutput(text);
            } else {
                Optional<String> json = parser.extractJson(text).or(() -> parser.extractJson(result.rawOutput()));
                if (json.isPresent()) {
                    try {
                        parser.parse(stage.getOutputFormat(), json.get());
                    } catch (OutputParseException ex) {
                        return fail(projectId, e, ex.getMessage());
                    }
                    e.setParsedOutput(json.get());
                } else {
                    // Follow-up attempts may answer in prose.
                    e.setParsedOutput(text);
                }
            }

            ExecutionStatus from = transition(e, ExecutionStatus.AWAITING_USER);
            executions.update(projectId, e);
            publish(projectId, e, from);
            log.info("Execution {} awaiting user decision", executionId);
            return e;
        }
    }

    /** The agent reported an error before producing a result. */
    public StageExecution failExecution(String projectId, String executionId, String message) {
        StageExecution e = requireExecution(projectId, executionId);
        synchronized (lockFor(e.getTaskId())) {
            e = requireExecution(projectId, executionId);
            if (e.getStatus().isTerminal()) {
                log.warn("Execution {} already {}; not failing it with '{}'",
                        executionId, e.getStatus().dbValue(), message);
                return e;
            }
            return fail(projectId, e, message);
        }
    }

    private StageExecution fail(String projectId, StageExecution e, String message) {
        ExecutionStatus from = transition(e, ExecutionStatus.FAILED);
        e.setErrorMessage(message);
        e.setCompletedAt(Instant.now());
        executions.update(projectId, e);
        publish(projectId, e, from);
        log.error("Execution {} failed: {}", e.getId(), message);

        Task task = taskService.getTask(projectId, e.getTaskId());
        if (task.getStatus() == TaskStatus.IN_PROGRESS) {
            taskService.moveTo(task, TaskStatus.FAILED);
        }
        return e;
    }

    // ------------------------------------------------------------------
    // Human decisions
    // ------------------------------------------------------------------

    /**
     * Accepts the latest attempt of the current stage.
     *
     * The decision must satisfy the stage's gate. The stage's result is
     * composed with the previous stage's according to its result mode, side
     * effects run, and the task advances to its next concrete stage or
     * completes. Version-control failures in side effects are logged and do not
     * undo the approval.
     *
     * Everything that can reject the decision is checked before the first
     * write, so a rejected approval leaves the attempt awaiting the user.
     *
     * @throws GateViolationException if the decision does not satisfy the gate
     * @throws IllegalArgumentException if a task splitting stage has no subtasks selected
     */
    public StageExecution approveStage(String projectId, String taskId, String stageId, String decision) {
        synchronized (lockFor(taskId)) {
            Task task = taskService.getTask(projectId, taskId);
            StageTemplate stage = templateService.getTemplate(projectId, stageId);
            requireRunnable(task, stage);
            StageExecution e = requireAwaitingUser(projectId, taskId, stage);

            gates.check(stage.getGateRule(), decision);
            List<TaskService.SubtaskProposal> subtasks = stage.getOutputFormat() == OutputFormat.TASK_SPLITTING
                    ? taskService.splitProposals(task, decision, e.getParsedOutput())
                    : List.of();

            List<StageTemplate> pipeline = taskService.concreteStages(projectId, taskId);
            String previousResult = previousApproved(projectId, taskId, pipeline, stage)
                    .map(Approved::result).orElse(null);
            String own     = extractor.extractStageOutput(stage, e, decision);
            String summary = extractor.extractStageSummary(stage, e, decision);
            String contribution = stage.getResultMode() == ResultMode.APPEND && summary != null ? summary : own;

            e.setUserDecision(decision);
            e.setStageResult(stage.getResultMode().compose(previousResult, contribution));
            e.setStageSummary(summary);
            e.setCompletedAt(Instant.now());
            ExecutionStatus from = transition(e, ExecutionStatus.APPROVED);
            executions.update(projectId, e);
            publish(projectId, e, from);
            log.info("Approved stage '{}' for task {}", stage.getName(), taskId);

            runSideEffects(projectId, task, stage, e, decision);
            if (!subtasks.isEmpty()) {
                taskService.splitTask(projectId, task, subtasks);
                return e;
            }

            advance(projectId, task, stage);
            return e;
        }
    }

    /** Fails the awaiting attempt with the user's feedback. */
    public StageExecution rejectStage(String projectId, String taskId, String stageId, String feedback) {
        synchronized (lockFor(taskId)) {
            Task task = taskService.getTask(projectId, taskId);
            StageTemplate stage = templateService.getTemplate(projectId, stageId);
            StageExecution e = requireAwaitingUser(projectId, task.getId(), stage);
            String reason = feedback == null || feedback.isBlank() ? "Rejected by user" : "Rejected by user: " + feedback;
            return fail(projectId, e, reason);
        }
    }

    /**
     * Starts a fresh attempt with {@code feedback} as user input. An attempt
     * still awaiting the user is closed as failed first.
     *
     * A non-blank {@code decision} is the user's selection from the previous
     * attempt (the findings to apply, for example). It must satisfy the
     * stage's gate and is stored on that attempt, where the next prompt picks
     * it up as the prior attempt's output.
     *
     * @throws GateViolationException if the decision does not satisfy the gate
     */
    public StageExecution redoStage(String projectId, String taskId, String stageId,
                                    String feedback, String decision) {
        synchronized (lockFor(taskId)) {
            Task task = taskService.getTask(projectId, taskId);
            StageTemplate stage = templateService.getTemplate(projectId, stageId);
            requireRunnable(task, stage);
            Optional<StageExecution> latest = executions.findLatestAttempt(projectId, taskId, stageId);

            boolean carriesDecision = decision != null && !decision.isBlank();
            if (carriesDecision) {
                ExecutionStatus status = latest.map(StageExecution::getStatus).orElse(null);
                if (status != ExecutionStatus.AWAITING_USER && status != ExecutionStatus.FAILED) {
                    throw new IllegalStageTransitionException(
                            "Stage '%s' has no finished attempt to select from".formatted(stage.getName()));
                }
                gates.check(stage.getGateRule(), decision);
            }

            if (latest.isPresent() && latest.get().getStatus() == ExecutionStatus.AWAITING_USER) {
                StageExecution superseded = latest.get();
                ExecutionStatus from = transition(superseded, ExecutionStatus.FAILED);
                superseded.setErrorMessage("Superseded by a new attempt");
                superseded.setCompletedAt(Instant.now());
                if (carriesDecision) superseded.setUserDecision(decision);
                executions.update(projectId, superseded);
                publish(projectId, superseded, from);
            } else if (carriesDecision) {
                StageExecution previous = latest.get();
                previous.setUserDecision(decision);
                executions.update(projectId, previous);
            }
            return startStage(projectId, taskId, stageId, feedback);
        }
    }

    /**
     * Stops a running attempt. If no agent is in flight for it (for example
     * after a restart) the attempt is failed directly.
     */
    public StageExecution cancelStage(String projectId, String executionId) {
        StageExecution e = requireExecution(projectId, executionId);
        if (e.getStatus().isTerminal()) {
            throw new IllegalStageTransitionException(
                    "Execution %s is already %s".formatted(executionId, e.getStatus().dbValue()));
        }
        if (dispatcher.cancel(executionId)) {
            log.info("Cancelling execution {}", executionId);
            return e;
        }
        return failExecution(projectId, executionId, STOPPED_BY_USER);
    }

    /**
     * Fails executions left {@code running} by a previous process; their
     * agents are gone.
     *
     * @return how many were failed
     */
    public int failOrphanedExecutions(String projectId) {
        int failed = 0;
        for (StageExecution e : executions.findByStatus(projectId, ExecutionStatus.RUNNING)) {
            if (dispatcher.isInFlight(e.getId())) continue;
            failExecution(projectId, e.getId(), "Agent process was lost (orchestrator restarted)");
            failed++;
        }
        return failed;
    }

    /** Merge and interactive stages never start themselves; others do unless they need user input. */
    public static boolean shouldAutoStart(StageTemplate stage) {
        if (stage.getOutputFormat().isManual()) return false;
        return !stage.isRequiresUserInput();
    }

    // ------------------------------------------------------------------
    // Side effects and advancement
    // ------------------------------------------------------------------

    private void runSideEffects(String projectId, Task task, StageTemplate stage,
                                StageExecution e, String decision) {
        Path workDir = task.getWorktreePath() != null
                ? Path.of(task.getWorktreePath())
                : Path.of(projects.requireProject(projectId).getPath());

        if (stage.isCommitsChanges()) {
            String prefix = stage.getCommitPrefix() == null || stage.getCommitPrefix().isBlank()
                    ? "" : stage.getCommitPrefix() + ": ";
            try {
                vcs.commitAll(workDir, prefix + task.getTitle());
            } catch (VersionControlException ex) {
                log.warn("Commit after stage '{}' failed for task {}: {}", stage.getName(), task.getId(), ex.getMessage());
            }
        }

        if (stage.isCreatesPr()) {
            JsonNode fields = parser.tryReadTree(decision);
            if (fields == null || !fields.isObject()) fields = parser.tryReadTree(e.getParsedOutput());
            String title = fields != null && fields.hasNonNull("title") ? fields.get("title").asText() : task.getTitle();
            String body  = fields != null && fields.hasNonNull("description") ? fields.get("description").asText() : "";
            try {
                String branch = task.getBranchName() != null ? task.getBranchName() : vcs.currentBranch(workDir);
                task.setPrUrl(vcs.openPullRequest(workDir, branch, title, body));
                taskService.save(task);
            } catch (VersionControlException ex) {
                log.warn("Opening a pull request for task {} failed: {}", task.getId(), ex.getMessage());
            }
        }

        if (stage.isTriggersStageSelection()) {
            taskService.applyStageSelection(projectId, task, stage, decision, e.getParsedOutput());
        }
    }

    private void advance(String projectId, Task task, StageTemplate stage) {
        Optional<StageTemplate> next = stage.isTerminal()
                ? Optional.empty()
                : taskService.concreteStages(projectId, task.getId()).stream()
                        .filter(t -> t.getSortOrder() > stage.getSortOrder())
                        .findFirst();
        if (next.isPresent()) {
            task.setCurrentStageId(next.get().getId());
            taskService.save(task);
            log.info("Task {} advanced to stage '{}'", task.getId(), next.get().getName());
        } else {
            taskService.moveTo(task, TaskStatus.COMPLETED);
        }
    }

    // ------------------------------------------------------------------
    // Prompt context
    // ------------------------------------------------------------------

    /** An approved execution of an earlier stage and the text it hands on. */
    private record Approved(StageTemplate stage, StageExecution execution, String result) {}

    private Optional<Approved> previousApproved(String projectId, String taskId,
                                                List<StageTemplate> pipeline, StageTemplate stage) {
        List<StageTemplate> earlier = earlierStages(pipeline, stage);
        for (int i = earlier.size() - 1; i >= 0; i--) {
            StageTemplate s = earlier.get(i);
            Optional<StageExecution> approved = executions.findLatestApproved(projectId, taskId, s.getId());
            if (approved.isPresent()) {
                StageExecution a = approved.get();
                String result = a.getStageResult() != null ? a.getStageResult() : a.effectiveOutput();
                return Optional.of(new Approved(s, a, result));
            }
        }
        return Optional.empty();
    }

    private List<Approved> allApproved(String projectId, String taskId,
                                       List<StageTemplate> pipeline, StageTemplate stage) {
        List<Approved> approved = new ArrayList<>();
        for (StageTemplate s : earlierStages(pipeline, stage)) {
            executions.findLatestApproved(projectId, taskId, s.getId()).ifPresent(a -> approved.add(
                    new Approved(s, a, a.getStageResult() != null ? a.getStageResult() : a.effectiveOutput())));
        }
        return approved;
    }

    private String stageSummaries(String projectId, String taskId, List<StageTemplate> pipeline, StageTemplate stage) {
        List<String> blocks = new ArrayList<>();
        for (Approved a : allApproved(projectId, taskId, pipeline, stage)) {
            if (a.execution().getStageSummary() != null) {
                blocks.add("### " + a.stage().getName() + "\n" + a.execution().getStageSummary());
            }
        }
        return blocks.isEmpty() ? null : String.join("\n\n", blocks);
    }

    private String allStageOutputs(String projectId, String taskId, List<StageTemplate> pipeline, StageTemplate stage) {
        List<String> blocks = new ArrayList<>();
        for (Approved a : allApproved(projectId, taskId, pipeline, stage)) {
            if (a.result() != null) blocks.add("### " + a.stage().getName() + "\n" + a.result());
        }
        return blocks.isEmpty() ? null : String.join("\n\n", blocks);
    }

    private Map<String, PromptContext.StageOutput> stageOutputs(String projectId, String taskId,
                                                               List<StageTemplate> pipeline, StageTemplate stage) {
        Map<String, PromptContext.StageOutput> outputs = new LinkedHashMap<>();
        for (Approved a : allApproved(projectId, taskId, pipeline, stage)) {
            outputs.put(a.stage().getName(), new PromptContext.StageOutput(a.result(), a.execution().getStageSummary()));
        }
        return outputs;
    }

    /**
     * What the previous attempt produced. For findings and task splitting the
     * user's selection is what matters on the next pass.
     */
    static String priorAttemptOutput(StageTemplate stage, StageExecution latest) {
        if (latest == null) return null;
        OutputFormat format = stage.getOutputFormat();
        if ((format == OutputFormat.FINDINGS || format == OutputFormat.TASK_SPLITTING)
                && latest.getUserDecision() != null) {
            return latest.getUserDecision();
        }
        return latest.effectiveOutput();
    }

    /** On a re-run the first attempt's input is kept and the new input is appended as answers. */
    static String effectiveUserInput(List<StageExecution> attempts, String userInput) {
        if (attempts.isEmpty()) return userInput;
        String first = attempts.get(0).getUserInput();
        boolean hasFirst = first != null && !first.isBlank();
        boolean hasNew   = userInput != null && !userInput.isBlank();
        if (hasFirst && hasNew) return first + FOLLOW_UP_HEADER + userInput;
        return hasNew ? userInput : first;
    }

    private static List<StageTemplate> earlierStages(List<StageTemplate> pipeline, StageTemplate stage) {
        return pipeline.stream().filter(t -> t.getSortOrder() < stage.getSortOrder()).toList();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void requireRunnable(Task task, StageTemplate stage) {
        if (task.isArchived() || task.getStatus().isTerminal()) {
            throw new IllegalStageTransitionException(
                    "Task %s is %s".formatted(task.getId(), task.isArchived() ? "archived" : task.getStatus().dbValue()));
        }
        if (!stage.getId().equals(task.getCurrentStageId())) {
            throw new IllegalStageTransitionException(
                    "Stage '%s' is not the current stage of task %s".formatted(stage.getName(), task.getId()));
        }
    }

    private StageExecution requireAwaitingUser(String projectId, String taskId, StageTemplate stage) {
        StageExecution e = executions.findLatestAttempt(projectId, taskId, stage.getId())
                .orElseThrow(() -> new IllegalStageTransitionException(
                        "Stage '%s' has not been run".formatted(stage.getName())));
        if (e.getStatus() != ExecutionStatus.AWAITING_USER) {
            throw new IllegalStageTransitionException(
                    "Stage '%s' is %s, not awaiting a decision".formatted(stage.getName(), e.getStatus().dbValue()));
        }
        return e;
    }

    private StageExecution requireExecution(String projectId, String executionId) {
        projects.requireProject(projectId);
        return executions.findById(projectId, executionId)
                .orElseThrow(() -> new NotFoundException("Execution", executionId));
    }

    /** @return the status the execution moved from */
    private ExecutionStatus transition(StageExecution e, ExecutionStatus next) {
        ExecutionStatus from = e.getStatus();
        if (!from.canTransitionTo(next)) {
            throw new IllegalStageTransitionException(
                    "Execution %s cannot move from %s to %s".formatted(e.getId(), from.dbValue(), next.dbValue()));
        }
        e.setStatus(next);
        meters.counter("stagehand.stage.transitions", "from", from.dbValue(), "to", next.dbValue()).increment();
        return from;
    }

    private void publish(String projectId, StageExecution e, ExecutionStatus from) {
        events.publish(PipelineEvent.stage(projectId, e.getTaskId(), e.getId(),
                from.dbValue(), e.getStatus().dbValue()));
    }

    /** Tasks share a fixed set of monitors, so the lock table never grows. */
    Object lockFor(String taskId) {
        return taskLocks[Math.floorMod(taskId.hashCode(), LOCK_STRIPES)];
    }
}
