package com.stagehand.orchestrator.model;

import java.time.Instant;

/**
 * One attempt at running a stage for a task.
 *
 * DB table: stage_executions (per-project database)
 *
 * Attempts are 1-indexed per (task, stage). Rows are never deleted; they are
 * the audit trail of every prompt sent and every answer received.
 */
public class StageExecution {

    private String             id;
    private String             taskId;
    private String             stageTemplateId;
    private int                attemptNumber = 1;
    private ExecutionStatus    status = ExecutionStatus.PENDING;
    private String             inputPrompt = "";
    private String             userInput;
    private String             rawOutput;
    private String             parsedOutput;
    private String             userDecision;
    private String             sessionId;
    private String             errorMessage;
    private String             thinkingOutput;
    private String             stageResult;
    private String             stageSummary;
    private ExecutionTelemetry telemetry = ExecutionTelemetry.empty();
    private Instant            startedAt;
    private Instant            completedAt;

    public StageExecution() {}

    public StageExecution(String id, String taskId, String stageTemplateId, int attemptNumber) {
        this.id              = id;
        this.taskId          = taskId;
        this.stageTemplateId = stageTemplateId;
        this.attemptNumber   = attemptNumber;
    }

    /** Parsed output if present, otherwise the raw output. */
    public String effectiveOutput() {
        if (parsedOutput != null) return parsedOutput;
        return rawOutput;
    }

    public String             getId()              { return id; }
    public String             getTaskId()          { return taskId; }
    public String             getStageTemplateId() { return stageTemplateId; }
    public int                getAttemptNumber()   { return attemptNumber; }
    public ExecutionStatus    getStatus()          { return status; }
    public String             getInputPrompt()     { return inputPrompt; }
    public String             getUserInput()       { return userInput; }
    public String             getRawOutput()       { return rawOutput; }
    public String             getParsedOutput()    { return parsedOutput; }
    public String             getUserDecision()    { return userDecision; }
    public String             getSessionId()       { return sessionId; }
    public String             getErrorMessage()    { return errorMessage; }
    public String             getThinkingOutput()  { return thinkingOutput; }
    public String             getStageResult()     { return stageResult; }
    public String             getStageSummary()    { return stageSummary; }
    public ExecutionTelemetry getTelemetry()       { return telemetry; }
    public Instant            getStartedAt()       { return startedAt; }
    public Instant            getCompletedAt()     { return completedAt; }

    public void setId(String id)                          { this.id = id; }
    public void setTaskId(String taskId)                  { this.taskId = taskId; }
    public void setStageTemplateId(String id)             { this.stageTemplateId = id; }
    public void setAttemptNumber(int attemptNumber)       { this.attemptNumber = attemptNumber; }
    public void setStatus(ExecutionStatus status)         { this.status = status; }
    public void setInputPrompt(String inputPrompt)        { this.inputPrompt = inputPrompt; }
    public void setUserInput(String userInput)            { this.userInput = userInput; }
    public void setRawOutput(String rawOutput)            { this.rawOutput = rawOutput; }
    public void setParsedOutput(String parsedOutput)      { this.parsedOutput = parsedOutput; }
    public void setUserDecision(String userDecision)      { this.userDecision = userDecision; }
    public void setSessionId(String sessionId)            { this.sessionId = sessionId; }
    public void setErrorMessage(String errorMessage)      { this.errorMessage = errorMessage; }
    public void setThinkingOutput(String thinkingOutput)  { this.thinkingOutput = thinkingOutput; }
    public void setStageResult(String stageResult)        { this.stageResult = stageResult; }
    public void setStageSummary(String stageSummary)      { this.stageSummary = stageSummary; }
    public void setTelemetry(ExecutionTelemetry t)        { this.telemetry = t == null ? ExecutionTelemetry.empty() : t; }
    public void setStartedAt(Instant t)                   { this.startedAt = t; }
    public void setCompletedAt(Instant t)                 { this.completedAt = t; }
}
