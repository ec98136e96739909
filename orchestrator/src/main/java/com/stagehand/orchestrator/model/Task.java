package com.stagehand.orchestrator.model;

import java.time.Instant;

/**
 * A unit of work travelling through a project's pipeline.
 *
 * DB table: tasks (per-project database)
 *
 * currentStageId points at the stage template the task is on; it only moves
 * forward along the task's concrete stage list.
 */
public class Task {

    private String     id;
    private String     projectId;
    private String     title;
    private String     description;
    private String     currentStageId;
    private TaskStatus status = TaskStatus.PENDING;
    private boolean    archived;
    private String     branchName;
    private String     prUrl;
    private String     worktreePath;
    private boolean    ejected;
    private String     parentTaskId;
    private Instant    createdAt;
    private Instant    updatedAt;

    public Task() {}

    public Task(String id, String projectId, String title) {
        this.id        = id;
        this.projectId = projectId;
        this.title     = title;
    }

    /** Text handed to prompts as {{task_description}}. */
    public String promptDescription() {
        if (description == null || description.isBlank()) return title;
        return title + "\n\n" + description;
    }

    public String     getId()             { return id; }
    public String     getProjectId()      { return projectId; }
    public String     getTitle()          { return title; }
    public String     getDescription()    { return description; }
    public String     getCurrentStageId() { return currentStageId; }
    public TaskStatus getStatus()         { return status; }
    public boolean    isArchived()        { return archived; }
    public String     getBranchName()     { return branchName; }
    public String     getPrUrl()          { return prUrl; }
    public String     getWorktreePath()   { return worktreePath; }
    public boolean    isEjected()         { return ejected; }
    public String     getParentTaskId()   { return parentTaskId; }
    public Instant    getCreatedAt()      { return createdAt; }
    public Instant    getUpdatedAt()      { return updatedAt; }

    public void setId(String id)                         { this.id = id; }
    public void setProjectId(String projectId)           { this.projectId = projectId; }
    public void setTitle(String title)                   { this.title = title; }
    public void setDescription(String description)       { this.description = description; }
    public void setCurrentStageId(String currentStageId) { this.currentStageId = currentStageId; }
    public void setStatus(TaskStatus status)             { this.status = status; }
    public void setArchived(boolean archived)            { this.archived = archived; }
    public void setBranchName(String branchName)         { this.branchName = branchName; }
    public void setPrUrl(String prUrl)                   { this.prUrl = prUrl; }
    public void setWorktreePath(String worktreePath)     { this.worktreePath = worktreePath; }
    public void setEjected(boolean ejected)              { this.ejected = ejected; }
    public void setParentTaskId(String parentTaskId)     { this.parentTaskId = parentTaskId; }
    public void setCreatedAt(Instant t)                  { this.createdAt = t; }
    public void setUpdatedAt(Instant t)                  { this.updatedAt = t; }
}
