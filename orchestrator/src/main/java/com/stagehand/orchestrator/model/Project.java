package com.stagehand.orchestrator.model;

import java.time.Instant;

/**
 * A registered working copy. Lives in the app-wide database; its stage
 * templates, tasks and executions live in the project's own database file.
 */
public class Project {

    private String  id;
    private String  name;
    private String  path;
    private boolean archived;
    private Instant createdAt;
    private Instant updatedAt;

    public Project(String id, String name, String path, boolean archived, Instant createdAt, Instant updatedAt) {
        this.id        = id;
        this.name      = name;
        this.path      = path;
        this.archived  = archived;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    public String  getId()        { return id; }
    public String  getName()      { return name; }
    public String  getPath()      { return path; }
    public boolean isArchived()   { return archived; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }

    public void setArchived(boolean archived) { this.archived = archived; }
    public void setUpdatedAt(Instant t)       { this.updatedAt = t; }
}
