package com.stagehand.orchestrator.service;

import com.stagehand.orchestrator.model.Project;
import com.stagehand.orchestrator.repository.ProjectRepository;
import com.stagehand.orchestrator.repository.SettingsRepository;
import com.stagehand.orchestrator.repository.StageTemplateRepository;
import com.stagehand.orchestrator.store.StoreRegistry;
import com.stagehand.orchestrator.template.DefaultPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Project lifecycle and settings.
 *
 * Creating a project writes its row to the app store, opens the project's own
 * store (which builds the schema and runs migrations), then seeds the default
 * pipeline if the project has no templates yet.
 */
@Service
public class ProjectService {

    private static final Logger log = LoggerFactory.getLogger(ProjectService.class);

    private final ProjectRepository       projects;
    private final SettingsRepository      settings;
    private final StageTemplateRepository templates;
    private final StoreRegistry           stores;

    public ProjectService(ProjectRepository projects,
                          SettingsRepository settings,
                          StageTemplateRepository templates,
                          StoreRegistry stores) {
        this.projects  = projects;
        this.settings  = settings;
        this.templates = templates;
        this.stores    = stores;
    }

    public Project createProject(String name, String path) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Project name is required");
        }
        if (path == null || !Files.isDirectory(Path.of(path))) {
            throw new IllegalArgumentException("Project path is not a directory: " + path);
        }
        Instant now = Instant.now();
        Project project = new Project(UUID.randomUUID().toString(), name.trim(), path, false, now, now);
        projects.insert(project);

        stores.project(project.getId());
        if (templates.findAll(project.getId()).isEmpty()) {
            templates.insertAll(project.getId(), DefaultPipeline.templates(project.getId()));
        }
        log.info("Created project {} ({}) at {}", project.getId(), project.getName(), path);
        return project;
    }

    public List<Project> listProjects(boolean includeArchived) {
        return projects.findAll(includeArchived);
    }

    /** @throws NotFoundException if no such project exists */
    public Project requireProject(String projectId) {
        StoreRegistry.requireValidId(projectId);
        return projects.findById(projectId)
                .orElseThrow(() -> new NotFoundException("Project", projectId));
    }

    public Project archiveProject(String projectId) {
        return setArchived(projectId, true);
    }

    public Project unarchiveProject(String projectId) {
        return setArchived(projectId, false);
    }

    private Project setArchived(String projectId, boolean archived) {
        Project project = requireProject(projectId);
        projects.setArchived(projectId, archived);
        project.setArchived(archived);
        project.setUpdatedAt(Instant.now());
        log.info("Project {} {}", projectId, archived ? "archived" : "restored");
        return project;
    }

    // ------------------------------------------------------------------
    // Settings
    // ------------------------------------------------------------------

    public Optional<String> getAppSetting(String key) {
        return settings.getAppSetting(key);
    }

    public void putAppSetting(String key, String value) {
        settings.putAppSetting(key, value);
    }

    public Optional<String> getProjectSetting(String projectId, String key) {
        requireProject(projectId);
        return settings.getProjectSetting(projectId, key);
    }

    /** A null value removes the setting. */
    public void putProjectSetting(String projectId, String key, String value) {
        requireProject(projectId);
        settings.putProjectSetting(projectId, key, value);
    }
}
