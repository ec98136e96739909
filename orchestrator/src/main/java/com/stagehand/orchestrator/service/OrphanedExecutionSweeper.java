package com.stagehand.orchestrator.service;

import com.stagehand.orchestrator.migration.MigrationException;
import com.stagehand.orchestrator.model.Project;
import com.stagehand.orchestrator.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * On startup, fails executions that were still running when the previous
 * process stopped. Their agent processes died with it.
 */
@Component
public class OrphanedExecutionSweeper {

    private static final Logger log = LoggerFactory.getLogger(OrphanedExecutionSweeper.class);

    private final ProjectService        projects;
    private final StageExecutionService stages;

    public OrphanedExecutionSweeper(ProjectService projects, StageExecutionService stages) {
        this.projects = projects;
        this.stages   = stages;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void sweep() {
        for (Project project : projects.listProjects(false)) {
            try {
                int failed = stages.failOrphanedExecutions(project.getId());
                if (failed > 0) {
                    log.warn("Failed {} orphaned execution(s) in project {}", failed, project.getId());
                }
            } catch (StoreException | MigrationException e) {
                log.warn("Could not sweep project {}: {}", project.getId(), e.getMessage());
            }
        }
    }
}
