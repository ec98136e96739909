package com.stagehand.orchestrator.repository;

import com.stagehand.orchestrator.model.StageTemplate;
import com.stagehand.orchestrator.store.StoreRegistry;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * A task's concrete stage list. No rows means the task runs every template
 * of its project.
 */
@Repository
public class TaskStageRepository {

    private final StoreRegistry stores;

    public TaskStageRepository(StoreRegistry stores) {
        this.stores = stores;
    }

    /** Selected template ids in pipeline order; empty if no selection was made. */
    public List<String> findStageIds(String projectId, String taskId) {
        return stores.project(projectId).call(db -> db.queryForList(
                "SELECT stage_template_id FROM task_stages WHERE task_id = ? ORDER BY sort_order",
                String.class, taskId));
    }

    /** Replaces the task's stage list atomically. */
    public void replace(String projectId, String taskId, List<StageTemplate> stages) {
        stores.project(projectId).inTransaction(db -> {
            db.update("DELETE FROM task_stages WHERE task_id = ?", taskId);
            for (StageTemplate s : stages) {
                db.update("INSERT INTO task_stages (id, task_id, stage_template_id, sort_order) VALUES (?, ?, ?, ?)",
                        UUID.randomUUID().toString(), taskId, s.getId(), s.getSortOrder());
            }
            return null;
        });
    }
}
