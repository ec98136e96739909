package com.stagehand.orchestrator.repository;

import com.stagehand.orchestrator.model.Task;
import com.stagehand.orchestrator.model.TaskStatus;
import com.stagehand.orchestrator.store.StoreRegistry;
import com.stagehand.orchestrator.store.Timestamps;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class TaskRepository {

    private static final RowMapper<Task> ROW = (rs, i) -> {
        Task t = new Task(rs.getString("id"), rs.getString("project_id"), rs.getString("title"));
        t.setDescription(rs.getString("description"));
        t.setCurrentStageId(rs.getString("current_stage_id"));
        t.setStatus(TaskStatus.fromDb(rs.getString("status")));
        t.setArchived(rs.getInt("archived") != 0);
        t.setBranchName(rs.getString("branch_name"));
        t.setPrUrl(rs.getString("pr_url"));
        t.setWorktreePath(rs.getString("worktree_path"));
        t.setEjected(rs.getInt("ejected") != 0);
        t.setParentTaskId(rs.getString("parent_task_id"));
        t.setCreatedAt(Timestamps.parse(rs.getString("created_at")));
        t.setUpdatedAt(Timestamps.parse(rs.getString("updated_at")));
        return t;
    };

    private final StoreRegistry stores;

    public TaskRepository(StoreRegistry stores) {
        this.stores = stores;
    }

    public void insert(Task t) {
        String now = Timestamps.now();
        stores.project(t.getProjectId()).run(db -> db.update("""
                INSERT INTO tasks (id, project_id, title, description, current_stage_id, status, archived,
                  branch_name, pr_url, worktree_path, ejected, parent_task_id, created_at, updated_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)""",
                t.getId(), t.getProjectId(), t.getTitle(), t.getDescription(), t.getCurrentStageId(),
                t.getStatus().dbValue(), t.isArchived() ? 1 : 0, t.getBranchName(), t.getPrUrl(),
                t.getWorktreePath(), t.isEjected() ? 1 : 0, t.getParentTaskId(), now, now));
        t.setCreatedAt(Timestamps.parse(now));
        t.setUpdatedAt(Timestamps.parse(now));
    }

    public void update(Task t) {
        String now = Timestamps.now();
        stores.project(t.getProjectId()).run(db -> db.update("""
                UPDATE tasks SET title = ?, description = ?, current_stage_id = ?, status = ?, archived = ?,
                  branch_name = ?, pr_url = ?, worktree_path = ?, ejected = ?, parent_task_id = ?, updated_at = ?
                WHERE id = ?""",
                t.getTitle(), t.getDescription(), t.getCurrentStageId(), t.getStatus().dbValue(),
                t.isArchived() ? 1 : 0, t.getBranchName(), t.getPrUrl(), t.getWorktreePath(),
                t.isEjected() ? 1 : 0, t.getParentTaskId(), now, t.getId()));
        t.setUpdatedAt(Timestamps.parse(now));
    }

    public Optional<Task> findById(String projectId, String taskId) {
        return stores.project(projectId).call(db -> db.query("SELECT * FROM tasks WHERE id = ?", ROW, taskId))
                .stream().findFirst();
    }

    /** Newest first. */
    public List<Task> findAll(String projectId, boolean includeArchived) {
        String sql = includeArchived
                ? "SELECT * FROM tasks WHERE project_id = ? ORDER BY created_at DESC"
                : "SELECT * FROM tasks WHERE project_id = ? AND archived = 0 ORDER BY created_at DESC";
        return stores.project(projectId).call(db -> db.query(sql, ROW, projectId));
    }

    public List<Task> findChildren(String projectId, String parentTaskId) {
        return stores.project(projectId).call(db -> db.query(
                "SELECT * FROM tasks WHERE parent_task_id = ? ORDER BY created_at", ROW, parentTaskId));
    }
}
