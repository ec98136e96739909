package com.stagehand.orchestrator.repository;

import com.stagehand.orchestrator.model.Project;
import com.stagehand.orchestrator.store.StoreRegistry;
import com.stagehand.orchestrator.store.Timestamps;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/** Projects live in the app-wide database. */
@Repository
public class ProjectRepository {

    private static final RowMapper<Project> ROW = (rs, i) -> new Project(
            rs.getString("id"),
            rs.getString("name"),
            rs.getString("path"),
            rs.getInt("archived") != 0,
            Timestamps.parse(rs.getString("created_at")),
            Timestamps.parse(rs.getString("updated_at")));

    private final StoreRegistry stores;

    public ProjectRepository(StoreRegistry stores) {
        this.stores = stores;
    }

    public void insert(Project p) {
        stores.app().run(db -> db.update(
                "INSERT INTO projects (id, name, path, archived, created_at, updated_at) VALUES (?, ?, ?, ?, ?, ?)",
                p.getId(), p.getName(), p.getPath(), p.isArchived() ? 1 : 0,
                Timestamps.format(p.getCreatedAt()), Timestamps.format(p.getUpdatedAt())));
    }

    public Optional<Project> findById(String id) {
        return stores.app().call(db -> db.query("SELECT * FROM projects WHERE id = ?", ROW, id))
                .stream().findFirst();
    }

    public List<Project> findAll(boolean includeArchived) {
        String sql = includeArchived
                ? "SELECT * FROM projects ORDER BY created_at"
                : "SELECT * FROM projects WHERE archived = 0 ORDER BY created_at";
        return stores.app().call(db -> db.query(sql, ROW));
    }

    public void setArchived(String id, boolean archived) {
        stores.app().run(db -> db.update("UPDATE projects SET archived = ?, updated_at = ? WHERE id = ?",
                archived ? 1 : 0, Timestamps.now(), id));
    }
}
