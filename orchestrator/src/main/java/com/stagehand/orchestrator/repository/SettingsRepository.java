package com.stagehand.orchestrator.repository;

import com.stagehand.orchestrator.store.ProjectStore;
import com.stagehand.orchestrator.store.StoreRegistry;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Key/value settings. App settings live in app.db; project settings (such as
 * the issue tracker API key) live in the project's own database.
 */
@Repository
public class SettingsRepository {

    private final StoreRegistry stores;

    public SettingsRepository(StoreRegistry stores) {
        this.stores = stores;
    }

    public Optional<String> getAppSetting(String key) {
        return get(stores.app(), key);
    }

    public void putAppSetting(String key, String value) {
        put(stores.app(), key, value);
    }

    public Optional<String> getProjectSetting(String projectId, String key) {
        return get(stores.project(projectId), key);
    }

    public void putProjectSetting(String projectId, String key, String value) {
        put(stores.project(projectId), key, value);
    }

    private static Optional<String> get(ProjectStore store, String key) {
        return store.call(db -> db.queryForList("SELECT value FROM settings WHERE key = ?", String.class, key))
                .stream().findFirst();
    }

    private static void put(ProjectStore store, String key, String value) {
        store.run(db -> {
            if (value == null) {
                db.update("DELETE FROM settings WHERE key = ?", key);
            } else {
                db.update("INSERT INTO settings (key, value) VALUES (?, ?) "
                        + "ON CONFLICT(key) DO UPDATE SET value = excluded.value", key, value);
            }
        });
    }
}
