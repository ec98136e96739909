package com.stagehand.orchestrator.store;

import com.stagehand.orchestrator.config.RetryPolicies;
import com.stagehand.orchestrator.config.StagehandProperties;
import com.stagehand.orchestrator.config.StagehandProperties.RetrySettings;
import com.stagehand.orchestrator.migration.MigrationRunner;
import com.stagehand.orchestrator.schema.SchemaInitializer;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.github.resilience4j.retry.Retry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Owns every open database handle: the app-wide store and one store per
 * project, each opened at most once per process.
 *
 * Opening a project store initializes its schema and runs pending migrations
 * on the store's own queue before the handle is handed out. If that fails,
 * nothing is cached, so the next caller retries the open from scratch.
 */
@Component
public class StoreRegistry {

    private static final Logger log = LoggerFactory.getLogger(StoreRegistry.class);

    private static final String  APP_KEY    = "app";
    private static final Pattern PROJECT_ID = Pattern.compile("[A-Za-z0-9-]+");

    private final Path                      dataDir;
    private final RetrySettings             busySettings;
    private final SchemaInitializer         schema;
    private final MigrationRunner           migrations;
    private final Counter                   busyRetries;
    private final Map<String, ProjectStore> stores = new ConcurrentHashMap<>();

    public StoreRegistry(StagehandProperties props,
                         SchemaInitializer schema,
                         MigrationRunner migrations,
                         MeterRegistry meters) {
        this.dataDir      = props.dataDir();
        this.busySettings = props.store().busyRetry();
        this.schema       = schema;
        this.migrations   = migrations;
        this.busyRetries  = Counter.builder("stagehand.store.busy.retries")
                .description("Store operations retried after SQLITE_BUSY/LOCKED")
                .register(meters);
    }

    /** The app-wide database (projects and global settings). */
    public ProjectStore app() {
        return stores.computeIfAbsent(APP_KEY, k -> open(k, dataDir.resolve("app.db"), true));
    }

    /** The project's own database, opened and migrated on first use. */
    public ProjectStore project(String projectId) {
        requireValidId(projectId);
        return stores.computeIfAbsent("project:" + projectId,
                k -> open(projectId, dataDir.resolve("data").resolve(projectId + ".db"), false));
    }

    public boolean isOpen(String projectId) {
        return stores.containsKey("project:" + projectId);
    }

    private ProjectStore open(String name, Path file, boolean appStore) {
        try {
            Files.createDirectories(file.getParent());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create data directory " + file.getParent(), e);
        }

        Retry retry = RetryPolicies.exponential("store-" + name, busySettings, StoreException::isBusyError);
        retry.getEventPublisher().onRetry(ev -> {
            busyRetries.increment();
            log.warn("Store '{}' busy, retry #{} in {}", name,
                    ev.getNumberOfRetryAttempts(), ev.getWaitInterval());
        });

        ProjectStore store = new ProjectStore(name, file, retry);
        try {
            store.run(db -> {
                db.execute("PRAGMA foreign_keys = ON");
                db.execute("PRAGMA busy_timeout = 5000");
                if (appStore) {
                    schema.initAppSchema(db);
                } else {
                    schema.initProjectSchema(db);
                    migrations.runPendingMigrations(db);
                }
            });
        } catch (RuntimeException e) {
            log.error("Failed to open store '{}' at {}: {}", name, file, e.getMessage());
            store.close();
            throw e;
        }
        log.info("Opened store '{}' at {}", name, file);
        return store;
    }

    public static void requireValidId(String projectId) {
        if (projectId == null || !PROJECT_ID.matcher(projectId).matches()) {
            throw new IllegalArgumentException("Invalid project id: " + projectId);
        }
    }

    @PreDestroy
    public void closeAll() {
        stores.values().forEach(ProjectStore::close);
        stores.clear();
    }
}
