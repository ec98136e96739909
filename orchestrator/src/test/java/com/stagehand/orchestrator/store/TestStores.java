package com.stagehand.orchestrator.store;

import com.stagehand.orchestrator.config.RetryPolicies;
import com.stagehand.orchestrator.config.StagehandProperties;
import com.stagehand.orchestrator.config.StagehandProperties.RetrySettings;
import com.stagehand.orchestrator.migration.MigrationRunner;
import com.stagehand.orchestrator.schema.SchemaInitializer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.nio.file.Path;
import java.time.Duration;

/** Fixtures for tests that need real SQLite stores under a temp directory. */
public final class TestStores {

    private TestStores() {}

    public static StagehandProperties properties(Path dataDir) {
        RetrySettings fast = new RetrySettings(3, Duration.ofMillis(5), Duration.ofMillis(20));
        return new StagehandProperties(
                dataDir,
                new StagehandProperties.Store(fast),
                new StagehandProperties.Tracker("http://localhost/graphql", Duration.ofSeconds(2), fast),
                new StagehandProperties.Agent("claude", Duration.ofMinutes(1), 1),
                new StagehandProperties.Vcs("git", "gh"));
    }

    public static StoreRegistry registry(Path dataDir) {
        SimpleMeterRegistry meters = new SimpleMeterRegistry();
        return new StoreRegistry(properties(dataDir), new SchemaInitializer(), new MigrationRunner(meters), meters);
    }

    /** A bare store with no schema applied. */
    public static ProjectStore rawStore(Path file) {
        RetrySettings once = new RetrySettings(1, Duration.ofMillis(1), Duration.ofMillis(1));
        return new ProjectStore("test", file, RetryPolicies.exponential("test", once, StoreException::isBusyError));
    }
}
