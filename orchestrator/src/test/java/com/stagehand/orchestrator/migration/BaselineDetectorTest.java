package com.stagehand.orchestrator.migration;

import com.stagehand.orchestrator.schema.SchemaInitializer;
import com.stagehand.orchestrator.store.ProjectStore;
import com.stagehand.orchestrator.store.TestStores;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class BaselineDetectorTest {

    @TempDir
    Path dir;

    private ProjectStore store;
    private final BaselineDetector detector = new BaselineDetector();

    @BeforeEach
    void setUp() {
        store = TestStores.rawStore(dir.resolve("p.db"));
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    private void template(String name, String format, String prompt) {
        store.run(db -> db.update("""
                INSERT INTO stage_templates (id, project_id, name, output_format, prompt_template)
                VALUES (?, 'p1', ?, ?, ?)""", name, name, format, prompt));
    }

    @Test
    void missingTables_detectsNothing() {
        assertThat(store.call(detector::detect)).isZero();
    }

    @Test
    void emptyTemplates_detectsNothing() {
        store.run(db -> new SchemaInitializer().initProjectSchema(db));
        assertThat(store.call(detector::detect)).isZero();
    }

    @Test
    void newestMarkerWins() {
        store.run(db -> new SchemaInitializer().initProjectSchema(db));
        template("Planning", "plan", "");
        template("PR Review", "pr_review", "");

        assertThat(store.call(detector::detect)).isEqualTo(8);
    }

    @Test
    void refinementFindings_impliesVersionFive() {
        store.run(db -> new SchemaInitializer().initProjectSchema(db));
        template("Refinement", "findings", "");

        assertThat(store.call(detector::detect)).isEqualTo(5);
    }

    @Test
    void prPrepPromptWithSummaries_impliesVersionSeven() {
        store.run(db -> new SchemaInitializer().initProjectSchema(db));
        template("PR Preparation", "structured", "Summaries: {{stage_summaries}}");

        assertThat(store.call(detector::detect)).isEqualTo(7);
    }

    @Test
    void behaviorFlagsOnly_impliesVersionOne() {
        store.run(db -> new SchemaInitializer().initProjectSchema(db));
        template("Implementation", "text", "");
        store.run(db -> db.update("UPDATE stage_templates SET commits_changes = 1"));

        assertThat(store.call(detector::detect)).isEqualTo(1);
    }

    @Test
    void documentationStage_realCatalogRecordsEverythingWithoutRunningBodies() {
        store.run(db -> new SchemaInitializer().initProjectSchema(db));
        template("Planning", "plan", "");
        template("Documentation", "text", "Document the change.");
        template("PR Preparation", "structured", "Write a PR for {{previous_output}}");
        MigrationRunner runner = new MigrationRunner(new SimpleMeterRegistry());

        assertThat(store.call(detector::detect)).isEqualTo(11);
        assertThat(store.call(runner::runPendingMigrations)).isZero();
        assertThat(store.call(runner::appliedMigrations)).hasSize(MigrationCatalog.all().size());
        // v9 appends Merge unconditionally when its body runs.
        assertThat(store.<Integer>call(db -> db.queryForObject(
                "SELECT COUNT(*) FROM stage_templates WHERE name = 'Merge'", Integer.class))).isZero();
    }
}
