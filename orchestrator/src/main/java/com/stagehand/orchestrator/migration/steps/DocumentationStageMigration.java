package com.stagehand.orchestrator.migration.steps;

import com.stagehand.orchestrator.migration.Migration;
import com.stagehand.orchestrator.migration.MigrationPrompts;
import com.stagehand.orchestrator.store.Timestamps;
import org.springframework.jdbc.core.JdbcOperations;

import java.util.Map;

/**
 * v11: insert Documentation at position 6 in every project, shifting PR
 * Preparation and everything after it down by one.
 */
public class DocumentationStageMigration implements Migration {

    static final String DESCRIPTION =
            "Write or update documentation based on the changes made in this task.";

    @Override public int    version() { return 11; }
    @Override public String name()    { return "documentation_stage"; }

    @Override
    public void apply(JdbcOperations db) {
        if (TemplateRows.exists(db, "SELECT COUNT(*) FROM stage_templates WHERE name = 'Documentation'")) {
            return;
        }
        String now = Timestamps.now();
        db.update("UPDATE stage_templates SET sort_order = sort_order + 1, updated_at = ? WHERE sort_order >= 6", now);

        for (Map<String, Object> row : TemplateRows.select(db,
                "SELECT DISTINCT project_id FROM stage_templates")) {
            TemplateRows.insert(db, TemplateRows.str(row, "project_id"), "Documentation", DESCRIPTION,
                    6, MigrationPrompts.DOCUMENTATION, "both", "text");
        }

        db.update("UPDATE stage_templates SET commits_changes = 1, commit_prefix = 'docs', updated_at = ? "
                + "WHERE name = 'Documentation'", now);
    }
}
