package com.stagehand.orchestrator.migration.steps;

import com.stagehand.orchestrator.migration.Migration;
import com.stagehand.orchestrator.migration.MigrationPrompts;
import com.stagehand.orchestrator.store.Timestamps;
import org.springframework.jdbc.core.JdbcOperations;

import java.util.Map;

/**
 * v7: PR Preparation reads per-stage summaries instead of only the previous
 * stage's output. Prompts that already use summaries or the stage-output
 * tool are newer than this change and are left alone.
 */
public class PrPrepSummariesMigration implements Migration {

    @Override public int    version() { return 7; }
    @Override public String name()    { return "pr_prep_summaries"; }

    @Override
    public void apply(JdbcOperations db) {
        for (Map<String, Object> row : TemplateRows.select(db,
                "SELECT id, prompt_template FROM stage_templates WHERE name = 'PR Preparation' AND sort_order = 6")) {
            String prompt = TemplateRows.str(row, "prompt_template");
            if (prompt != null
                    && (prompt.contains("{{stage_summaries}}") || prompt.contains("get_stage_output"))) {
                continue;
            }
            db.update("UPDATE stage_templates SET prompt_template = ?, updated_at = ? WHERE id = ?",
                    MigrationPrompts.PR_PREP_SUMMARIES, Timestamps.now(), TemplateRows.str(row, "id"));
        }
    }
}
