package com.stagehand.orchestrator.migration.steps;

import com.stagehand.orchestrator.migration.Migration;
import com.stagehand.orchestrator.store.Timestamps;
import com.stagehand.orchestrator.template.OutputSchemas;
import com.stagehand.orchestrator.template.StagePrompts;
import org.springframework.jdbc.core.JdbcOperations;

import java.util.Map;

/** v5: Research also suggests which downstream stages the task needs. */
public class ResearchStageSuggestionsMigration implements Migration {

    @Override public int    version() { return 5; }
    @Override public String name()    { return "research_stage_suggestions"; }

    @Override
    public void apply(JdbcOperations db) {
        for (Map<String, Object> row : TemplateRows.select(db,
                "SELECT id, output_schema FROM stage_templates "
                        + "WHERE name = 'Research' AND output_format = 'research' AND sort_order = 0")) {
            String schema = TemplateRows.str(row, "output_schema");
            if (schema != null && !schema.contains("\"suggested_stages\"")) {
                db.update("UPDATE stage_templates SET output_schema = ?, prompt_template = ?, updated_at = ? WHERE id = ?",
                        OutputSchemas.RESEARCH, StagePrompts.RESEARCH, Timestamps.now(), TemplateRows.str(row, "id"));
            }
        }
    }
}
