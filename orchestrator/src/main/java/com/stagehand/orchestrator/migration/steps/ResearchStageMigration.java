package com.stagehand.orchestrator.migration.steps;

import com.stagehand.orchestrator.migration.Migration;
import com.stagehand.orchestrator.store.Timestamps;
import com.stagehand.orchestrator.template.OutputSchemas;
import com.stagehand.orchestrator.template.StagePrompts;
import org.springframework.jdbc.core.JdbcOperations;

import java.util.Map;

/** v3: Research moves from free text to the research format with questions. */
public class ResearchStageMigration implements Migration {

    @Override public int    version() { return 3; }
    @Override public String name()    { return "research_stage"; }

    @Override
    public void apply(JdbcOperations db) {
        for (Map<String, Object> row : TemplateRows.select(db,
                "SELECT id FROM stage_templates WHERE name = 'Research' AND output_format = 'text' AND sort_order = 0")) {
            db.update("UPDATE stage_templates SET output_format = 'research', output_schema = ?, "
                            + "prompt_template = ?, updated_at = ? WHERE id = ?",
                    OutputSchemas.RESEARCH, StagePrompts.RESEARCH, Timestamps.now(), TemplateRows.str(row, "id"));
        }

        // Research schemas written before questions carried selectable options.
        for (Map<String, Object> row : TemplateRows.select(db,
                "SELECT id, output_schema FROM stage_templates "
                        + "WHERE name = 'Research' AND output_format = 'research' AND sort_order = 0")) {
            String schema = TemplateRows.str(row, "output_schema");
            if (schema != null && !schema.contains("\"options\"")) {
                db.update("UPDATE stage_templates SET output_schema = ?, prompt_template = ?, updated_at = ? WHERE id = ?",
                        OutputSchemas.RESEARCH, StagePrompts.RESEARCH, Timestamps.now(), TemplateRows.str(row, "id"));
            }
        }
    }
}
