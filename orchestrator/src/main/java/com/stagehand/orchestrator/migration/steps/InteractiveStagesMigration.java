package com.stagehand.orchestrator.migration.steps;

import com.stagehand.orchestrator.migration.Migration;
import com.stagehand.orchestrator.migration.MigrationPrompts;
import com.stagehand.orchestrator.store.Timestamps;
import com.stagehand.orchestrator.template.OutputSchemas;
import com.stagehand.orchestrator.template.StagePrompts;
import org.springframework.jdbc.core.JdbcOperations;

import java.util.Map;

/**
 * v6: Research becomes investigation only; High-Level Approaches and Planning
 * may ask the developer clarifying questions before answering.
 */
public class InteractiveStagesMigration implements Migration {

    static final String RESEARCH_ONLY_MARKER = "Your ONLY job is to investigate";

    @Override public int    version() { return 6; }
    @Override public String name()    { return "interactive_stages"; }

    @Override
    public void apply(JdbcOperations db) {
        String now = Timestamps.now();

        for (Map<String, Object> row : TemplateRows.select(db,
                "SELECT id, prompt_template FROM stage_templates "
                        + "WHERE name = 'Research' AND output_format = 'research' AND sort_order = 0")) {
            String prompt = TemplateRows.str(row, "prompt_template");
            if (prompt == null || !prompt.contains(RESEARCH_ONLY_MARKER)) {
                db.update("UPDATE stage_templates SET prompt_template = ?, updated_at = ? WHERE id = ?",
                        StagePrompts.RESEARCH, now, TemplateRows.str(row, "id"));
            }
        }

        for (Map<String, Object> row : TemplateRows.select(db,
                "SELECT id, output_schema FROM stage_templates "
                        + "WHERE name = 'High-Level Approaches' AND output_format = 'options' AND sort_order = 1")) {
            if (!hasQuestions(TemplateRows.str(row, "output_schema"))) {
                db.update("UPDATE stage_templates SET prompt_template = ?, output_schema = ?, updated_at = ? WHERE id = ?",
                        MigrationPrompts.APPROACHES, OutputSchemas.APPROACHES, now, TemplateRows.str(row, "id"));
            }
        }

        for (Map<String, Object> row : TemplateRows.select(db,
                "SELECT id FROM stage_templates WHERE name = 'Planning' AND output_format = 'text' AND sort_order = 2")) {
            db.update("UPDATE stage_templates SET output_format = 'plan', output_schema = ?, prompt_template = ?, "
                            + "updated_at = ? WHERE id = ?",
                    OutputSchemas.PLANNING, MigrationPrompts.PLANNING, now, TemplateRows.str(row, "id"));
        }

        for (Map<String, Object> row : TemplateRows.select(db,
                "SELECT id, output_schema FROM stage_templates "
                        + "WHERE name = 'Planning' AND output_format = 'plan' AND sort_order = 2")) {
            if (!hasQuestions(TemplateRows.str(row, "output_schema"))) {
                db.update("UPDATE stage_templates SET output_schema = ?, prompt_template = ?, updated_at = ? WHERE id = ?",
                        OutputSchemas.PLANNING, MigrationPrompts.PLANNING, now, TemplateRows.str(row, "id"));
            }
        }
    }

    private static boolean hasQuestions(String schema) {
        return schema != null && schema.contains("\"questions\"");
    }
}
