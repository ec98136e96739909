package com.stagehand.orchestrator.migration.steps;

import com.stagehand.orchestrator.migration.Migration;
import com.stagehand.orchestrator.migration.MigrationPrompts;
import com.stagehand.orchestrator.store.Timestamps;
import com.stagehand.orchestrator.template.OutputSchemas;
import org.springframework.jdbc.core.JdbcOperations;

import java.util.Map;

/**
 * v4: Refinement and Security Review stop editing code directly. They report
 * findings, the user selects which to fix, and a second attempt applies them.
 */
public class FindingsStagesMigration implements Migration {

    static final String REFINEMENT_DESCRIPTION =
            "Self-review the implementation: identify issues for the developer to select, then apply chosen fixes.";
    static final String SECURITY_DESCRIPTION =
            "Analyze for security vulnerabilities, then apply selected fixes.";

    @Override public int    version() { return 4; }
    @Override public String name()    { return "findings_stages"; }

    @Override
    public void apply(JdbcOperations db) {
        for (Map<String, Object> row : TemplateRows.select(db,
                "SELECT id, output_format FROM stage_templates WHERE name = 'Refinement' AND sort_order = 4")) {
            if ("findings".equals(TemplateRows.str(row, "output_format"))) continue;
            db.update("""
                    UPDATE stage_templates SET
                      output_format = 'findings', output_schema = ?, prompt_template = ?,
                      gate_rules = ?, allowed_tools = NULL, result_mode = 'append',
                      description = ?, input_source = 'previous_stage', updated_at = ?
                    WHERE id = ?""",
                    OutputSchemas.FINDINGS, MigrationPrompts.REFINEMENT_FINDINGS, TemplateRows.APPROVAL_GATE,
                    REFINEMENT_DESCRIPTION, Timestamps.now(), TemplateRows.str(row, "id"));
        }

        for (Map<String, Object> row : TemplateRows.select(db,
                "SELECT id, output_format FROM stage_templates WHERE name = 'Security Review' AND sort_order = 5")) {
            if ("findings".equals(TemplateRows.str(row, "output_format"))) continue;
            db.update("""
                    UPDATE stage_templates SET
                      output_format = 'findings', output_schema = ?, prompt_template = ?,
                      gate_rules = ?, allowed_tools = NULL, result_mode = 'append',
                      description = ?, updated_at = ?
                    WHERE id = ?""",
                    OutputSchemas.FINDINGS, MigrationPrompts.SECURITY_FINDINGS, TemplateRows.APPROVAL_GATE,
                    SECURITY_DESCRIPTION, Timestamps.now(), TemplateRows.str(row, "id"));
        }
    }
}
