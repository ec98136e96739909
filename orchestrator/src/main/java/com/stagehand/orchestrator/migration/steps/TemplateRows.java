package com.stagehand.orchestrator.migration.steps;

import com.stagehand.orchestrator.store.Timestamps;
import org.springframework.jdbc.core.JdbcOperations;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/** Small SQL helpers shared by the migration steps. */
final class TemplateRows {

    static final String APPROVAL_GATE = "{\"type\":\"require_approval\"}";

    private TemplateRows() {}

    /** Inserts a stage template with no persona, schema or tool restrictions. */
    static void insert(JdbcOperations db, String projectId, String name, String description,
                       int sortOrder, String prompt, String inputSource, String outputFormat) {
        String now = Timestamps.now();
        db.update("""
                INSERT INTO stage_templates (id, project_id, name, description, sort_order,
                  prompt_template, input_source, output_format, output_schema, gate_rules,
                  persona_name, persona_system_prompt, persona_model, preparation_prompt,
                  allowed_tools, result_mode, created_at, updated_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, NULL, ?, NULL, NULL, NULL, NULL, NULL, 'replace', ?, ?)""",
                UUID.randomUUID().toString(), projectId, name, description, sortOrder,
                prompt, inputSource, outputFormat, APPROVAL_GATE, now, now);
    }

    static List<Map<String, Object>> select(JdbcOperations db, String sql, Object... args) {
        return db.queryForList(sql, args);
    }

    static String str(Map<String, Object> row, String column) {
        Object v = row.get(column);
        return v == null ? null : v.toString();
    }

    static boolean exists(JdbcOperations db, String sql, Object... args) {
        Integer count = db.queryForObject(sql, Integer.class, args);
        return count != null && count > 0;
    }
}
