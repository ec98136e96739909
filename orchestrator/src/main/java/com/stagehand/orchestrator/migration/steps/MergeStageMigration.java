package com.stagehand.orchestrator.migration.steps;

import com.stagehand.orchestrator.migration.Migration;
import org.springframework.jdbc.core.JdbcOperations;

import java.util.Map;

/** v9: append a Merge stage after the last stage of every project. */
public class MergeStageMigration implements Migration {

    static final String DESCRIPTION = "Merge the task branch into the target branch and push.";

    @Override public int    version() { return 9; }
    @Override public String name()    { return "merge_stage"; }

    @Override
    public void apply(JdbcOperations db) {
        if (TemplateRows.exists(db, "SELECT COUNT(*) FROM stage_templates WHERE name = 'Merge'")) {
            return;
        }
        for (Map<String, Object> row : TemplateRows.select(db,
                "SELECT project_id, MAX(sort_order) AS max_order FROM stage_templates GROUP BY project_id")) {
            int maxOrder = ((Number) row.get("max_order")).intValue();
            TemplateRows.insert(db, TemplateRows.str(row, "project_id"), "Merge", DESCRIPTION,
                    maxOrder + 1, "", "previous_stage", "merge");
        }
    }
}
