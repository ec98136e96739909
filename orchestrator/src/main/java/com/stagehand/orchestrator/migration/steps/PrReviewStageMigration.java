package com.stagehand.orchestrator.migration.steps;

import com.stagehand.orchestrator.migration.Migration;
import org.springframework.jdbc.core.JdbcOperations;

import java.util.Map;

/** v8: add PR Review after PR Preparation in every project that has one at position 6. */
public class PrReviewStageMigration implements Migration {

    static final String DESCRIPTION =
            "Fetch PR reviews from GitHub, fix reviewer comments, and complete the task.";

    @Override public int    version() { return 8; }
    @Override public String name()    { return "pr_review_stage"; }

    @Override
    public void apply(JdbcOperations db) {
        if (TemplateRows.exists(db,
                "SELECT COUNT(*) FROM stage_templates WHERE name = 'PR Review' AND sort_order = 7")) {
            return;
        }
        for (Map<String, Object> row : TemplateRows.select(db,
                "SELECT project_id FROM stage_templates WHERE name = 'PR Preparation' AND sort_order = 6")) {
            TemplateRows.insert(db, TemplateRows.str(row, "project_id"), "PR Review", DESCRIPTION,
                    7, "", "previous_stage", "pr_review");
        }
    }
}
