package com.stagehand.orchestrator.migration.steps;

import com.stagehand.orchestrator.migration.Migration;
import org.springframework.jdbc.core.JdbcOperations;

/** v10: PR-creating stages get their own output format instead of generic structured. */
public class PrPreparationFormatMigration implements Migration {

    @Override public int    version() { return 10; }
    @Override public String name()    { return "pr_preparation_format"; }

    @Override
    public void apply(JdbcOperations db) {
        db.update("UPDATE stage_templates SET output_format = 'pr_preparation' "
                + "WHERE output_format = 'structured' AND creates_pr = 1");
    }
}
