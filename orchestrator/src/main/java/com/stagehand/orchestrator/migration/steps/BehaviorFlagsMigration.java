package com.stagehand.orchestrator.migration.steps;

import com.stagehand.orchestrator.migration.Migration;
import com.stagehand.orchestrator.store.Timestamps;
import org.springframework.jdbc.core.JdbcOperations;

/**
 * v1: behavior flags moved from hard-coded stage names into columns. Sets them
 * on the default stages, matched by name and position.
 */
public class BehaviorFlagsMigration implements Migration {

    @Override public int    version() { return 1; }
    @Override public String name()    { return "behavior_flags"; }

    @Override
    public void apply(JdbcOperations db) {
        if (TemplateRows.exists(db, """
                SELECT COUNT(*) FROM stage_templates
                WHERE commits_changes = 1 OR creates_pr = 1 OR is_terminal = 1 OR triggers_stage_selection = 1""")) {
            return;
        }
        String now = Timestamps.now();
        db.update("UPDATE stage_templates SET commits_changes = 1, commit_prefix = 'feat', updated_at = ? "
                + "WHERE name = 'Implementation' AND sort_order = 3", now);
        db.update("UPDATE stage_templates SET commits_changes = 1, commit_prefix = 'fix', updated_at = ? "
                + "WHERE name = 'Refinement' AND sort_order = 4", now);
        db.update("UPDATE stage_templates SET commits_changes = 1, commit_prefix = 'fix', updated_at = ? "
                + "WHERE name = 'Security Review' AND sort_order = 5", now);
        db.update("UPDATE stage_templates SET creates_pr = 1, updated_at = ? "
                + "WHERE name = 'PR Preparation' AND sort_order = 6", now);
        db.update("UPDATE stage_templates SET triggers_stage_selection = 1, updated_at = ? "
                + "WHERE name = 'Research' AND sort_order = 0", now);
        db.update("UPDATE stage_templates SET is_terminal = 1, updated_at = ? "
                + "WHERE name = 'PR Review' AND sort_order = 7", now);
        // Merge has no fixed position.
        db.update("UPDATE stage_templates SET is_terminal = 1, updated_at = ? WHERE name = 'Merge'", now);
    }
}
