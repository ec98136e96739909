package com.stagehand.orchestrator.schema;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcOperations;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Creates the app and project tables and adds columns introduced after the
 * first release.
 *
 * Everything here is idempotent: tables use IF NOT EXISTS and column
 * additions treat "duplicate column" as already applied. Versioned data
 * changes live in the migration package instead.
 */
@Component
public class SchemaInitializer {

    private static final Logger log = LoggerFactory.getLogger(SchemaInitializer.class);

    // ── App database ─────────────────────────────────────────────────────

    public void initAppSchema(JdbcOperations db) {
        db.execute("""
                CREATE TABLE IF NOT EXISTS projects (
                  id TEXT PRIMARY KEY,
                  name TEXT NOT NULL,
                  path TEXT NOT NULL,
                  created_at TEXT NOT NULL DEFAULT (datetime('now')),
                  updated_at TEXT NOT NULL DEFAULT (datetime('now'))
                )""");
        db.execute("""
                CREATE TABLE IF NOT EXISTS settings (
                  key TEXT PRIMARY KEY,
                  value TEXT NOT NULL
                )""");
        addColumn(db, "projects", "archived INTEGER NOT NULL DEFAULT 0");

        // The tracker key became a per-project setting.
        db.update("DELETE FROM settings WHERE key = ?", "linear_api_key");
    }

    // ── Project database ─────────────────────────────────────────────────

    public void initProjectSchema(JdbcOperations db) {
        db.execute("""
                CREATE TABLE IF NOT EXISTS stage_templates (
                  id TEXT PRIMARY KEY,
                  project_id TEXT NOT NULL,
                  name TEXT NOT NULL,
                  description TEXT NOT NULL DEFAULT '',
                  sort_order INTEGER NOT NULL DEFAULT 0,
                  prompt_template TEXT NOT NULL DEFAULT '',
                  input_source TEXT NOT NULL DEFAULT 'user',
                  output_format TEXT NOT NULL DEFAULT 'text',
                  output_schema TEXT,
                  gate_rules TEXT NOT NULL DEFAULT '{"type":"require_approval"}',
                  persona_name TEXT,
                  persona_system_prompt TEXT,
                  persona_model TEXT,
                  preparation_prompt TEXT,
                  allowed_tools TEXT,
                  created_at TEXT NOT NULL DEFAULT (datetime('now')),
                  updated_at TEXT NOT NULL DEFAULT (datetime('now'))
                )""");
        db.execute("""
                CREATE TABLE IF NOT EXISTS tasks (
                  id TEXT PRIMARY KEY,
                  project_id TEXT NOT NULL,
                  title TEXT NOT NULL,
                  current_stage_id TEXT,
                  status TEXT NOT NULL DEFAULT 'pending',
                  archived INTEGER NOT NULL DEFAULT 0,
                  created_at TEXT NOT NULL DEFAULT (datetime('now')),
                  updated_at TEXT NOT NULL DEFAULT (datetime('now'))
                )""");
        db.execute("""
                CREATE TABLE IF NOT EXISTS stage_executions (
                  id TEXT PRIMARY KEY,
                  task_id TEXT NOT NULL,
                  stage_template_id TEXT NOT NULL,
                  attempt_number INTEGER NOT NULL DEFAULT 1,
                  status TEXT NOT NULL DEFAULT 'pending',
                  input_prompt TEXT NOT NULL DEFAULT '',
                  user_input TEXT,
                  raw_output TEXT,
                  parsed_output TEXT,
                  user_decision TEXT,
                  session_id TEXT,
                  error_message TEXT,
                  started_at TEXT NOT NULL DEFAULT (datetime('now')),
                  completed_at TEXT,
                  FOREIGN KEY (task_id) REFERENCES tasks(id),
                  FOREIGN KEY (stage_template_id) REFERENCES stage_templates(id)
                )""");
        db.execute("""
                CREATE TABLE IF NOT EXISTS settings (
                  key TEXT PRIMARY KEY,
                  value TEXT NOT NULL
                )""");
        db.execute("""
                CREATE TABLE IF NOT EXISTS task_stages (
                  id TEXT PRIMARY KEY,
                  task_id TEXT NOT NULL,
                  stage_template_id TEXT NOT NULL,
                  sort_order INTEGER NOT NULL,
                  FOREIGN KEY (task_id) REFERENCES tasks(id),
                  FOREIGN KEY (stage_template_id) REFERENCES stage_templates(id),
                  UNIQUE(task_id, stage_template_id)
                )""");

        addColumns(db, "stage_executions", List.of(
                "thinking_output TEXT",
                "stage_result TEXT",
                "stage_summary TEXT",
                "input_tokens INTEGER",
                "output_tokens INTEGER",
                "cache_creation_input_tokens INTEGER",
                "cache_read_input_tokens INTEGER",
                "total_cost_usd REAL",
                "duration_ms INTEGER",
                "num_turns INTEGER"));
        addColumns(db, "tasks", List.of(
                "description TEXT",
                "branch_name TEXT",
                "pr_url TEXT",
                "worktree_path TEXT",
                "ejected INTEGER NOT NULL DEFAULT 0",
                "parent_task_id TEXT"));
        addColumns(db, "stage_templates", List.of(
                "result_mode TEXT NOT NULL DEFAULT 'replace'",
                "commits_changes INTEGER NOT NULL DEFAULT 0",
                "creates_pr INTEGER NOT NULL DEFAULT 0",
                "is_terminal INTEGER NOT NULL DEFAULT 0",
                "triggers_stage_selection INTEGER NOT NULL DEFAULT 0",
                "commit_prefix TEXT",
                "requires_user_input INTEGER NOT NULL DEFAULT 0",
                "agent TEXT"));

        db.update("""
                UPDATE stage_templates SET requires_user_input = 1
                WHERE input_source IN ('user', 'both') AND requires_user_input = 0""");

        createPrReviewFixes(db);
    }

    /**
     * pr_review_fixes was first created with UNIQUE(execution_id, comment_id);
     * older files are copied into a table keyed on comment_type as well.
     */
    private void createPrReviewFixes(JdbcOperations db) {
        db.execute(prReviewFixesDdl("pr_review_fixes"));

        List<String> ddl = db.queryForList(
                "SELECT sql FROM sqlite_master WHERE type = 'table' AND name = 'pr_review_fixes'",
                String.class);
        if (!ddl.isEmpty() && !ddl.get(0).contains("comment_type)")) {
            log.info("Widening pr_review_fixes unique key to include comment_type");
            db.execute(prReviewFixesDdl("_pr_review_fixes_v2"));
            db.execute("INSERT OR IGNORE INTO _pr_review_fixes_v2 SELECT * FROM pr_review_fixes");
            db.execute("DROP TABLE pr_review_fixes");
            db.execute("ALTER TABLE _pr_review_fixes_v2 RENAME TO pr_review_fixes");
        }
        db.execute("DROP TABLE IF EXISTS _pr_review_fixes_v2");
    }

    private static String prReviewFixesDdl(String table) {
        return """
                CREATE TABLE IF NOT EXISTS %s (
                  id TEXT PRIMARY KEY,
                  execution_id TEXT NOT NULL,
                  comment_id INTEGER NOT NULL,
                  comment_type TEXT NOT NULL DEFAULT 'inline',
                  author TEXT NOT NULL DEFAULT '',
                  author_avatar_url TEXT,
                  body TEXT NOT NULL DEFAULT '',
                  file_path TEXT,
                  line INTEGER,
                  diff_hunk TEXT,
                  state TEXT NOT NULL DEFAULT 'COMMENTED',
                  fix_status TEXT NOT NULL DEFAULT 'pending',
                  fix_commit_hash TEXT,
                  created_at TEXT NOT NULL DEFAULT (datetime('now')),
                  updated_at TEXT NOT NULL DEFAULT (datetime('now')),
                  FOREIGN KEY (execution_id) REFERENCES stage_executions(id),
                  UNIQUE(execution_id, comment_id, comment_type)
                )""".formatted(table);
    }

    // ── Guarded ALTERs ───────────────────────────────────────────────────

    private void addColumns(JdbcOperations db, String table, List<String> columns) {
        columns.forEach(c -> addColumn(db, table, c));
    }

    /** ALTER TABLE ... ADD COLUMN, treating "duplicate column" as already applied. */
    static void addColumn(JdbcOperations db, String table, String columnDef) {
        try {
            db.execute("ALTER TABLE " + table + " ADD COLUMN " + columnDef);
        } catch (DataAccessException e) {
            String msg = String.valueOf(e.getMostSpecificCause().getMessage());
            if (!msg.contains("duplicate column")) {
                throw e;
            }
        }
    }
}
