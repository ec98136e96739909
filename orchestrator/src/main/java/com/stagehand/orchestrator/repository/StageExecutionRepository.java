package com.stagehand.orchestrator.repository;

import com.stagehand.orchestrator.model.ExecutionStatus;
import com.stagehand.orchestrator.model.ExecutionTelemetry;
import com.stagehand.orchestrator.model.StageExecution;
import com.stagehand.orchestrator.store.StoreRegistry;
import com.stagehand.orchestrator.store.Timestamps;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * Execution rows are only ever inserted and updated, never deleted.
 */
@Repository
public class StageExecutionRepository {

    private static final RowMapper<StageExecution> ROW = (rs, i) -> {
        StageExecution e = new StageExecution(
                rs.getString("id"), rs.getString("task_id"),
                rs.getString("stage_template_id"), rs.getInt("attempt_number"));
        e.setStatus(ExecutionStatus.fromDb(rs.getString("status")));
        e.setInputPrompt(rs.getString("input_prompt"));
        e.setUserInput(rs.getString("user_input"));
        e.setRawOutput(rs.getString("raw_output"));
        e.setParsedOutput(rs.getString("parsed_output"));
        e.setUserDecision(rs.getString("user_decision"));
        e.setSessionId(rs.getString("session_id"));
        e.setErrorMessage(rs.getString("error_message"));
        e.setThinkingOutput(rs.getString("thinking_output"));
        e.setStageResult(rs.getString("stage_result"));
        e.setStageSummary(rs.getString("stage_summary"));
        e.setTelemetry(new ExecutionTelemetry(
                longOrNull(rs, "input_tokens"),
                longOrNull(rs, "output_tokens"),
                longOrNull(rs, "cache_creation_input_tokens"),
                longOrNull(rs, "cache_read_input_tokens"),
                doubleOrNull(rs, "total_cost_usd"),
                longOrNull(rs, "duration_ms"),
                intOrNull(rs, "num_turns")));
        e.setStartedAt(Timestamps.parse(rs.getString("started_at")));
        e.setCompletedAt(Timestamps.parse(rs.getString("completed_at")));
        return e;
    };

    private final StoreRegistry stores;

    public StageExecutionRepository(StoreRegistry stores) {
        this.stores = stores;
    }

    // ------------------------------------------------------------------
    // Writes
    // ------------------------------------------------------------------

    public void insert(String projectId, StageExecution e) {
        stores.project(projectId).run(db -> db.update("""
                INSERT INTO stage_executions (id, task_id, stage_template_id, attempt_number, status,
                  input_prompt, user_input, session_id, started_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)""",
                e.getId(), e.getTaskId(), e.getStageTemplateId(), e.getAttemptNumber(),
                e.getStatus().dbValue(), e.getInputPrompt(), e.getUserInput(), e.getSessionId(),
                Timestamps.format(e.getStartedAt())));
    }

    public void update(String projectId, StageExecution e) {
        ExecutionTelemetry t = e.getTelemetry();
        stores.project(projectId).run(db -> db.update("""
                UPDATE stage_executions SET status = ?, user_input = ?, raw_output = ?, parsed_output = ?,
                  user_decision = ?, session_id = ?, error_message = ?, thinking_output = ?, stage_result = ?,
                  stage_summary = ?, input_tokens = ?, output_tokens = ?, cache_creation_input_tokens = ?,
                  cache_read_input_tokens = ?, total_cost_usd = ?, duration_ms = ?, num_turns = ?,
                  completed_at = ?
                WHERE id = ?""",
                e.getStatus().dbValue(), e.getUserInput(), e.getRawOutput(), e.getParsedOutput(),
                e.getUserDecision(), e.getSessionId(), e.getErrorMessage(), e.getThinkingOutput(),
                e.getStageResult(), e.getStageSummary(), t.inputTokens(), t.outputTokens(),
                t.cacheCreationInputTokens(), t.cacheReadInputTokens(), t.totalCostUsd(), t.durationMs(),
                t.numTurns(), Timestamps.format(e.getCompletedAt()), e.getId()));
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    public Optional<StageExecution> findById(String projectId, String executionId) {
        return stores.project(projectId).call(db -> db.query(
                "SELECT * FROM stage_executions WHERE id = ?", ROW, executionId)).stream().findFirst();
    }

    /** Every attempt for the task, oldest first. */
    public List<StageExecution> findByTask(String projectId, String taskId) {
        return stores.project(projectId).call(db -> db.query(
                "SELECT * FROM stage_executions WHERE task_id = ? ORDER BY started_at, attempt_number",
                ROW, taskId));
    }

    /** Attempts for one (task, stage), lowest attempt number first. */
    public List<StageExecution> findAttempts(String projectId, String taskId, String stageTemplateId) {
        return stores.project(projectId).call(db -> db.query(
                "SELECT * FROM stage_executions WHERE task_id = ? AND stage_template_id = ? ORDER BY attempt_number",
                ROW, taskId, stageTemplateId));
    }

    public Optional<StageExecution> findLatestAttempt(String projectId, String taskId, String stageTemplateId) {
        return stores.project(projectId).call(db -> db.query(
                "SELECT * FROM stage_executions WHERE task_id = ? AND stage_template_id = ? "
                        + "ORDER BY attempt_number DESC LIMIT 1",
                ROW, taskId, stageTemplateId)).stream().findFirst();
    }

    public Optional<StageExecution> findLatestApproved(String projectId, String taskId, String stageTemplateId) {
        return stores.project(projectId).call(db -> db.query(
                "SELECT * FROM stage_executions WHERE task_id = ? AND stage_template_id = ? AND status = 'approved' "
                        + "ORDER BY attempt_number DESC LIMIT 1",
                ROW, taskId, stageTemplateId)).stream().findFirst();
    }

    /** Executions that were running when the process last stopped. */
    public List<StageExecution> findByStatus(String projectId, ExecutionStatus status) {
        return stores.project(projectId).call(db -> db.query(
                "SELECT * FROM stage_executions WHERE status = ?", ROW, status.dbValue()));
    }

    private static Long longOrNull(ResultSet rs, String column) throws SQLException {
        long v = rs.getLong(column);
        return rs.wasNull() ? null : v;
    }

    private static Integer intOrNull(ResultSet rs, String column) throws SQLException {
        int v = rs.getInt(column);
        return rs.wasNull() ? null : v;
    }

    private static Double doubleOrNull(ResultSet rs, String column) throws SQLException {
        double v = rs.getDouble(column);
        return rs.wasNull() ? null : v;
    }
}
