package com.stagehand.orchestrator.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stagehand.orchestrator.model.GateRule;
import com.stagehand.orchestrator.model.InputSource;
import com.stagehand.orchestrator.model.OutputFormat;
import com.stagehand.orchestrator.model.ResultMode;
import com.stagehand.orchestrator.model.StageTemplate;
import com.stagehand.orchestrator.store.StoreRegistry;
import com.stagehand.orchestrator.store.Timestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcOperations;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * Reads and writes stage_templates in a project database.
 *
 * gate_rules and allowed_tools are JSON columns. A gate that no longer parses
 * falls back to plain approval rather than making the whole pipeline unreadable.
 */
@Repository
public class StageTemplateRepository {

    private static final Logger log = LoggerFactory.getLogger(StageTemplateRepository.class);

    private final StoreRegistry stores;
    private final ObjectMapper  json;

    public StageTemplateRepository(StoreRegistry stores, ObjectMapper json) {
        this.stores = stores;
        this.json   = json;
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    /** All templates of the project, in pipeline order. */
    public List<StageTemplate> findAll(String projectId) {
        return stores.project(projectId).call(db -> db.query(
                "SELECT * FROM stage_templates WHERE project_id = ? ORDER BY sort_order, created_at",
                rowMapper(), projectId));
    }

    public Optional<StageTemplate> findById(String projectId, String templateId) {
        return stores.project(projectId).call(db -> db.query(
                "SELECT * FROM stage_templates WHERE id = ?", rowMapper(), templateId))
                .stream().findFirst();
    }

    public int maxSortOrder(String projectId) {
        Integer max = stores.project(projectId).call(db -> db.queryForObject(
                "SELECT MAX(sort_order) FROM stage_templates WHERE project_id = ?", Integer.class, projectId));
        return max == null ? -1 : max;
    }

    // ------------------------------------------------------------------
    // Writes
    // ------------------------------------------------------------------

    public void insertAll(String projectId, List<StageTemplate> templates) {
        stores.project(projectId).inTransaction(db -> {
            templates.forEach(t -> insert(db, t));
            return null;
        });
    }

    public void insert(String projectId, StageTemplate t) {
        stores.project(projectId).run(db -> insert(db, t));
    }

    public void update(String projectId, StageTemplate t) {
        String now = Timestamps.now();
        stores.project(projectId).run(db -> db.update("""
                UPDATE stage_templates SET
                  name = ?, description = ?, sort_order = ?, prompt_template = ?, input_source = ?,
                  output_format = ?, output_schema = ?, gate_rules = ?, persona_name = ?,
                  persona_system_prompt = ?, persona_model = ?, preparation_prompt = ?, allowed_tools = ?,
                  result_mode = ?, commits_changes = ?, commit_prefix = ?, creates_pr = ?, is_terminal = ?,
                  triggers_stage_selection = ?, requires_user_input = ?, agent = ?, updated_at = ?
                WHERE id = ?""",
                t.getName(), t.getDescription(), t.getSortOrder(), t.getPromptTemplate(),
                t.getInputSource().dbValue(), t.getOutputFormat().dbValue(), t.getOutputSchema(),
                writeGate(t.getGateRule()), t.getPersonaName(), t.getPersonaSystemPrompt(), t.getPersonaModel(),
                t.getPreparationPrompt(), writeTools(t.getAllowedTools()), t.getResultMode().dbValue(),
                flag(t.isCommitsChanges()), t.getCommitPrefix(), flag(t.isCreatesPr()), flag(t.isTerminal()),
                flag(t.isTriggersStageSelection()), flag(t.isRequiresUserInput()), t.getAgent(), now,
                t.getId()));
        t.setUpdatedAt(Timestamps.parse(now));
    }

    private void insert(JdbcOperations db, StageTemplate t) {
        String now = Timestamps.now();
        db.update("""
                INSERT INTO stage_templates (id, project_id, name, description, sort_order, prompt_template,
                  input_source, output_format, output_schema, gate_rules, persona_name, persona_system_prompt,
                  persona_model, preparation_prompt, allowed_tools, result_mode, commits_changes, commit_prefix,
                  creates_pr, is_terminal, triggers_stage_selection, requires_user_input, agent,
                  created_at, updated_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)""",
                t.getId(), t.getProjectId(), t.getName(), t.getDescription(), t.getSortOrder(),
                t.getPromptTemplate(), t.getInputSource().dbValue(), t.getOutputFormat().dbValue(),
                t.getOutputSchema(), writeGate(t.getGateRule()), t.getPersonaName(), t.getPersonaSystemPrompt(),
                t.getPersonaModel(), t.getPreparationPrompt(), writeTools(t.getAllowedTools()),
                t.getResultMode().dbValue(), flag(t.isCommitsChanges()), t.getCommitPrefix(),
                flag(t.isCreatesPr()), flag(t.isTerminal()), flag(t.isTriggersStageSelection()),
                flag(t.isRequiresUserInput()), t.getAgent(), now, now);
        t.setCreatedAt(Timestamps.parse(now));
        t.setUpdatedAt(Timestamps.parse(now));
    }

    // ------------------------------------------------------------------
    // Mapping
    // ------------------------------------------------------------------

    private RowMapper<StageTemplate> rowMapper() {
        return this::map;
    }

    private StageTemplate map(ResultSet rs, int rowNum) throws SQLException {
        StageTemplate t = new StageTemplate(
                rs.getString("id"), rs.getString("project_id"), rs.getString("name"), rs.getInt("sort_order"));
        t.setDescription(rs.getString("description"));
        t.setPromptTemplate(rs.getString("prompt_template"));
        t.setInputSource(InputSource.fromDb(rs.getString("input_source")));
        t.setOutputFormat(OutputFormat.fromDb(rs.getString("output_format")));
        t.setOutputSchema(rs.getString("output_schema"));
        t.setGateRule(readGate(t.getId(), rs.getString("gate_rules")));
        t.setPersonaName(rs.getString("persona_name"));
        t.setPersonaSystemPrompt(rs.getString("persona_system_prompt"));
        t.setPersonaModel(rs.getString("persona_model"));
        t.setPreparationPrompt(rs.getString("preparation_prompt"));
        t.setAllowedTools(readTools(t.getId(), rs.getString("allowed_tools")));
        t.setResultMode(ResultMode.fromDb(rs.getString("result_mode")));
        t.setCommitsChanges(rs.getInt("commits_changes") != 0);
        t.setCommitPrefix(rs.getString("commit_prefix"));
        t.setCreatesPr(rs.getInt("creates_pr") != 0);
        t.setTerminal(rs.getInt("is_terminal") != 0);
        t.setTriggersStageSelection(rs.getInt("triggers_stage_selection") != 0);
        t.setRequiresUserInput(rs.getInt("requires_user_input") != 0);
        t.setAgent(rs.getString("agent"));
        t.setCreatedAt(Timestamps.parse(rs.getString("created_at")));
        t.setUpdatedAt(Timestamps.parse(rs.getString("updated_at")));
        return t;
    }

    private GateRule readGate(String templateId, String raw) {
        if (raw == null || raw.isBlank()) return GateRule.approval();
        try {
            return json.readValue(raw, GateRule.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Template {} has unreadable gate_rules '{}', using require_approval: {}",
                    templateId, raw, e.getMessage());
            return GateRule.approval();
        }
    }

    private List<String> readTools(String templateId, String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            return json.readValue(raw, new TypeReference<List<String>>() {});
        } catch (JsonProcessingException e) {
            log.warn("Template {} has unreadable allowed_tools '{}', granting full tool set", templateId, raw);
            return null;
        }
    }

    private String writeGate(GateRule rule) {
        try {
            return json.writeValueAsString(rule == null ? GateRule.approval() : rule);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize gate rule " + rule, e);
        }
    }

    private String writeTools(List<String> tools) {
        if (tools == null) return null;
        try {
            return json.writeValueAsString(tools);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize allowed tools " + tools, e);
        }
    }

    private static int flag(boolean b) {
        return b ? 1 : 0;
    }
}
