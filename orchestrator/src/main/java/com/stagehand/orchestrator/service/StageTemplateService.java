package com.stagehand.orchestrator.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stagehand.orchestrator.model.GateRule;
import com.stagehand.orchestrator.model.InputSource;
import com.stagehand.orchestrator.model.OutputFormat;
import com.stagehand.orchestrator.model.ResultMode;
import com.stagehand.orchestrator.model.StageTemplate;
import com.stagehand.orchestrator.repository.StageTemplateRepository;
import com.stagehand.orchestrator.template.DefaultPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Reads and edits a project's stage templates.
 */
@Service
public class StageTemplateService {

    private static final Logger log = LoggerFactory.getLogger(StageTemplateService.class);

    public static final String TASK_SPLITTING_PRESET = "task_splitting";

    private final StageTemplateRepository templates;
    private final ProjectService          projects;
    private final ObjectMapper            json;

    public StageTemplateService(StageTemplateRepository templates,
                                ProjectService projects,
                                ObjectMapper objectMapper) {
        this.templates = templates;
        this.projects  = projects;
        this.json      = objectMapper;
    }

    /** All templates in sort order. */
    public List<StageTemplate> listTemplates(String projectId) {
        projects.requireProject(projectId);
        return templates.findAll(projectId);
    }

    public StageTemplate getTemplate(String projectId, String templateId) {
        projects.requireProject(projectId);
        return templates.findById(projectId, templateId)
                .orElseThrow(() -> new NotFoundException("Stage template", templateId));
    }

    /**
     * Applies {@code patch} after validating every enum and JSON field.
     *
     * @throws IllegalArgumentException on an unknown format, input source,
     *         result mode, or malformed gate JSON; nothing is written then
     */
    public StageTemplate updateTemplate(String projectId, String templateId, TemplatePatch patch) {
        StageTemplate t = getTemplate(projectId, templateId);
        applyPatch(t, patch);
        templates.update(projectId, t);
        log.info("Updated stage template {} ({}) in project {}", t.getId(), t.getName(), projectId);
        return t;
    }

    /**
     * Builds a custom template from {@code definition} and appends it. When no gate
     * is given the output format's usual gate applies.
     */
    public StageTemplate createTemplate(String projectId, TemplatePatch definition) {
        StageTemplate t = new StageTemplate();
        applyPatch(t, definition);
        if (definition.gateRules() == null) t.setGateRule(t.getOutputFormat().defaultGate());
        return createTemplate(projectId, t);
    }

    private void applyPatch(StageTemplate t, TemplatePatch patch) {
        // Parse everything first so a bad field leaves the template untouched.
        OutputFormat format = patch.outputFormat() == null ? null : OutputFormat.fromDb(patch.outputFormat());
        InputSource  input  = patch.inputSource()  == null ? null : InputSource.fromDb(patch.inputSource());
        ResultMode   mode   = patch.resultMode()   == null ? null : ResultMode.fromDb(patch.resultMode());
        GateRule     gate   = patch.gateRules()    == null ? null : parseGate(patch.gateRules());

        set(patch.name(), t::setName);
        set(patch.description(), t::setDescription);
        set(patch.promptTemplate(), t::setPromptTemplate);
        set(input, t::setInputSource);
        set(format, t::setOutputFormat);
        set(patch.outputSchema(), t::setOutputSchema);
        set(gate, t::setGateRule);
        set(patch.personaName(), t::setPersonaName);
        set(patch.personaSystemPrompt(), t::setPersonaSystemPrompt);
        set(patch.personaModel(), t::setPersonaModel);
        set(patch.preparationPrompt(), t::setPreparationPrompt);
        set(patch.allowedTools(), t::setAllowedTools);
        if (Boolean.TRUE.equals(patch.clearAllowedTools())) t.setAllowedTools(null);
        set(mode, t::setResultMode);
        set(patch.commitsChanges(), t::setCommitsChanges);
        set(patch.commitPrefix(), t::setCommitPrefix);
        set(patch.createsPr(), t::setCreatesPr);
        set(patch.terminal(), t::setTerminal);
        set(patch.triggersStageSelection(), t::setTriggersStageSelection);
        set(patch.requiresUserInput(), t::setRequiresUserInput);

        if (t.getName() == null || t.getName().isBlank()) {
            throw new IllegalArgumentException("Stage name must not be blank");
        }
    }

    /**
     * Appends a new template after the current last one. The template's id,
     * project and sort order are assigned here.
     */
    public StageTemplate createTemplate(String projectId, StageTemplate template) {
        projects.requireProject(projectId);
        if (template.getName() == null || template.getName().isBlank()) {
            throw new IllegalArgumentException("Stage name must not be blank");
        }
        template.setId(UUID.randomUUID().toString());
        template.setProjectId(projectId);
        template.setSortOrder(templates.maxSortOrder(projectId) + 1);
        templates.insert(projectId, template);
        log.info("Added stage template '{}' at position {} in project {}",
                template.getName(), template.getSortOrder(), projectId);
        return template;
    }

    /** Adds the optional task-splitting stage to the end of the pipeline. */
    public StageTemplate addTaskSplittingStage(String projectId) {
        return createTemplate(projectId, DefaultPipeline.taskSplitting(projectId, 0));
    }

    /**
     * Text for {{available_stages}}: one {@code - "Name": description} line per
     * stage a selection could pick, in sort order.
     */
    public String availableStagesListing(String projectId) {
        return templates.findAll(projectId).stream()
                .filter(t -> !t.isTriggersStageSelection())
                .map(t -> "- \"%s\": %s".formatted(t.getName(), t.getDescription()))
                .collect(Collectors.joining("\n"));
    }

    public GateRule parseGate(String gateJson) {
        try {
            GateRule rule = json.readValue(gateJson, GateRule.class);
            if (rule == null) throw new IllegalArgumentException("Gate rule must not be null");
            return rule;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid gate rule JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static <T> void set(T value, Consumer<T> setter) {
        if (value != null) setter.accept(value);
    }
}
