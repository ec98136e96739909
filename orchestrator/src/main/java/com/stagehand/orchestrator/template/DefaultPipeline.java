package com.stagehand.orchestrator.template;

import com.stagehand.orchestrator.model.GateRule;
import com.stagehand.orchestrator.model.InputSource;
import com.stagehand.orchestrator.model.OutputFormat;
import com.stagehand.orchestrator.model.ResultMode;
import com.stagehand.orchestrator.model.StageTemplate;

import java.util.List;
import java.util.UUID;

/**
 * The pipeline every new project starts with.
 *
 *   0 Research → 1 High-Level Approaches → 2 Planning → 3 Implementation
 *   → 4 Refinement → 5 Security Review → 6 PR Preparation → 7 PR Review
 *
 * Existing projects never see this list again; their templates only change
 * through migrations.
 */
public final class DefaultPipeline {

    static final List<String> READ_ONLY_TOOLS = List.of("Read", "Glob", "Grep");
    static final List<String> RESEARCH_TOOLS  = List.of("Read", "Glob", "Grep", "WebSearch", "WebFetch");

    private DefaultPipeline() {}

    public static List<StageTemplate> templates(String projectId) {
        StageTemplate research = stage(projectId, 0, "Research",
                "Investigate the problem space, gather context, and understand requirements.",
                StagePrompts.RESEARCH, InputSource.USER, OutputFormat.RESEARCH, OutputSchemas.RESEARCH);
        research.setAllowedTools(RESEARCH_TOOLS);
        research.setRequiresUserInput(true);
        research.setTriggersStageSelection(true);

        StageTemplate approaches = stage(projectId, 1, "High-Level Approaches",
                "Generate multiple implementation approaches based on the research.",
                StagePrompts.APPROACHES, InputSource.PREVIOUS_STAGE, OutputFormat.OPTIONS, OutputSchemas.APPROACHES);
        approaches.setGateRule(GateRule.selection(1, 1));
        approaches.setAllowedTools(READ_ONLY_TOOLS);
        approaches.setResultMode(ResultMode.APPEND);

        StageTemplate planning = stage(projectId, 2, "Planning",
                "Create a detailed implementation plan based on the selected approach.",
                StagePrompts.PLANNING, InputSource.PREVIOUS_STAGE, OutputFormat.PLAN, OutputSchemas.PLANNING);
        planning.setAllowedTools(READ_ONLY_TOOLS);

        StageTemplate implementation = stage(projectId, 3, "Implementation",
                "Execute the implementation plan: write code, create files, run commands.",
                StagePrompts.IMPLEMENTATION, InputSource.PREVIOUS_STAGE, OutputFormat.TEXT, null);
        implementation.setCommitsChanges(true);
        implementation.setCommitPrefix("feat");

        StageTemplate refinement = stage(projectId, 4, "Refinement",
                "Self-review the implementation: identify issues for the developer to select, then apply chosen fixes.",
                StagePrompts.REFINEMENT_FINDINGS, InputSource.PREVIOUS_STAGE, OutputFormat.FINDINGS, OutputSchemas.FINDINGS);
        refinement.setResultMode(ResultMode.APPEND);
        refinement.setCommitsChanges(true);
        refinement.setCommitPrefix("fix");

        StageTemplate security = stage(projectId, 5, "Security Review",
                "Analyze for security vulnerabilities, then apply selected fixes.",
                StagePrompts.SECURITY_FINDINGS, InputSource.PREVIOUS_STAGE, OutputFormat.FINDINGS, OutputSchemas.FINDINGS);
        security.setResultMode(ResultMode.APPEND);
        security.setCommitsChanges(true);
        security.setCommitPrefix("fix");

        StageTemplate prPreparation = stage(projectId, 6, "PR Preparation",
                "Generate a pull request title, description, and test plan.",
                StagePrompts.PR_PREPARATION, InputSource.PREVIOUS_STAGE, OutputFormat.PR_PREPARATION,
                OutputSchemas.PR_PREPARATION);
        prPreparation.setGateRule(GateRule.fields(List.of("title", "description")));
        prPreparation.setAllowedTools(READ_ONLY_TOOLS);
        prPreparation.setCreatesPr(true);

        StageTemplate prReview = stage(projectId, 7, "PR Review",
                "Fetch PR reviews from GitHub, fix reviewer comments, and complete the task.",
                "", InputSource.PREVIOUS_STAGE, OutputFormat.PR_REVIEW, null);
        prReview.setTerminal(true);

        return List.of(research, approaches, planning, implementation,
                refinement, security, prPreparation, prReview);
    }

    /**
     * Optional preset for decomposing a task into subtasks. Not part of the
     * default list; added to a project explicitly.
     */
    public static StageTemplate taskSplitting(String projectId, int sortOrder) {
        StageTemplate t = stage(projectId, sortOrder, "Task Splitting",
                "Decompose the task into smaller, independently completable subtasks.",
                StagePrompts.TASK_SPLITTING, InputSource.PREVIOUS_STAGE, OutputFormat.TASK_SPLITTING,
                OutputSchemas.TASK_SPLITTING);
        t.setGateRule(OutputFormat.TASK_SPLITTING.defaultGate());
        t.setAllowedTools(READ_ONLY_TOOLS);
        return t;
    }

    private static StageTemplate stage(String projectId, int sortOrder, String name, String description,
                                       String prompt, InputSource input, OutputFormat format, String schema) {
        StageTemplate t = new StageTemplate(UUID.randomUUID().toString(), projectId, name, sortOrder);
        t.setDescription(description);
        t.setPromptTemplate(prompt);
        t.setInputSource(input);
        t.setOutputFormat(format);
        t.setOutputSchema(schema);
        t.setGateRule(GateRule.approval());
        t.setResultMode(ResultMode.REPLACE);
        return t;
    }
}
