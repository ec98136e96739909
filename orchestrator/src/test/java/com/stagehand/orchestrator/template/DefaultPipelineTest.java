package com.stagehand.orchestrator.template;

import com.stagehand.orchestrator.model.GateRuleType;
import com.stagehand.orchestrator.model.OutputFormat;
import com.stagehand.orchestrator.model.ResultMode;
import com.stagehand.orchestrator.model.StageTemplate;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class DefaultPipelineTest {

    private final List<StageTemplate> stages = DefaultPipeline.templates("proj");

    @Test
    void templates_areOrderedZeroToSeven() {
        assertThat(stages).extracting(StageTemplate::getName).containsExactly(
                "Research", "High-Level Approaches", "Planning", "Implementation",
                "Refinement", "Security Review", "PR Preparation", "PR Review");
        assertThat(stages).extracting(StageTemplate::getSortOrder).containsExactly(0, 1, 2, 3, 4, 5, 6, 7);
        assertThat(stages).extracting(StageTemplate::getProjectId).containsOnly("proj");
        assertThat(stages).extracting(StageTemplate::getId).doesNotHaveDuplicates();
    }

    @Test
    void research_selectsStagesAndWaitsForInput() {
        StageTemplate research = stages.get(0);

        assertThat(research.getOutputFormat()).isEqualTo(OutputFormat.RESEARCH);
        assertThat(research.isTriggersStageSelection()).isTrue();
        assertThat(research.isRequiresUserInput()).isTrue();
        assertThat(research.getAllowedTools()).contains("WebSearch");
        assertThat(research.getOutputSchema()).isNotBlank();
    }

    @Test
    void approaches_requireExactlyOneSelection() {
        StageTemplate approaches = stages.get(1);

        assertThat(approaches.getGateRule().type()).isEqualTo(GateRuleType.REQUIRE_SELECTION);
        assertThat(approaches.getGateRule().min()).isEqualTo(1);
        assertThat(approaches.getGateRule().max()).isEqualTo(1);
        assertThat(approaches.getResultMode()).isEqualTo(ResultMode.APPEND);
    }

    @Test
    void committingStages_carryPrefixes() {
        assertThat(stages)
                .filteredOn(StageTemplate::isCommitsChanges)
                .extracting(StageTemplate::getName, StageTemplate::getCommitPrefix)
                .containsExactly(
                        tuple("Implementation", "feat"),
                        tuple("Refinement", "fix"),
                        tuple("Security Review", "fix"));
    }

    @Test
    void prStages_createPrAndTerminate() {
        StageTemplate prep   = stages.get(6);
        StageTemplate review = stages.get(7);

        assertThat(prep.isCreatesPr()).isTrue();
        assertThat(prep.getGateRule().fields()).containsExactly("title", "description");
        assertThat(review.isTerminal()).isTrue();
        assertThat(stages).filteredOn(StageTemplate::isTerminal).hasSize(1);
    }

    @Test
    void taskSplitting_isSelectionGatedPreset() {
        StageTemplate split = DefaultPipeline.taskSplitting("proj", 9);

        assertThat(split.getName()).isEqualTo("Task Splitting");
        assertThat(split.getSortOrder()).isEqualTo(9);
        assertThat(split.getOutputFormat()).isEqualTo(OutputFormat.TASK_SPLITTING);
        assertThat(split.getGateRule().min()).isEqualTo(1);
        assertThat(split.getGateRule().max()).isEqualTo(20);
    }
}
