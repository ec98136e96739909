package com.stagehand.orchestrator.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.stagehand.orchestrator.model.OutputFormat;
import com.stagehand.orchestrator.model.StageExecution;
import com.stagehand.orchestrator.model.StageTemplate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StageResultExtractorTest {

    private StageResultExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new StageResultExtractor(new OutputParser(new ObjectMapper()));
    }

    private static StageTemplate stage(OutputFormat format) {
        StageTemplate t = new StageTemplate("s1", "p1", "Stage", 0);
        t.setOutputFormat(format);
        return t;
    }

    private static StageExecution execution(String raw, String parsed) {
        StageExecution e = new StageExecution("e1", "t1", "s1", 1);
        e.setRawOutput(raw);
        e.setParsedOutput(parsed);
        return e;
    }

    // ------------------------------------------------------------------
    // extractStageOutput
    // ------------------------------------------------------------------

    @Test
    void output_research_usesResearchField() {
        StageExecution e = execution("ignored", "{\"research\":\"Config lives in app.yml.\"}");
        assertThat(extractor.extractStageOutput(stage(OutputFormat.RESEARCH), e, null))
                .isEqualTo("Config lives in app.yml.");
    }

    @Test
    void output_plan_fallsBackToRawWhenNotJson() {
        StageExecution e = execution("Step one. Step two.", null);
        assertThat(extractor.extractStageOutput(stage(OutputFormat.PLAN), e, null))
                .isEqualTo("Step one. Step two.");
    }

    @Test
    void output_options_formatsSelectedApproach() {
        String decision = """
                [{"id":"a","title":"Cache layer","description":"Add a cache.","pros":["fast"],"cons":["stale"]}]
                """;
        String out = extractor.extractStageOutput(stage(OutputFormat.OPTIONS), execution("{}", null), decision);

        assertThat(out).startsWith("## Selected Approach: Cache layer\n\nAdd a cache.");
        assertThat(out).contains("**Pros:**\n- fast");
        assertThat(out).contains("**Cons:**\n- stale");
    }

    @Test
    void output_options_plainTextDecision_isReturnedVerbatim() {
        assertThat(extractor.formatSelectedApproach("go with B")).isEqualTo("go with B");
    }

    @Test
    void output_findings_prosePreferredWhenNoSummaryField() {
        StageExecution e = execution("Applied the fixes.", null);
        assertThat(extractor.extractStageOutput(stage(OutputFormat.FINDINGS), e, null))
                .isEqualTo("Applied the fixes.");
    }

    @Test
    void output_manualFormats_haveDefaults() {
        StageExecution empty = execution(null, null);
        assertThat(extractor.extractStageOutput(stage(OutputFormat.MERGE), empty, null))
                .isEqualTo("Branch merged successfully");
        assertThat(extractor.extractStageOutput(stage(OutputFormat.INTERACTIVE_TERMINAL), empty, null))
                .isEqualTo("Interactive session completed");
        assertThat(extractor.extractStageOutput(stage(OutputFormat.PR_REVIEW), empty, null))
                .isEqualTo("PR Review completed");
    }

    // ------------------------------------------------------------------
    // extractStageSummary
    // ------------------------------------------------------------------

    @Test
    void summary_blankOutput_isNull() {
        assertThat(extractor.extractStageSummary(stage(OutputFormat.TEXT), execution("  ", null), null)).isNull();
    }

    @Test
    void summary_blankInteractive_hasDefault() {
        assertThat(extractor.extractStageSummary(stage(OutputFormat.INTERACTIVE_TERMINAL), execution(null, null), null))
                .isEqualTo("Interactive session completed");
    }

    @Test
    void summary_research_firstThreeSentences() {
        StageExecution e = execution(null, "{\"research\":\"One. Two! Three? Four.\"}");
        assertThat(extractor.extractStageSummary(stage(OutputFormat.RESEARCH), e, null))
                .isEqualTo("One. Two! Three?");
    }

    @Test
    void summary_options_describesSelection() {
        String decision = "[{\"title\":\"Flag\",\"description\":\"Gate it. Roll out slowly. Then clean up.\"}]";
        assertThat(extractor.extractStageSummary(stage(OutputFormat.OPTIONS), execution("{}", null), decision))
                .isEqualTo("Selected: Flag — Gate it. Roll out slowly.");
    }

    @Test
    void summary_taskSplitting_countsSubtasks() {
        String parsed = """
                {"reasoning":"Too big for one change.","proposed_tasks":[{"title":"A"},{"title":"B"}]}
                """;
        assertThat(extractor.extractStageSummary(stage(OutputFormat.TASK_SPLITTING), execution(null, parsed), null))
                .isEqualTo("Task split into 2 subtasks. Too big for one change.");
    }

    @Test
    void summary_text_prefersSummarySection() {
        String raw = """
                I looked around and edited things.

                ## Summary
                Rewrote the loader. Added tests.

                ## Notes
                Nothing else.
                """;
        assertThat(extractor.extractStageSummary(stage(OutputFormat.TEXT), execution(raw, null), null))
                .isEqualTo("Rewrote the loader. Added tests.");
    }

    @Test
    void summary_text_fallsBackToLastParagraph() {
        String raw = "First paragraph is long enough to count.\n\nFinal words describing the change made.";
        assertThat(StageResultExtractor.extractImplementationSummary(raw))
                .isEqualTo("Final words describing the change made.");
    }

    @Test
    void truncateToSentences_noPunctuation_usesPrefix() {
        String text = "x".repeat(400);
        assertThat(StageResultExtractor.truncateToSentences(text, 3)).hasSize(300);
    }

    @Test
    void truncateToSentences_stripsHeaders() {
        assertThat(StageResultExtractor.truncateToSentences("# Title\nBody here. More.", 1))
                .isEqualTo("Body here.");
    }
}
