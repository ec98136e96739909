package com.stagehand.orchestrator.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.stagehand.orchestrator.model.OutputFormat;
import com.stagehand.orchestrator.model.output.OptionsOutput;
import com.stagehand.orchestrator.model.output.ResearchOutput;
import com.stagehand.orchestrator.model.output.StageOutputPayload;
import com.stagehand.orchestrator.model.output.StructuredOutput;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OutputParserTest {

    private OutputParser parser;

    @BeforeEach
    void setUp() {
        parser = new OutputParser(new ObjectMapper());
    }

    // ------------------------------------------------------------------
    // extractJson
    // ------------------------------------------------------------------

    @Test
    void extractJson_bareJson_returnedAsIs() {
        String raw = "{\"research\":\"notes\"}";
        assertThat(parser.extractJson(raw)).contains(raw);
    }

    @Test
    void extractJson_streamResultEvent_prefersStructuredOutput() {
        String raw = """
                {"type":"system","subtype":"init"}
                {"type":"assistant","message":{"content":[{"type":"text","text":"thinking..."}]}}
                {"type":"result","result":"ignored","structured_output":{"plan":"step 1"}}
                """;
        assertThat(parser.extractJson(raw)).contains("{\"plan\":\"step 1\"}");
    }

    @Test
    void extractJson_streamResultEvent_withJsonEncodedResult() {
        String raw = """
                {"type":"system"}
                {"type":"result","result":"{\\"plan\\":\\"p\\"}"}
                """;
        assertThat(parser.extractJson(raw)).contains("{\"plan\":\"p\"}");
    }

    @Test
    void extractJson_codexAgentMessage_lastMessageWins() {
        String raw = """
                {"type":"item.completed","item":{"type":"agent_message","text":"first"}}
                {"type":"item.completed","item":{"type":"reasoning","text":"hmm"}}
                {"type":"item.completed","item":{"type":"agent_message","text":"{\\"plan\\":\\"final\\"}"}}
                """;
        assertThat(parser.extractJson(raw)).contains("{\"plan\":\"final\"}");
    }

    @Test
    void extractJson_embeddedInProse_isFound() {
        String raw = "Here is my answer:\n{\"research\": \"deep dive\"}\nThanks.";
        assertThat(parser.extractJson(raw)).contains("{\"research\": \"deep dive\"}");
    }

    @Test
    void extractJson_twoSeparateObjects_takesFirst() {
        String raw = "A {\"a\":1} then B {\"b\":2}";
        assertThat(parser.extractJson(raw)).contains("{\"a\":1}");
    }

    @Test
    void extractJson_plainProse_isEmpty() {
        assertThat(parser.extractJson("I changed three files.")).isEmpty();
        assertThat(parser.extractJson("")).isEmpty();
        assertThat(parser.extractJson(null)).isEmpty();
    }

    // ------------------------------------------------------------------
    // parse
    // ------------------------------------------------------------------

    @Test
    void parse_research_bindsPayload() {
        String json = """
                {"research":"Found the config loader.",
                 "questions":[{"id":"q1","question":"Which env?","proposed_answer":"prod"}],
                 "suggested_stages":[{"name":"Planning","reason":"complex change"}]}
                """;

        Optional<StageOutputPayload> payload = parser.parse(OutputFormat.RESEARCH, json);

        assertThat(payload).isPresent();
        ResearchOutput research = (ResearchOutput) payload.get();
        assertThat(research.research()).isEqualTo("Found the config loader.");
        assertThat(research.questions()).hasSize(1);
        assertThat(research.questions().get(0).proposedAnswer()).isEqualTo("prod");
        assertThat(research.suggestedStages()).hasSize(1);
    }

    @Test
    void parse_options_bindsApproaches() {
        String json = """
                {"options":[{"id":"a","title":"Flag","description":"Feature flag","pros":["safe"],"cons":[]}]}
                """;

        OptionsOutput options = (OptionsOutput) parser.parse(OutputFormat.OPTIONS, json).orElseThrow();

        assertThat(options.options()).hasSize(1);
        assertThat(options.options().get(0).pros()).containsExactly("safe");
        assertThat(options.questions()).isEmpty();
    }

    @Test
    void parse_prPreparation_bindsFlatFields() {
        String json = "{\"title\":\"Add SSO\",\"description\":\"Body\",\"test_plan\":[\"unit\"],\"draft\":null}";

        StructuredOutput out = (StructuredOutput) parser.parse(OutputFormat.PR_PREPARATION, json).orElseThrow();

        assertThat(out.field("title")).isEqualTo("Add SSO");
        assertThat(out.field("test_plan")).isEqualTo("[\"unit\"]");
        assertThat(out.fields()).doesNotContainKey("draft");
    }

    @Test
    void parse_missingRequiredField_throws() {
        assertThatThrownBy(() -> parser.parse(OutputFormat.RESEARCH, "{\"questions\":[]}"))
                .isInstanceOf(OutputParseException.class)
                .hasMessageContaining("research");
    }

    @Test
    void parse_malformedJson_throws() {
        assertThatThrownBy(() -> parser.parse(OutputFormat.PLAN, "{\"plan\": "))
                .isInstanceOf(OutputParseException.class);
    }

    @Test
    void parse_emptyOutput_throws() {
        assertThatThrownBy(() -> parser.parse(OutputFormat.PLAN, " "))
                .isInstanceOf(OutputParseException.class)
                .hasMessageContaining("Empty output");
    }

    @Test
    void parse_textFormat_hasNoPayload() {
        assertThat(parser.parse(OutputFormat.TEXT, "anything")).isEmpty();
        assertThat(parser.parse(OutputFormat.MERGE, null)).isEmpty();
    }

    @Test
    void tryReadTree_nonJson_returnsNull() {
        assertThat(parser.tryReadTree("not json")).isNull();
        assertThat(parser.tryReadTree("[1] trailing")).isNull();
        assertThat(parser.tryReadTree("[1]")).isNotNull();
    }
}
