package com.stagehand.orchestrator.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.stagehand.orchestrator.store.TestStores;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Command construction and stream-json interpretation. No process is spawned.
 */
class ClaudeCliAgentRunnerTest {

    private ClaudeCliAgentRunner runner;

    @BeforeEach
    void setUp() {
        runner = new ClaudeCliAgentRunner(TestStores.properties(Path.of("unused")), new ObjectMapper());
    }

    private static AgentRequest request(List<String> tools, String schema, String persona, String model) {
        return new AgentRequest("e1", "Do the thing", Path.of("/tmp/repo"), tools, schema, persona, model, "s-1");
    }

    // ------------------------------------------------------------------
    // buildCommand
    // ------------------------------------------------------------------

    @Test
    void buildCommand_minimal_hasPrintModeAndStreamJson() {
        List<String> cmd = runner.buildCommand(request(null, null, null, null));

        assertThat(cmd).containsExactly(
                "claude", "--dangerously-skip-permissions",
                "-p", "Do the thing",
                "--output-format", "stream-json", "--verbose",
                "--session-id", "s-1");
    }

    @Test
    void buildCommand_allOptions_appendsEachFlag() {
        List<String> cmd = runner.buildCommand(request(List.of("Read", "Grep"), "{\"type\":\"object\"}",
                "You are a reviewer.", "opus"));

        assertThat(cmd).containsSubsequence("--append-system-prompt", "You are a reviewer.");
        assertThat(cmd).containsSubsequence("--model", "opus");
        assertThat(cmd).containsSubsequence("--json-schema", "{\"type\":\"object\"}");
        assertThat(cmd).containsSubsequence("--allowedTools", "Read", "--allowedTools", "Grep");
    }

    @Test
    void buildCommand_emptyToolList_passesSentinel() {
        List<String> cmd = runner.buildCommand(request(List.of(), null, null, null));

        assertThat(cmd).containsSubsequence("--allowedTools", ClaudeCliAgentRunner.NO_TOOLS);
    }

    @Test
    void buildCommand_blankPersonaAndModel_areOmitted() {
        List<String> cmd = runner.buildCommand(request(null, null, "  ", ""));

        assertThat(cmd).doesNotContain("--append-system-prompt", "--model");
    }

    // ------------------------------------------------------------------
    // interpret
    // ------------------------------------------------------------------

    @Test
    void interpret_resultEvent_carriesAnswerSessionAndTelemetry() {
        List<String> lines = List.of(
                "{\"type\":\"system\",\"subtype\":\"init\"}",
                "{\"type\":\"assistant\",\"message\":{\"content\":[{\"type\":\"text\",\"text\":\"Looking around. \"},"
                        + "{\"type\":\"tool_use\",\"name\":\"Read\"}]}}",
                "{\"type\":\"result\",\"result\":\"Final answer\",\"session_id\":\"s-2\",\"total_cost_usd\":0.42,"
                        + "\"duration_ms\":1200,\"num_turns\":3,"
                        + "\"usage\":{\"input_tokens\":100,\"output_tokens\":50,\"cache_read_input_tokens\":7}}");

        AgentResult result = runner.interpret(lines, 0, false, "s-1");

        assertThat(result.succeeded()).isTrue();
        assertThat(result.resultText()).isEqualTo("Final answer");
        assertThat(result.thinking()).isEqualTo("Looking around. ");
        assertThat(result.sessionId()).isEqualTo("s-2");
        assertThat(result.telemetry().inputTokens()).isEqualTo(100L);
        assertThat(result.telemetry().outputTokens()).isEqualTo(50L);
        assertThat(result.telemetry().cacheReadInputTokens()).isEqualTo(7L);
        assertThat(result.telemetry().cacheCreationInputTokens()).isNull();
        assertThat(result.telemetry().totalCostUsd()).isEqualTo(0.42);
        assertThat(result.telemetry().numTurns()).isEqualTo(3);
        assertThat(result.rawOutput()).contains("\"type\":\"result\"");
    }

    @Test
    void interpret_structuredOutput_winsOverResultText() {
        List<String> lines = List.of(
                "{\"type\":\"result\",\"result\":\"prose\",\"structured_output\":{\"plan\":\"Step 1\"}}");

        AgentResult result = runner.interpret(lines, 0, false, null);

        assertThat(result.resultText()).isEqualTo("{\"plan\":\"Step 1\"}");
    }

    @Test
    void interpret_noResultEvent_fallsBackToAccumulatedText() {
        List<String> lines = List.of(
                "not json at all",
                "{\"type\":\"content_block_delta\",\"delta\":{\"text\":\"Hel\"}}",
                "{\"type\":\"content_block_delta\",\"delta\":{\"text\":\"lo\"}}");

        AgentResult result = runner.interpret(lines, 1, false, "s-1");

        assertThat(result.succeeded()).isFalse();
        assertThat(result.resultText()).isEqualTo("Hello");
        assertThat(result.sessionId()).isEqualTo("s-1");
        assertThat(result.rawOutput()).startsWith("not json at all\n");
    }

    @Test
    void interpret_emptyOutput_hasNoThinking() {
        AgentResult result = runner.interpret(List.of(), 143, true, null);

        assertThat(result.killed()).isTrue();
        assertThat(result.thinking()).isNull();
        assertThat(result.resultText()).isEmpty();
    }

    @Test
    void cancel_unknownExecution_returnsFalse() {
        assertThat(runner.cancel("nothing-running")).isFalse();
    }
}
