package com.stagehand.orchestrator.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stagehand.orchestrator.config.StagehandProperties;
import com.stagehand.orchestrator.model.ExecutionTelemetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Drives the {@code claude} CLI in print mode with stream-json output.
 *
 * Each stdout line is a JSON event. Assistant text blocks accumulate into the
 * thinking transcript; the final {@code result} event carries the answer
 * (or {@code structured_output} when {@code --json-schema} was passed), the
 * session id and usage figures.
 */
@Component
public class ClaudeCliAgentRunner implements AgentRunner {

    private static final Logger log = LoggerFactory.getLogger(ClaudeCliAgentRunner.class);

    /** Passed as the only allowed tool when a stage may use no tools at all. */
    static final String NO_TOOLS = "_none_";

    private final String       command;
    private final Duration     timeout;
    private final ObjectMapper json;

    private final Map<String, Process> running   = new ConcurrentHashMap<>();
    private final Set<String>          cancelled = ConcurrentHashMap.newKeySet();

    public ClaudeCliAgentRunner(StagehandProperties props, ObjectMapper objectMapper) {
        this.command = props.agent().command();
        this.timeout = props.agent().timeout();
        this.json    = objectMapper;
    }

    @Override
    public AgentResult run(AgentRequest request) {
        ProcessBuilder pb = new ProcessBuilder(buildCommand(request));
        if (request.workingDirectory() != null) {
            pb.directory(request.workingDirectory().toFile());
        }

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new AgentRunnerException("Failed to spawn agent: " + e.getMessage(), e);
        }
        running.put(request.executionId(), process);
        log.info("Agent started for execution {} (pid={})", request.executionId(), process.pid());

        try {
            CompletableFuture<List<String>> stdout = readLines(process.getInputStream());
            CompletableFuture<List<String>> stderr = readLines(process.getErrorStream());

            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                log.warn("Agent for execution {} exceeded {}; killing it", request.executionId(), timeout);
                process.destroyForcibly();
                process.waitFor();
            }
            boolean killed = !finished || cancelled.remove(request.executionId());

            List<String> lines = stdout.get();
            for (String line : stderr.get()) {
                log.debug("[agent stderr] {}", line);
            }
            return interpret(lines, process.exitValue(), killed, request.sessionId());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new AgentRunnerException("Interrupted while waiting for agent", e);
        } catch (ExecutionException e) {
            throw new AgentRunnerException("Failed to read agent output", e.getCause());
        } finally {
            running.remove(request.executionId());
            cancelled.remove(request.executionId());
        }
    }

    @Override
    public boolean cancel(String executionId) {
        Process process = running.get(executionId);
        if (process == null) return false;
        cancelled.add(executionId);
        process.destroy();
        log.info("Cancellation requested for execution {}", executionId);
        return true;
    }

    List<String> buildCommand(AgentRequest request) {
        List<String> cmd = new ArrayList<>(List.of(
                command, "--dangerously-skip-permissions",
                "-p", request.prompt(),
                "--output-format", "stream-json", "--verbose"));
        if (request.sessionId() != null) {
            cmd.add("--session-id");
            cmd.add(request.sessionId());
        }
        if (request.systemPrompt() != null && !request.systemPrompt().isBlank()) {
            cmd.add("--append-system-prompt");
            cmd.add(request.systemPrompt());
        }
        if (request.model() != null && !request.model().isBlank()) {
            cmd.add("--model");
            cmd.add(request.model());
        }
        if (request.jsonSchema() != null) {
            cmd.add("--json-schema");
            cmd.add(request.jsonSchema());
        }
        if (request.allowedTools() != null) {
            if (request.allowedTools().isEmpty()) {
                cmd.add("--allowedTools");
                cmd.add(NO_TOOLS);
            } else {
                for (String tool : request.allowedTools()) {
                    cmd.add("--allowedTools");
                    cmd.add(tool);
                }
            }
        }
        return cmd;
    }

    /** Folds stream-json lines into a result. Non-JSON lines are kept in the raw output only. */
    AgentResult interpret(List<String> lines, int exitCode, boolean killed, String requestedSession) {
        StringBuilder raw      = new StringBuilder();
        StringBuilder text     = new StringBuilder();
        StringBuilder thinking = new StringBuilder();
        String resultText = null;
        String sessionId  = requestedSession;
        ExecutionTelemetry telemetry = ExecutionTelemetry.empty();

        for (String line : lines) {
            raw.append(line).append('\n');
            JsonNode event = readEvent(line);
            if (event == null) continue;

            switch (event.path("type").asText()) {
                case "assistant" -> {
                    for (JsonNode block : event.path("message").path("content")) {
                        if ("text".equals(block.path("type").asText())) {
                            text.append(block.path("text").asText());
                            thinking.append(block.path("text").asText());
                        }
                    }
                }
                case "content_block_delta" -> {
                    String delta = event.path("delta").path("text").asText("");
                    text.append(delta);
                    thinking.append(delta);
                }
                case "result" -> {
                    JsonNode output = event.hasNonNull("structured_output")
                            ? event.get("structured_output") : event.get("result");
                    if (output != null && !output.isNull()) {
                        String value = output.isTextual() ? output.asText() : output.toString();
                        if (!value.isEmpty()) resultText = value;
                    }
                    if (event.hasNonNull("session_id")) sessionId = event.get("session_id").asText();
                    telemetry = telemetryOf(event);
                }
                default -> { }
            }
        }
        return new AgentResult(exitCode, killed, raw.toString(),
                resultText != null ? resultText : text.toString(),
                thinking.isEmpty() ? null : thinking.toString(),
                telemetry, sessionId);
    }

    private JsonNode readEvent(String line) {
        if (line.isBlank() || line.charAt(0) != '{') return null;
        try {
            return json.readTree(line);
        } catch (JsonProcessingException e) {
            log.trace("Skipping non-JSON agent line: {}", e.getOriginalMessage());
            return null;
        }
    }

    private static ExecutionTelemetry telemetryOf(JsonNode result) {
        JsonNode usage = result.path("usage");
        return new ExecutionTelemetry(
                longOrNull(usage, "input_tokens"),
                longOrNull(usage, "output_tokens"),
                longOrNull(usage, "cache_creation_input_tokens"),
                longOrNull(usage, "cache_read_input_tokens"),
                result.hasNonNull("total_cost_usd") ? result.get("total_cost_usd").asDouble() : null,
                longOrNull(result, "duration_ms"),
                result.hasNonNull("num_turns") ? result.get("num_turns").asInt() : null);
    }

    private static Long longOrNull(JsonNode node, String field) {
        return node.hasNonNull(field) ? node.get(field).asLong() : null;
    }

    private static CompletableFuture<List<String>> readLines(InputStream in) {
        return CompletableFuture.supplyAsync(() -> {
            List<String> lines = new ArrayList<>();
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) lines.add(line);
            } catch (IOException e) {
                throw new AgentRunnerException("Agent output stream failed", e);
            }
            return lines;
        });
    }
}
