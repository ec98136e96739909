package com.stagehand.orchestrator.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.stagehand.orchestrator.model.OutputFormat;
import com.stagehand.orchestrator.model.output.StageOutputPayload;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the JSON answer in agent output and binds it to the stage format's
 * payload record.
 *
 * Agents wrap their answer in different ways: bare JSON, a stream-json
 * "result" event, a Codex "agent_message" item, or JSON embedded in prose.
 * {@link #extractJson} tries each in that order.
 */
@Component
public class OutputParser {

    private static final Pattern GREEDY_OBJECT = Pattern.compile("\\{.*\\}", Pattern.DOTALL);
    private static final Pattern LAZY_OBJECT   = Pattern.compile("\\{.*?\\}", Pattern.DOTALL);

    private final ObjectMapper json;
    private final ObjectReader strictReader;

    public OutputParser(ObjectMapper json) {
        this.json         = json;
        this.strictReader = json.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    // ------------------------------------------------------------------
    // Locating JSON
    // ------------------------------------------------------------------

    public Optional<String> extractJson(String text) {
        if (text == null || text.isBlank()) return Optional.empty();

        if (readTree(text) != null) return Optional.of(text);

        String lastAgentMessage = null;
        for (String line : text.split("\n")) {
            JsonNode event = readTree(line);
            if (event == null || !event.isObject()) continue;

            String type = event.path("type").asText("");
            if ("result".equals(type)) {
                JsonNode output = event.hasNonNull("structured_output")
                        ? event.get("structured_output")
                        : event.get("result");
                String candidate = asJsonText(output);
                if (candidate != null) return Optional.of(candidate);
            }
            JsonNode item = event.path("item");
            if ("item.completed".equals(type)
                    && "agent_message".equals(item.path("type").asText())
                    && !item.path("text").asText("").isEmpty()) {
                lastAgentMessage = item.get("text").asText();
            }
        }
        if (lastAgentMessage != null) {
            // The final agent message is the answer even when it is not JSON.
            return Optional.of(lastAgentMessage);
        }

        Matcher greedy = GREEDY_OBJECT.matcher(text);
        if (greedy.find()) {
            if (readTree(greedy.group()) != null) return Optional.of(greedy.group());
            // Greedy spans several separate objects; take the first one.
            Matcher lazy = LAZY_OBJECT.matcher(text);
            if (lazy.find() && readTree(lazy.group()) != null) return Optional.of(lazy.group());
        }
        return Optional.empty();
    }

    /** The output node as JSON text if it is (or encodes) a JSON object or array. */
    private String asJsonText(JsonNode output) {
        if (output == null || output.isNull()) return null;
        if (output.isContainerNode()) return output.toString();
        String str = output.asText();
        if (str.isEmpty()) return null;
        JsonNode parsed = readTree(str);
        return parsed != null && parsed.isContainerNode() ? str : null;
    }

    private JsonNode readTree(String text) {
        try {
            JsonNode node = strictReader.readTree(text);
            return node == null || node.isMissingNode() ? null : node;
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    // ------------------------------------------------------------------
    // Typed binding
    // ------------------------------------------------------------------

    /**
     * Binds {@code jsonText} to the format's payload record.
     *
     * @throws OutputParseException if the format has a payload type and the
     *         JSON is malformed or lacks a required field
     * @return the payload, or empty for formats without one
     */
    public Optional<StageOutputPayload> parse(OutputFormat format, String jsonText) {
        if (format.payloadType().isEmpty()) return Optional.empty();
        Class<? extends StageOutputPayload> type = format.payloadType().get();
        if (jsonText == null || jsonText.isBlank()) {
            throw new OutputParseException(format, "Empty output for " + format.dbValue() + " stage", null);
        }
        try {
            return Optional.of(json.readValue(jsonText, type));
        } catch (JsonProcessingException e) {
            throw new OutputParseException(format,
                    "Output does not match the %s format: %s".formatted(format.dbValue(), e.getOriginalMessage()), e);
        }
    }

    /** Reads a JSON tree, or null when {@code text} is not JSON. */
    public JsonNode tryReadTree(String text) {
        if (text == null || text.isBlank()) return null;
        return readTree(text);
    }
}
