package com.stagehand.orchestrator.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.stagehand.orchestrator.model.OutputFormat;
import com.stagehand.orchestrator.model.StageExecution;
import com.stagehand.orchestrator.model.StageTemplate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns an approved execution into the text later stages see.
 *
 * {@link #extractStageOutput} is the stage's own contribution to the
 * accumulated result; {@link #extractStageSummary} is the short form used by
 * {{stage_summaries}} and by append-mode stages.
 */
@Component
public class StageResultExtractor {

    private static final Pattern MARKDOWN_HEADER = Pattern.compile("(?m)^#+\\s+.*$");
    private static final Pattern SENTENCE        = Pattern.compile("[^.!?]*[.!?]+");
    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\n\n+");
    private static final Pattern SUMMARY_SECTION = Pattern.compile(
            "(?:^|\n)#+\\s*(?:Summary|Changes Made|What (?:was|I) (?:changed|did))[^\n]*\n"
                    + "([\\s\\S]{10,500}?)(?:\n#|\n---|\n\\*\\*|$)",
            Pattern.CASE_INSENSITIVE);

    private static final int FALLBACK_CHARS = 300;

    private final OutputParser parser;

    public StageResultExtractor(OutputParser parser) {
        this.parser = parser;
    }

    // ------------------------------------------------------------------
    // Stage output
    // ------------------------------------------------------------------

    public String extractStageOutput(StageTemplate stage, StageExecution execution, String decision) {
        String raw = rawOf(execution);
        OutputFormat format = stage.getOutputFormat();
        switch (format) {
            case RESEARCH:
                return textField(raw, "research").orElse(raw);
            case PLAN:
                return textField(raw, "plan").orElse(raw);
            case OPTIONS:
                return decision != null && !decision.isEmpty() ? formatSelectedApproach(decision) : raw;
            case FINDINGS:
                // Second attempts apply fixes and answer in prose.
                return textField(raw, "summary").orElse(raw);
            case TASK_SPLITTING:
                return textField(raw, "reasoning").orElse(raw);
            case PR_REVIEW:
                return raw.isEmpty() ? "PR Review completed" : raw;
            case MERGE:
                return raw.isEmpty() ? "Branch merged successfully" : raw;
            case INTERACTIVE_TERMINAL:
                return raw.isEmpty() ? "Interactive session completed" : raw;
            default:
                return raw;
        }
    }

    /** "## Selected Approach: title" plus description and pros/cons of the first selected option. */
    public String formatSelectedApproach(String decision) {
        JsonNode selected = parser.tryReadTree(decision);
        if (selected == null || !selected.isArray() || selected.isEmpty()) return decision;

        JsonNode approach = selected.get(0);
        StringBuilder text = new StringBuilder()
                .append("## Selected Approach: ").append(approach.path("title").asText())
                .append("\n\n").append(approach.path("description").asText());
        appendList(text, "Pros", approach.path("pros"));
        appendList(text, "Cons", approach.path("cons"));
        return text.toString();
    }

    private static void appendList(StringBuilder text, String heading, JsonNode items) {
        if (!items.isArray() || items.isEmpty()) return;
        List<String> lines = new ArrayList<>();
        items.forEach(i -> lines.add("- " + i.asText()));
        text.append("\n\n**").append(heading).append(":**\n").append(String.join("\n", lines));
    }

    // ------------------------------------------------------------------
    // Stage summary
    // ------------------------------------------------------------------

    /** @return a short summary, or null when the execution produced nothing */
    public String extractStageSummary(StageTemplate stage, StageExecution execution, String decision) {
        String raw = rawOf(execution);
        if (raw.isBlank()) {
            return stage.getOutputFormat() == OutputFormat.INTERACTIVE_TERMINAL
                    ? "Interactive session completed" : null;
        }
        switch (stage.getOutputFormat()) {
            case RESEARCH:
                return truncateToSentences(textField(raw, "research").orElse(raw), 3);
            case PLAN:
                return truncateToSentences(textField(raw, "plan").orElse(raw), 3);
            case OPTIONS: {
                JsonNode selected = parser.tryReadTree(decision);
                if (selected != null && selected.isArray() && !selected.isEmpty()) {
                    JsonNode approach = selected.get(0);
                    return "Selected: " + approach.path("title").asText() + " — "
                            + truncateToSentences(approach.path("description").asText(), 2);
                }
                return truncateToSentences(raw, 3);
            }
            case FINDINGS:
                return textField(raw, "summary").orElseGet(() -> truncateToSentences(raw, 3));
            case TASK_SPLITTING: {
                JsonNode data = parser.tryReadTree(raw);
                if (data == null || !data.isObject()) return truncateToSentences(raw, 3);
                int count = data.path("proposed_tasks").size();
                String summary = "Task split into %d subtask%s.".formatted(count, count == 1 ? "" : "s");
                String reasoning = data.path("reasoning").asText("");
                return reasoning.isEmpty() ? summary : summary + " " + truncateToSentences(reasoning, 2);
            }
            case TEXT:
                return extractImplementationSummary(raw);
            default:
                return truncateToSentences(raw, 3);
        }
    }

    /** First {@code n} sentences, markdown headers removed; the first 300 chars if none are found. */
    public static String truncateToSentences(String text, int n) {
        String cleaned = MARKDOWN_HEADER.matcher(text == null ? "" : text).replaceAll("").trim();
        Matcher m = SENTENCE.matcher(cleaned);
        StringBuilder out = new StringBuilder();
        int found = 0;
        while (found < n && m.find()) {
            out.append(m.group());
            found++;
        }
        if (found == 0) {
            return cleaned.substring(0, Math.min(FALLBACK_CHARS, cleaned.length())).trim();
        }
        return out.toString().trim();
    }

    /** A "Summary"/"Changes Made" section if present, else the last substantial paragraph. */
    public static String extractImplementationSummary(String raw) {
        if (raw == null || raw.isBlank()) return null;

        Matcher section = SUMMARY_SECTION.matcher(raw);
        if (section.find()) {
            return truncateToSentences(section.group(1).trim(), 3);
        }

        List<String> paragraphs = new ArrayList<>();
        for (String p : PARAGRAPH_BREAK.split(raw)) {
            if (p.trim().length() > 20) paragraphs.add(p);
        }
        if (!paragraphs.isEmpty()) {
            return truncateToSentences(paragraphs.get(paragraphs.size() - 1).trim(), 3);
        }
        return truncateToSentences(raw, 3);
    }

    // ------------------------------------------------------------------

    private static String rawOf(StageExecution execution) {
        String raw = execution.effectiveOutput();
        return raw == null ? "" : raw;
    }

    private Optional<String> textField(String raw, String field) {
        JsonNode data = parser.tryReadTree(raw);
        if (data == null || !data.isObject()) return Optional.empty();
        String value = data.path(field).asText("");
        return value.isEmpty() ? Optional.empty() : Optional.of(value);
    }
}
