package com.stagehand.orchestrator.prompt;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders a stored stage prompt template against a {@link PromptContext}.
 *
 * Supported markup:
 * <pre>
 *   {{field}}                              substitution
 *   {{stages.Stage Name.output}}           output of a completed stage
 *   {{stages.Stage Name.summary}}          summary of a completed stage
 *   {{#if field}}...{{/if}}                conditional block
 *   {{#if field}}...{{else}}...{{/if}}     conditional with fallback
 * </pre>
 *
 * Conditionals are resolved first (innermost block first, so blocks may nest),
 * then every remaining token is substituted in a single left-to-right pass.
 * Substituted values are never re-scanned, so user text that happens to
 * contain {{...}} is inserted verbatim.
 *
 * Absent fields render as empty string, except {@code previous_output}, which
 * older stored templates expect to be filled with {@link #NO_PREVIOUS_OUTPUT}.
 * Tokens naming fields that no longer exist are stripped.
 *
 * Pure and stateless: no I/O, safe to share.
 */
public final class PromptRenderer {

    public static final String NO_PREVIOUS_OUTPUT = "(no previous output)";

    private static final String FIELD = "stages\\.[^.}]+\\.(?:output|summary)|\\w+";

    // Innermost block: a body that does not itself open another {{#if ...}}.
    private static final Pattern INNERMOST_IF = Pattern.compile(
            "\\{\\{#if\\s+(" + FIELD + ")\\s*\\}\\}((?:(?!\\{\\{#if\\s).)*?)\\{\\{/if\\}\\}",
            Pattern.DOTALL);

    private static final Pattern ELSE = Pattern.compile("\\{\\{else\\}\\}");

    private static final Pattern TOKEN = Pattern.compile("\\{\\{\\s*(" + FIELD + ")\\s*\\}\\}");

    private static final Pattern STAGE_REF = Pattern.compile("^stages\\.([^.}]+)\\.(output|summary)$");

    private PromptRenderer() {}

    public static String render(String template, PromptContext context) {
        if (template == null || template.isEmpty()) return "";

        String withConditionals = resolveConditionals(template, context);

        Matcher m = TOKEN.matcher(withConditionals);
        StringBuilder out = new StringBuilder(withConditionals.length());
        while (m.find()) {
            m.appendReplacement(out, Matcher.quoteReplacement(substitute(m.group(1), context)));
        }
        m.appendTail(out);
        return out.toString().trim();
    }

    private static String resolveConditionals(String template, PromptContext context) {
        String current = template;
        while (true) {
            Matcher m = INNERMOST_IF.matcher(current);
            if (!m.find()) return current;

            StringBuilder out = new StringBuilder(current.length());
            do {
                String[] branches = ELSE.split(m.group(2), 2);
                String chosen = isTruthy(lookup(m.group(1), context))
                        ? branches[0]
                        : (branches.length > 1 ? branches[1] : "");
                m.appendReplacement(out, Matcher.quoteReplacement(chosen));
            } while (m.find());
            m.appendTail(out);
            current = out.toString();
        }
    }

    private static String substitute(String field, PromptContext context) {
        String value = lookup(field, context);
        if (value != null) return value;
        if ("previous_output".equals(field)) return NO_PREVIOUS_OUTPUT;
        return "";
    }

    /** Raw context value for a field, or null when absent or unknown. */
    private static String lookup(String field, PromptContext ctx) {
        Matcher stage = STAGE_REF.matcher(field);
        if (stage.matches()) {
            Map<String, PromptContext.StageOutput> outputs = ctx.stageOutputs();
            PromptContext.StageOutput data = outputs.get(stage.group(1));
            if (data == null) return null;
            return "output".equals(stage.group(2)) ? data.output() : data.summary();
        }
        return switch (field) {
            case "task_description"     -> ctx.taskDescription();
            case "previous_output"      -> ctx.previousOutput();
            case "user_input"           -> ctx.userInput();
            case "user_decision"        -> ctx.userDecision();
            case "prior_attempt_output" -> ctx.priorAttemptOutput();
            case "stage_summaries"      -> ctx.stageSummaries();
            case "all_stage_outputs"    -> ctx.allStageOutputs();
            case "available_stages"     -> ctx.availableStages();
            default                     -> null;
        };
    }

    private static boolean isTruthy(String value) {
        return value != null && !value.isEmpty();
    }
}
