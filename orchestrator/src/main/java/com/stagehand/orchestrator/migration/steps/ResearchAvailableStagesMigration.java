package com.stagehand.orchestrator.migration.steps;

import com.stagehand.orchestrator.migration.Migration;
import com.stagehand.orchestrator.store.Timestamps;
import org.springframework.jdbc.core.JdbcOperations;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * v2: the Research prompt listed the pipeline's stages literally. Replace the
 * list with {{available_stages}} so it follows the project's real templates.
 */
public class ResearchAvailableStagesMigration implements Migration {

    static final Pattern HARDCODED_LIST =
            Pattern.compile("The available stages are:\n(?:- \"[^\"]+\":? [^\n]*\n)+");

    @Override public int    version() { return 2; }
    @Override public String name()    { return "research_available_stages"; }

    @Override
    public void apply(JdbcOperations db) {
        for (Map<String, Object> row : TemplateRows.select(db,
                "SELECT id, prompt_template FROM stage_templates "
                        + "WHERE name = 'Research' AND output_format = 'research' AND sort_order = 0")) {
            String prompt = TemplateRows.str(row, "prompt_template");
            if (prompt == null
                    || !prompt.contains("\"High-Level Approaches\"")
                    || prompt.contains("{{available_stages}}")) {
                continue;
            }
            String updated = rewrite(prompt);
            if (!updated.equals(prompt)) {
                db.update("UPDATE stage_templates SET prompt_template = ?, updated_at = ? WHERE id = ?",
                        updated, Timestamps.now(), TemplateRows.str(row, "id"));
            }
        }
    }

    static String rewrite(String prompt) {
        return HARDCODED_LIST.matcher(prompt)
                .replaceFirst(Matcher.quoteReplacement("The available stages are:\n{{available_stages}}\n"));
    }
}
