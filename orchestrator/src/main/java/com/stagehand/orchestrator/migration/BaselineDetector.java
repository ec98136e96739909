package com.stagehand.orchestrator.migration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcOperations;

import java.util.List;

/**
 * Classifies a database created before the ledger existed.
 *
 * Each probe looks for a marker that only a specific migration leaves behind.
 * Probes run newest first and the first hit wins. This is content sniffing:
 * a user-created stage literally named "Documentation" or "Merge" reads as a
 * later baseline than the data really has. It only runs while the ledger is
 * empty; new migrations must not add probes here.
 */
public class BaselineDetector {

    private static final Logger log = LoggerFactory.getLogger(BaselineDetector.class);

    record Probe(int version, String description, String countSql) {}

    static final List<Probe> PROBES = List.of(
            new Probe(11, "Documentation stage exists",
                    "SELECT COUNT(*) FROM stage_templates WHERE name = 'Documentation'"),
            new Probe(10, "pr_preparation format in use",
                    "SELECT COUNT(*) FROM stage_templates WHERE output_format = 'pr_preparation'"),
            new Probe(9, "Merge stage exists",
                    "SELECT COUNT(*) FROM stage_templates WHERE name = 'Merge'"),
            new Probe(8, "PR Review stage exists",
                    "SELECT COUNT(*) FROM stage_templates WHERE name = 'PR Review'"),
            new Probe(7, "PR Preparation prompt uses stage summaries",
                    "SELECT COUNT(*) FROM stage_templates WHERE name = 'PR Preparation' "
                            + "AND prompt_template LIKE '%{{stage_summaries}}%'"),
            new Probe(6, "Planning uses plan format",
                    "SELECT COUNT(*) FROM stage_templates WHERE name = 'Planning' AND output_format = 'plan'"),
            // v4 and v5 both reshape Research/Refinement; the findings format implies both ran.
            new Probe(5, "Refinement uses findings format",
                    "SELECT COUNT(*) FROM stage_templates WHERE name = 'Refinement' AND output_format = 'findings'"),
            new Probe(1, "behavior flags set",
                    "SELECT COUNT(*) FROM stage_templates WHERE commits_changes = 1 OR creates_pr = 1")
    );

    /** Highest migration version the data already reflects; 0 for fresh or unmarked data. */
    public int detect(JdbcOperations db) {
        for (Probe probe : PROBES) {
            if (matches(db, probe)) {
                log.info("Baseline probe matched: {} (v{})", probe.description(), probe.version());
                return probe.version();
            }
        }
        return 0;
    }

    private boolean matches(JdbcOperations db, Probe probe) {
        try {
            Integer count = db.queryForObject(probe.countSql(), Integer.class);
            return count != null && count > 0;
        } catch (DataAccessException e) {
            log.debug("Baseline probe v{} failed, treating as no match: {}", probe.version(), e.getMessage());
            return false;
        }
    }
}
