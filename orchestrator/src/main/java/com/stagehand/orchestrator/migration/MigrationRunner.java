package com.stagehand.orchestrator.migration;

import com.stagehand.orchestrator.model.MigrationRecord;
import com.stagehand.orchestrator.store.Timestamps;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcOperations;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Brings a project database up to the current version, once per change.
 *
 * Steps on every open:
 *  1. Ensure the _migrations ledger exists.
 *  2. Load applied versions.
 *  3. If none, detect the baseline and record versions up to it without
 *     running their bodies.
 *  4. Run the remaining migrations in ascending order, writing a ledger row
 *     after each body succeeds.
 *
 * A failing body aborts the run with a {@link MigrationException}; later
 * migrations are not attempted and no ledger row is written for it.
 */
@Component
public class MigrationRunner {

    private static final Logger log = LoggerFactory.getLogger(MigrationRunner.class);

    private final List<Migration>  migrations;
    private final BaselineDetector baseline;
    private final MeterRegistry    meters;

    @Autowired
    public MigrationRunner(MeterRegistry meters) {
        this(MigrationCatalog.all(), new BaselineDetector(), meters);
    }

    public MigrationRunner(List<Migration> migrations, BaselineDetector baseline, MeterRegistry meters) {
        for (int i = 1; i < migrations.size(); i++) {
            if (migrations.get(i).version() <= migrations.get(i - 1).version()) {
                throw new IllegalArgumentException(
                        "Migrations must be in strictly ascending version order at v"
                                + migrations.get(i).version());
            }
        }
        this.migrations = List.copyOf(migrations);
        this.baseline   = baseline;
        this.meters     = meters;
    }

    /**
     * @return the number of migration bodies executed
     * @throws MigrationException if a migration body fails
     */
    public int runPendingMigrations(JdbcOperations db) {
        db.execute("""
                CREATE TABLE IF NOT EXISTS _migrations (
                  version INTEGER PRIMARY KEY,
                  name TEXT NOT NULL,
                  applied_at TEXT NOT NULL DEFAULT (datetime('now'))
                )""");

        Set<Integer> applied = new HashSet<>(
                db.queryForList("SELECT version FROM _migrations ORDER BY version", Integer.class));

        if (applied.isEmpty()) {
            int detected = baseline.detect(db);
            if (detected > 0) {
                log.info("Detected existing database at baseline version {}", detected);
                String now = Timestamps.now();
                for (Migration m : migrations) {
                    if (m.version() > detected) break;
                    db.update("INSERT OR IGNORE INTO _migrations (version, name, applied_at) VALUES (?, ?, ?)",
                            m.version(), m.name(), now);
                    applied.add(m.version());
                }
            }
        }

        int ran = 0;
        for (Migration m : migrations) {
            if (applied.contains(m.version())) continue;

            log.info("Running migration {}: {}", m.version(), m.name());
            Timer.Sample sample = Timer.start(meters);
            try {
                m.apply(db);
            } catch (RuntimeException e) {
                log.error("Migration {} ({}) failed; aborting run", m.version(), m.name(), e);
                throw new MigrationException(m.version(), m.name(), e);
            }
            sample.stop(Timer.builder("stagehand.migration.duration")
                    .tag("version", String.valueOf(m.version()))
                    .register(meters));

            db.update("INSERT INTO _migrations (version, name, applied_at) VALUES (?, ?, ?)",
                    m.version(), m.name(), Timestamps.now());
            ran++;
        }
        return ran;
    }

    /** The ledger, oldest first. */
    public List<MigrationRecord> appliedMigrations(JdbcOperations db) {
        return db.query("SELECT version, name, applied_at FROM _migrations ORDER BY version",
                (rs, i) -> new MigrationRecord(
                        rs.getInt("version"),
                        rs.getString("name"),
                        Timestamps.parse(rs.getString("applied_at"))));
    }
}
