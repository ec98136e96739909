package com.stagehand.orchestrator.migration;

/**
 * A migration body failed. The run stops at this version with no ledger row
 * written for it, and the database must not be used until a later open
 * succeeds.
 */
public class MigrationException extends RuntimeException {

    private final int    version;
    private final String migrationName;

    public MigrationException(int version, String migrationName, Throwable cause) {
        super("Migration %d (%s) failed: %s".formatted(version, migrationName, cause.getMessage()), cause);
        this.version       = version;
        this.migrationName = migrationName;
    }

    public int    getVersion()       { return version; }
    public String getMigrationName() { return migrationName; }
}
