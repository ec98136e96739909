package com.stagehand.orchestrator.model;

import java.time.Instant;

/** One row of the _migrations ledger. */
public record MigrationRecord(int version, String name, Instant appliedAt) {}
