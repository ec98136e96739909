package com.stagehand.orchestrator.migration;

import org.springframework.jdbc.core.JdbcOperations;

/**
 * One versioned change to a project database.
 *
 * Bodies must re-check their own precondition before mutating, so running a
 * body against data that already has the target shape changes nothing.
 */
public interface Migration {

    int version();

    String name();

    void apply(JdbcOperations db);
}
