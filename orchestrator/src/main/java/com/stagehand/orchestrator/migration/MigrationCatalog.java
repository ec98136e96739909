package com.stagehand.orchestrator.migration;

import com.stagehand.orchestrator.migration.steps.*;

import java.util.List;

/** Every migration, in ascending version order. Append only. */
public final class MigrationCatalog {

    private MigrationCatalog() {}

    public static List<Migration> all() {
        return List.of(
                new BehaviorFlagsMigration(),
                new ResearchAvailableStagesMigration(),
                new ResearchStageMigration(),
                new FindingsStagesMigration(),
                new ResearchStageSuggestionsMigration(),
                new InteractiveStagesMigration(),
                new PrPrepSummariesMigration(),
                new PrReviewStageMigration(),
                new MergeStageMigration(),
                new PrPreparationFormatMigration(),
                new DocumentationStageMigration()
        );
    }
}
