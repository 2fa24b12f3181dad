package de.bsommerfeld.promptstore.db.migration;

import java.util.List;

/**
 * Result of bringing one table to the current layout.
 *
 * @param table     table name
 * @param rewritten {@code false} if the table already matched and was left alone
 * @param migrated  rows carried over
 * @param skipped   rows left out, each with a reason
 */
public record MigrationOutcome(String table, boolean rewritten, long migrated, List<RowSkip> skipped) {

    public MigrationOutcome {
        skipped = List.copyOf(skipped);
    }

    static MigrationOutcome unchanged(String table) {
        return new MigrationOutcome(table, false, 0, List.of());
    }
}
