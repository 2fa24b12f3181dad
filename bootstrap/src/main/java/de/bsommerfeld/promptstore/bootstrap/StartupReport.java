package de.bsommerfeld.promptstore.bootstrap;

import de.bsommerfeld.promptstore.core.host.HostRoot;
import de.bsommerfeld.promptstore.core.settings.DatabaseLocation;
import de.bsommerfeld.promptstore.db.legacy.ImportReport;
import de.bsommerfeld.promptstore.db.migration.MigrationOutcome;

import java.nio.file.Path;
import java.util.List;

/**
 * What {@link StorageBootstrap#start()} found and did.
 *
 * @param root       the discovered host root
 * @param dataDir    the active data directory
 * @param imported   legacy file import results
 * @param database   the database location in use
 * @param migrations schema outcomes for the active database
 */
public record StartupReport(
        HostRoot root,
        Path dataDir,
        ImportReport imported,
        DatabaseLocation database,
        List<MigrationOutcome> migrations) {

    public StartupReport {
        migrations = List.copyOf(migrations);
    }
}
