package de.bsommerfeld.promptstore.bootstrap;

import de.bsommerfeld.promptstore.core.error.StorageException;
import de.bsommerfeld.promptstore.core.host.HostRoot;
import de.bsommerfeld.promptstore.core.settings.DatabaseLocation;
import de.bsommerfeld.promptstore.db.SqliteConnections;
import de.bsommerfeld.promptstore.db.legacy.ImportReport;
import de.bsommerfeld.promptstore.db.migration.MigrationOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

/**
 * Startup sequence run once before the database is first opened:
 * <ol>
 * <li>discover the host root</li>
 * <li>create the data directory layout</li>
 * <li>normalize the stored database location</li>
 * <li>import legacy files from the host root</li>
 * <li>bring the active database's schema up to date</li>
 * </ol>
 */
public class StorageBootstrap {

    private static final Logger LOG = LoggerFactory.getLogger(StorageBootstrap.class);

    private final StorageContext context;

    public StorageBootstrap(StorageContext context) {
        this.context = context;
    }

    public StartupReport start() throws StorageException, IOException {
        HostRoot root = context.rootResolver().resolve();
        context.directories().ensureDirectoryStructure();
        Path dataDir = context.directories().getDataDir(true);
        LOG.info("Data directory: {}", dataDir);

        DatabaseLocation location = context.settings().loadDatabaseLocation();
        ImportReport imported = context.importer().importLegacy();
        List<MigrationOutcome> migrations = migrate(location.path());

        LOG.info("Storage ready, database at {}{}", location.path(), location.custom() ? " (custom)" : "");
        return new StartupReport(root, dataDir, imported, location, migrations);
    }

    private List<MigrationOutcome> migrate(Path database) throws StorageException, IOException {
        Path parent = database.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Connection conn = SqliteConnections.open(database)) {
            return context.migrator().migrate(conn);
        } catch (SQLException e) {
            throw new StorageException("Schema upgrade failed for " + database, e);
        }
    }
}
