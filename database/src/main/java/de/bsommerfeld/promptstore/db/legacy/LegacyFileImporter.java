package de.bsommerfeld.promptstore.db.legacy;

import de.bsommerfeld.promptstore.core.config.StorageOptions;
import de.bsommerfeld.promptstore.core.error.DiscoveryException;
import de.bsommerfeld.promptstore.core.error.StorageException;
import de.bsommerfeld.promptstore.core.event.StorageEventBus;
import de.bsommerfeld.promptstore.core.event.StorageEvents;
import de.bsommerfeld.promptstore.core.settings.LegacyDatabaseHandler;
import de.bsommerfeld.promptstore.core.storage.DataDirectoryManager;
import de.bsommerfeld.promptstore.core.storage.StorageArea;
import de.bsommerfeld.promptstore.db.SqliteConnections;
import de.bsommerfeld.promptstore.db.migration.ManagedTable;
import de.bsommerfeld.promptstore.db.migration.MigrationOutcome;
import de.bsommerfeld.promptstore.db.migration.SchemaMigrator;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Optional;

/**
 * Brings files left directly under the host root by older releases into
 * the data directory.
 *
 * <p>
 * Databases are copied, upgraded with {@link SchemaMigrator} on the copy,
 * and renamed into place, so the destination never holds a half-migrated
 * file. Other files are copied verbatim. Every imported file first gets a
 * timestamped copy in the backups area, and the original is renamed with
 * {@value #MIGRATED_SUFFIX} rather than deleted.
 *
 * <p>
 * When the destination already exists, databases are compared by prompt
 * count. A destination holding less than a tenth of the legacy rows is
 * taken for an interrupted earlier import and moved aside as
 * {@code <name>.partial_backup_<timestamp>}, and moved back if the import
 * then fails; otherwise the file counts as imported already and is skipped.
 */
@Singleton
public class LegacyFileImporter implements LegacyDatabaseHandler {

    private static final Logger LOG = LoggerFactory.getLogger(LegacyFileImporter.class);

    static final String MIGRATED_SUFFIX = ".v1_migrated";
    static final String PARTIAL_SUFFIX = ".partial_backup";
    static final String IMPORT_SUFFIX = ".importing";
    static final String BACKUP_INFIX = ".v1_backup_";
    static final double PARTIAL_THRESHOLD = 0.1;

    private static final DateTimeFormatter BACKUP_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final StorageOptions options;
    private final DataDirectoryManager directories;
    private final SchemaMigrator migrator;
    private final StorageEventBus eventBus;
    private final Clock clock;

    @Inject
    public LegacyFileImporter(StorageOptions options, DataDirectoryManager directories, SchemaMigrator migrator,
            StorageEventBus eventBus) {
        this(options, directories, migrator, eventBus, Clock.systemDefaultZone());
    }

    LegacyFileImporter(StorageOptions options, DataDirectoryManager directories, SchemaMigrator migrator,
            StorageEventBus eventBus, Clock clock) {
        this.options = options;
        this.directories = directories;
        this.migrator = migrator;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    /**
     * Imports every known legacy file found under the host root. A failure
     * on one file is recorded and the rest still run.
     */
    public ImportReport importLegacy() throws DiscoveryException, IOException {
        Path root = directories.hostRoot().path();
        directories.ensureDirectoryStructure();
        Path dataDir = directories.getDataDir(true);

        ImportReport.Builder report = new ImportReport.Builder();
        for (String name : options.legacyFileNames()) {
            Path source = root.resolve(name);
            if (!Files.exists(source)) {
                continue;
            }
            importFile(source, dataDir.resolve(targetName(name)), options.isDatabaseFile(name), report);
        }
        ImportReport result = report.build();
        if (!result.isEmpty()) {
            LOG.info("Legacy import finished: {} imported, {} skipped, {} failed",
                    result.migrated().size(), result.skipped().size(), result.errors().size());
            eventBus.post(new StorageEvents.LegacyImportCompletedEvent(
                    result.migrated().size(), result.skipped().size(), result.errors().size()));
        }
        return result;
    }

    @Override
    public void adopt(Path legacyPath, Path destination) throws StorageException, IOException {
        directories.ensureDirectoryStructure();
        ImportReport.Builder report = new ImportReport.Builder();
        importFile(legacyPath, destination, true, report);
        ImportReport result = report.build();
        if (!result.errors().isEmpty()) {
            throw new StorageException("Importing " + legacyPath + " failed: " + result.errors().get(0).error());
        }
    }

    /**
     * Legacy backups of the database import under the database's own name.
     */
    String targetName(String legacyName) {
        String database = options.databaseFileName();
        if (legacyName.startsWith(database) && legacyName.endsWith("_backup")) {
            return database;
        }
        return legacyName;
    }

    private void importFile(Path source, Path destination, boolean database, ImportReport.Builder report) {
        String name = source.getFileName().toString();

        if (Files.exists(destination)) {
            Optional<String> skipReason = database
                    ? compareWithExisting(source, destination)
                    : Optional.of("Already exists in data directory");
            if (skipReason.isPresent()) {
                LOG.info("Skipping legacy file {}: {}", name, skipReason.get());
                report.skipped(name, skipReason.get());
                return;
            }
        }

        Path partial = null;
        try {
            Path backup = backupCopy(source);
            if (Files.exists(destination)) {
                partial = movePartialAside(destination);
            }
            long prompts = 0;
            if (database) {
                prompts = importDatabase(source, destination);
            } else {
                Files.copy(source, destination, StandardCopyOption.COPY_ATTRIBUTES);
                LOG.info("Copied {} to {}", name, destination);
            }
            Path marked = source.resolveSibling(name + MIGRATED_SUFFIX);
            Files.move(source, marked);
            LOG.info("Marked legacy file as imported: {}", marked);
            report.imported(new ImportReport.ImportedFile(name, source, destination, backup, prompts));
        } catch (IOException | SQLException | DiscoveryException | RuntimeException e) {
            LOG.error("Failed to import legacy file {}", name, e);
            if (partial != null && !Files.exists(destination)) {
                restorePartial(partial, destination);
            }
            report.failed(name, String.valueOf(e.getMessage()));
        }
    }

    /**
     * Returns a skip reason, or empty if the destination is a partial import
     * that should be replaced.
     */
    private Optional<String> compareWithExisting(Path source, Path destination) {
        long legacyCount;
        long existingCount;
        try (Connection legacy = SqliteConnections.openReadOnly(source);
                Connection existing = SqliteConnections.openReadOnly(destination)) {
            legacyCount = SqliteConnections.countRows(legacy, ManagedTable.PROMPTS.tableName());
            existingCount = SqliteConnections.countRows(existing, ManagedTable.PROMPTS.tableName());
        } catch (SQLException e) {
            LOG.warn("Could not compare {} with {}: {}", source, destination, e.getMessage());
            return Optional.of("Already exists in data directory");
        }

        if (existingCount >= legacyCount * PARTIAL_THRESHOLD) {
            return Optional.of("Already migrated (" + existingCount + " prompts present)");
        }
        LOG.info("Existing database has {} prompts vs {} in legacy file, replacing", existingCount, legacyCount);
        return Optional.empty();
    }

    /**
     * Moves a partial destination to a name no earlier import has used.
     */
    private Path movePartialAside(Path destination) throws IOException {
        String base = destination.getFileName() + PARTIAL_SUFFIX + "_" + LocalDateTime.now(clock).format(BACKUP_STAMP);
        Path partial = destination.resolveSibling(base);
        for (int i = 1; Files.exists(partial); i++) {
            partial = destination.resolveSibling(base + "_" + i);
        }
        Files.move(destination, partial);
        LOG.info("Moved partial database to {}", partial);
        return partial;
    }

    private static void restorePartial(Path partial, Path destination) {
        try {
            Files.move(partial, destination);
            LOG.info("Restored {} from {}", destination, partial);
        } catch (IOException e) {
            LOG.error("Could not restore {}, the earlier database stays at {}", destination, partial, e);
        }
    }

    private Path backupCopy(Path source) throws DiscoveryException, IOException {
        String stamp = LocalDateTime.now(clock).format(BACKUP_STAMP);
        Path backup = directories.getArea(StorageArea.BACKUPS, true)
                .resolve(source.getFileName() + BACKUP_INFIX + stamp);
        Files.copy(source, backup, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
        LOG.info("Created backup {}", backup);
        return backup;
    }

    /**
     * Copies, upgrades and renames into place.
     *
     * @return rows in {@code prompts} after the upgrade
     */
    private long importDatabase(Path source, Path destination) throws IOException, SQLException {
        Path work = destination.resolveSibling(destination.getFileName() + IMPORT_SUFFIX);
        Files.deleteIfExists(work);
        Files.copy(source, work);
        try {
            long prompts;
            try (Connection conn = SqliteConnections.open(work)) {
                List<MigrationOutcome> outcomes = migrator.migrate(conn);
                for (MigrationOutcome outcome : outcomes) {
                    if (outcome.rewritten()) {
                        LOG.info("Upgraded {} in {}: {} rows, {} skipped",
                                outcome.table(), source.getFileName(), outcome.migrated(), outcome.skipped().size());
                    }
                }
                prompts = SqliteConnections.countRows(conn, ManagedTable.PROMPTS.tableName());
            }
            moveIntoPlace(work, destination);
            LOG.info("Imported {} prompts from {} into {}", prompts, source, destination);
            return prompts;
        } catch (IOException | SQLException | RuntimeException e) {
            Files.deleteIfExists(work);
            throw e;
        }
    }

    private static void moveIntoPlace(Path from, Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            LOG.warn("Atomic move not supported for {}, falling back to plain move", to);
            Files.move(from, to);
        }
    }
}
