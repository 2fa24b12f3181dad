package de.bsommerfeld.promptstore.core.relocate;

import de.bsommerfeld.promptstore.core.error.CollisionException;
import de.bsommerfeld.promptstore.core.error.IntegrityException;
import de.bsommerfeld.promptstore.core.error.StorageException;
import de.bsommerfeld.promptstore.core.event.StorageEventBus;
import de.bsommerfeld.promptstore.core.event.StorageEvents;
import de.bsommerfeld.promptstore.core.settings.DatabaseLocation;
import de.bsommerfeld.promptstore.core.settings.SettingsStore;
import de.bsommerfeld.promptstore.core.storage.DataDirectoryManager;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Moves the database file without ever leaving zero or two authoritative
 * copies.
 *
 * <h3>Protocol</h3>
 * <ol>
 * <li>Rename the source to {@code <name>.moving_backup}</li>
 * <li>Copy the backup to {@code <destination>.tmp_move}</li>
 * <li>Compare byte sizes</li>
 * <li>Rename the temp file onto the destination</li>
 * <li>Persist the new location in the settings</li>
 * <li>Delete the backup</li>
 * </ol>
 * A failure in steps 2 to 5 deletes whatever this call created at the
 * destination and renames the backup back. A failure in step 6 only leaves
 * the backup behind.
 *
 * <p>
 * The caller must hold no open connection to the source while this runs.
 */
@Singleton
public class AtomicRelocator {

    private static final Logger LOG = LoggerFactory.getLogger(AtomicRelocator.class);

    static final String BACKUP_SUFFIX = ".moving_backup";
    static final String TEMP_SUFFIX = ".tmp_move";

    private final DataDirectoryManager directories;
    private final SettingsStore settings;
    private final StorageEventBus eventBus;
    private final FileCopier copier;

    @Inject
    public AtomicRelocator(DataDirectoryManager directories, SettingsStore settings, StorageEventBus eventBus) {
        this(directories, settings, eventBus, FileCopier.DEFAULT);
    }

    public AtomicRelocator(DataDirectoryManager directories, SettingsStore settings, StorageEventBus eventBus,
            FileCopier copier) {
        this.directories = directories;
        this.settings = settings;
        this.eventBus = eventBus;
        this.copier = copier;
    }

    /**
     * Moves the database the settings currently point at.
     */
    public RelocationResult relocateActive(Path destination) throws StorageException, IOException {
        DatabaseLocation location = settings.loadDatabaseLocation();
        return relocate(location.path(), destination);
    }

    /**
     * Moves {@code current} to {@code destination}. A relative destination
     * is taken as relative to the data directory; an existing directory
     * receives the file under its current name.
     *
     * @throws NoSuchFileException  if {@code current} does not exist
     * @throws CollisionException   if the destination is occupied
     * @throws IntegrityException   if the copy came out the wrong size
     */
    public RelocationResult relocate(Path current, Path destination) throws StorageException, IOException {
        Path source = current.toAbsolutePath().normalize();
        Path target = resolveDestination(destination, source);

        if (!Files.exists(source)) {
            throw new NoSuchFileException(source.toString(), null, "database to relocate does not exist");
        }
        if (source.equals(target) || (Files.exists(target) && Files.isSameFile(source, target))) {
            LOG.debug("Database already at {}, nothing to move", target);
            return new RelocationResult(source, target, false);
        }
        if (Files.exists(target)) {
            throw new CollisionException(target);
        }

        Path parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path backup = source.resolveSibling(source.getFileName() + BACKUP_SUFFIX);
        Path tmp = target.resolveSibling(target.getFileName() + TEMP_SUFFIX);

        LOG.info("Moving database {} -> {}", source, target);
        Files.move(source, backup);

        boolean placed = false;
        try {
            copier.copy(backup, tmp);
            long expected = Files.size(backup);
            long actual = Files.size(tmp);
            if (expected != actual) {
                throw new IntegrityException(backup, expected, tmp, actual);
            }
            rename(tmp, target);
            placed = true;
            settings.saveDatabaseLocation(target);
        } catch (StorageException | IOException | RuntimeException e) {
            LOG.error("Moving database to {} failed, rolling back", target, e);
            rollback(e, tmp, placed ? target : null, backup, source);
            throw e;
        }

        try {
            Files.delete(backup);
        } catch (IOException e) {
            LOG.warn("Database moved but backup {} could not be removed", backup, e);
        }
        LOG.info("Database moved to {}", target);
        eventBus.post(new StorageEvents.DatabaseRelocatedEvent(source, target));
        return new RelocationResult(source, target, true);
    }

    private Path resolveDestination(Path destination, Path source) throws StorageException {
        Path target = destination;
        if (!target.isAbsolute()) {
            target = directories.dataDir().resolve(target);
        }
        if (Files.isDirectory(target)) {
            target = target.resolve(source.getFileName());
        }
        return target.toAbsolutePath().normalize();
    }

    private static void rollback(Exception failure, Path tmp, Path placedTarget, Path backup, Path source) {
        try {
            Files.deleteIfExists(tmp);
            if (placedTarget != null) {
                Files.deleteIfExists(placedTarget);
            }
        } catch (IOException e) {
            LOG.error("Could not clean up partial copy at {}", placedTarget != null ? placedTarget : tmp, e);
            failure.addSuppressed(e);
        }
        try {
            Files.move(backup, source);
            LOG.info("Restored database at {}", source);
        } catch (IOException e) {
            LOG.error("Could not restore {} from {}. The backup holds your data.", source, backup, e);
            failure.addSuppressed(e);
        }
    }

    private static void rename(Path from, Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            LOG.warn("Atomic move not supported for {}, falling back to plain move", to);
            Files.move(from, to);
        }
    }
}
