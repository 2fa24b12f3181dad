package de.bsommerfeld.promptstore.core.settings;

import de.bsommerfeld.promptstore.core.error.StorageException;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Takes over a database file that the settings still point at but that
 * sits in a location from an older layout.
 */
public interface LegacyDatabaseHandler {

    /**
     * Brings {@code legacyPath} under management as {@code destination}.
     * The legacy file must not be deleted.
     */
    void adopt(Path legacyPath, Path destination) throws StorageException, IOException;
}
