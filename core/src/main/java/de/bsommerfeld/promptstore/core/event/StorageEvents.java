package de.bsommerfeld.promptstore.core.event;

import java.nio.file.Path;

/**
 * Events posted on the {@link StorageEventBus}.
 */
public class StorageEvents {

    /**
     * Marker for everything the storage layer announces.
     */
    public interface StorageEvent {
    }

    /**
     * The database file now lives at {@code newPath}. Connections opened on
     * {@code previousPath} point at a file that no longer exists.
     */
    public record DatabaseRelocatedEvent(Path previousPath, Path newPath) implements StorageEvent {
    }

    public record LegacyImportCompletedEvent(int imported, int skipped, int failed) implements StorageEvent {
    }
}
