package de.bsommerfeld.promptstore.core.error;

import java.nio.file.Path;

/**
 * The destination of a move is already occupied. There is no overwrite mode.
 */
public class CollisionException extends StorageException {

    private final Path destination;

    public CollisionException(Path destination) {
        super("Destination already has a database: " + destination);
        this.destination = destination;
    }

    public Path destination() {
        return destination;
    }
}
