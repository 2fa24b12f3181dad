package de.bsommerfeld.promptstore.core.error;

import java.nio.file.Path;
import java.util.List;

/**
 * Thrown when no host root can be found. Fatal and never retried; carries
 * every path that was inspected so the user can see where we looked.
 */
public class DiscoveryException extends StorageException {

    private final List<Path> scannedPaths;

    public DiscoveryException(String message, List<Path> scannedPaths) {
        super(message);
        this.scannedPaths = List.copyOf(scannedPaths);
    }

    public List<Path> scannedPaths() {
        return scannedPaths;
    }
}
