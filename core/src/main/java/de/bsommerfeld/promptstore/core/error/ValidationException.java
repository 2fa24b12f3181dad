package de.bsommerfeld.promptstore.core.error;

import java.nio.file.Path;

/**
 * A requested path was rejected before anything was changed: relative,
 * unwritable, or not plausible as a storage location.
 */
public class ValidationException extends StorageException {

    private final Path rejectedPath;

    public ValidationException(Path rejectedPath, String reason) {
        super("Rejected " + rejectedPath + ": " + reason);
        this.rejectedPath = rejectedPath;
    }

    public Path rejectedPath() {
        return rejectedPath;
    }
}
