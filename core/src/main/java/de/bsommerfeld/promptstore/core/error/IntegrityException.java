package de.bsommerfeld.promptstore.core.error;

import java.nio.file.Path;

/**
 * A copied file does not match its source. Aborts the relocation that
 * produced it; the caller has already rolled back when this surfaces.
 */
public class IntegrityException extends StorageException {

    public IntegrityException(Path source, long expectedBytes, Path copy, long actualBytes) {
        super("Copied database size mismatch: " + source + " (" + expectedBytes + " bytes) vs "
                + copy + " (" + actualBytes + " bytes)");
    }
}
