package de.bsommerfeld.promptstore.core.relocate;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Byte-for-byte file copy used by {@link AtomicRelocator}.
 */
@FunctionalInterface
public interface FileCopier {

    FileCopier DEFAULT = (source, target) -> Files.copy(source, target, StandardCopyOption.COPY_ATTRIBUTES);

    void copy(Path source, Path target) throws IOException;
}
