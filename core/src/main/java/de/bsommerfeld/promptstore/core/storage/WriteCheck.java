package de.bsommerfeld.promptstore.core.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Checks writability the only reliable way: create and delete a file.
 * Permission bits lie on network mounts and under ACLs.
 */
public final class WriteCheck {

    private static final Logger LOG = LoggerFactory.getLogger(WriteCheck.class);

    static final String CHECK_FILE = ".pm_write_test";

    private WriteCheck() {
    }

    /**
     * Creates {@code dir} if needed, then writes and removes a check file.
     *
     * @return {@code true} if both succeeded
     */
    public static boolean isWritableDirectory(Path dir) {
        Path check = dir.resolve(CHECK_FILE);
        try {
            Files.createDirectories(dir);
            Files.writeString(check, "ok");
            Files.delete(check);
            return true;
        } catch (IOException | SecurityException e) {
            LOG.debug("Write check failed in {}: {}", dir, e.toString());
            try {
                Files.deleteIfExists(check);
            } catch (IOException cleanup) {
                LOG.debug("Could not remove check file {}", check, cleanup);
            }
            return false;
        }
    }
}
