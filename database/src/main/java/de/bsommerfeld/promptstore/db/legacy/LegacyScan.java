package de.bsommerfeld.promptstore.db.legacy;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * Legacy files present under the host root, found without changing anything.
 *
 * @param root  the host root that was scanned
 * @param files the files found, in lookup order
 */
public record LegacyScan(Path root, List<LegacyFile> files) {

    public LegacyScan {
        files = List.copyOf(files);
    }

    public boolean found() {
        return !files.isEmpty();
    }

    /**
     * @param stats {@code null} for non-database files and unreadable databases
     */
    public record LegacyFile(String fileName, Path path, long size, Instant modified, DatabaseStats stats) {
    }

    /**
     * Row counts of a legacy database. Tables that do not exist count as 0.
     */
    public record DatabaseStats(long prompts, long images, long categories) {
    }
}
