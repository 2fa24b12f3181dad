package de.bsommerfeld.promptstore.core.storage;

import java.nio.file.Path;

/**
 * Point-in-time description of the data directory, for status displays.
 *
 * @param path         the data directory
 * @param custom       {@code true} if a custom root is active
 * @param exists       whether the directory exists
 * @param writable     result of a write check, {@code false} if missing
 * @param totalSize    sum of regular file sizes in bytes, recursive
 * @param fileCount    number of regular files, recursive
 * @param freeSpace    usable bytes on the containing store, 0 if missing
 * @param databasePath the active database file
 */
public record DirectoryInfo(
        Path path,
        boolean custom,
        boolean exists,
        boolean writable,
        long totalSize,
        long fileCount,
        long freeSpace,
        Path databasePath) {
}
