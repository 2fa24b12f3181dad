package de.bsommerfeld.promptstore.core.relocate;

import java.nio.file.Path;

/**
 * Outcome of a relocation request.
 *
 * @param previousPath where the database was
 * @param newPath      where it is now
 * @param changed      {@code false} if both paths were the same and nothing
 *                     was touched
 */
public record RelocationResult(Path previousPath, Path newPath, boolean changed) {
}
