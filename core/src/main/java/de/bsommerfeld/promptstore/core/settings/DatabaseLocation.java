package de.bsommerfeld.promptstore.core.settings;

import java.nio.file.Path;

/**
 * Where the database lives.
 *
 * @param path   absolute path of the database file
 * @param custom {@code true} if the user chose this location; {@code false}
 *               always means the canonical default
 */
public record DatabaseLocation(Path path, boolean custom) {
}
