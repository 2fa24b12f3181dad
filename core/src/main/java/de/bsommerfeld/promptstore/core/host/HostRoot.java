package de.bsommerfeld.promptstore.core.host;

import java.nio.file.Path;

/**
 * Root directory of the host application.
 *
 * @param path              the root, absolute
 * @param strategy          which discovery step found it
 * @param symlinksPreserved {@code true} if {@code path} was derived without
 *                          collapsing symlinks
 */
public record HostRoot(Path path, DiscoveryStrategy strategy, boolean symlinksPreserved) {
}
