package de.bsommerfeld.promptstore.core.host;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Process-level facts root discovery depends on. Injected so discovery can
 * be exercised against a synthetic directory tree.
 */
public interface HostEnvironment {

    /**
     * Value of an environment variable, empty if unset or blank.
     */
    Optional<String> getenv(String name);

    /**
     * Absolute location this extension was loaded from, with symlinks left
     * exactly as the host presented them.
     */
    Path installPath();

    Path workingDirectory();
}
