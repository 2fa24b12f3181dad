package de.bsommerfeld.promptstore.core.host;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.security.CodeSource;
import java.util.Optional;

/**
 * {@link HostEnvironment} backed by the running JVM.
 *
 * <p>
 * The install path is the code source of this class (the jar or the classes
 * directory). {@link Path#of(java.net.URI)} does not touch the filesystem, so
 * a symlinked extension directory keeps its symlinked identity here.
 */
public final class SystemHostEnvironment implements HostEnvironment {

    private static final Logger LOG = LoggerFactory.getLogger(SystemHostEnvironment.class);

    @Override
    public Optional<String> getenv(String name) {
        String value = System.getenv(name);
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value.strip());
    }

    @Override
    public Path installPath() {
        CodeSource source = SystemHostEnvironment.class.getProtectionDomain().getCodeSource();
        if (source == null || source.getLocation() == null) {
            LOG.warn("No code source available, using working directory as install path");
            return workingDirectory();
        }
        try {
            return Path.of(source.getLocation().toURI()).toAbsolutePath();
        } catch (URISyntaxException | IllegalArgumentException e) {
            LOG.warn("Cannot determine install path from {}, using working directory", source.getLocation(), e);
            return workingDirectory();
        }
    }

    @Override
    public Path workingDirectory() {
        return Path.of("").toAbsolutePath();
    }
}
