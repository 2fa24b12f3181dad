package de.bsommerfeld.promptstore.core.host;

import com.google.common.collect.ImmutableSet;
import de.bsommerfeld.promptstore.core.config.StorageOptions;
import de.bsommerfeld.promptstore.core.error.DiscoveryException;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Locates the host application's root directory.
 *
 * <h3>Resolution order</h3>
 * <ol>
 * <li>Environment override ({@code COMFYUI_PATH}), accepted unconditionally</li>
 * <li>Walk up the install path <em>as presented</em> looking for the
 * container folder ({@code custom_nodes}); its parent must carry a marker
 * pair</li>
 * <li>The same walk over the symlink-resolved install path</li>
 * <li>Marker-only walk over the resolved path</li>
 * <li>Working directory holding both {@code user/} and {@code custom_nodes/}</li>
 * <li>Parent of a container folder that holds {@code user/}</li>
 * </ol>
 *
 * Symlinks are kept for as long as possible: extension folders are often
 * symlinked in from a shared checkout, and collapsing the link first would
 * point discovery at that checkout instead of the installation using it.
 *
 * <p>
 * The result is cached for the lifetime of this instance. There is no
 * fallback directory; total failure raises {@link DiscoveryException} with
 * every scanned path.
 */
@Singleton
public class RootResolver {

    private static final Logger LOG = LoggerFactory.getLogger(RootResolver.class);

    private static final String USER_DIR = "user";

    private final StorageOptions options;
    private final HostEnvironment environment;

    private HostRoot cached;

    @Inject
    public RootResolver(StorageOptions options, HostEnvironment environment) {
        this.options = options;
        this.environment = environment;
    }

    /**
     * Returns the host root, discovering it on first call.
     *
     * @throws DiscoveryException if no step identifies a root
     */
    public synchronized HostRoot resolve() throws DiscoveryException {
        if (cached == null) {
            cached = discover();
        }
        return cached;
    }

    private HostRoot discover() throws DiscoveryException {
        Optional<HostRoot> override = fromEnvironment();
        if (override.isPresent()) {
            return override.get();
        }

        Set<Path> scanned = new LinkedHashSet<>();
        Path start = environment.installPath().toAbsolutePath();
        Path resolvedStart = realPath(start);

        List<Path> presentedChain = ancestors(start);
        scanned.addAll(presentedChain);
        Optional<Path> found = containerScan(presentedChain);
        if (found.isPresent()) {
            return found(found.get(), DiscoveryStrategy.CONTAINER_SCAN, true);
        }

        List<Path> resolvedChain = ancestors(resolvedStart);
        scanned.addAll(resolvedChain);
        found = containerScan(resolvedChain);
        if (found.isPresent()) {
            return found(found.get(), DiscoveryStrategy.RESOLVED_CONTAINER_SCAN, false);
        }

        for (Path candidate : resolvedChain) {
            if (hasMarkers(candidate)) {
                return found(candidate, DiscoveryStrategy.MARKER_SCAN, false);
            }
        }

        Path cwd = environment.workingDirectory().toAbsolutePath();
        scanned.add(cwd);
        if (Files.isDirectory(cwd.resolve(USER_DIR))
                && Files.isDirectory(cwd.resolve(options.containerFolderName()))) {
            return found(cwd, DiscoveryStrategy.WORKING_DIRECTORY, true);
        }

        for (Path candidate : resolvedChain) {
            if (isContainer(candidate) && candidate.getParent() != null
                    && Files.isDirectory(candidate.getParent().resolve(USER_DIR))) {
                return found(candidate.getParent(), DiscoveryStrategy.CONTAINER_PARENT, false);
            }
        }

        List<Path> scannedList = new ArrayList<>(scanned);
        String message = "Could not find the ComfyUI root directory. Install the extension under "
                + "ComfyUI/" + options.containerFolderName() + "/ or set "
                + options.rootOverrideVariable() + " to the ComfyUI directory. Working directory: "
                + cwd + ". Searched paths: "
                + scannedList.stream().map(Path::toString).collect(Collectors.joining(", "));
        LOG.error(message);
        throw new DiscoveryException(message, scannedList);
    }

    private Optional<HostRoot> fromEnvironment() {
        Optional<String> value = environment.getenv(options.rootOverrideVariable());
        if (value.isEmpty()) {
            return Optional.empty();
        }
        Path path = Path.of(value.get());
        if (!path.isAbsolute()) {
            LOG.warn("{} is relative ({}), resolving against working directory",
                    options.rootOverrideVariable(), path);
            path = environment.workingDirectory().resolve(path);
        }
        path = path.normalize();
        if (!Files.isDirectory(path)) {
            LOG.warn("{} points to {} which is not an existing directory, using it anyway",
                    options.rootOverrideVariable(), path);
        } else if (!hasMarkers(path)) {
            LOG.warn("{} points to {} which has none of the expected ComfyUI markers, using it anyway",
                    options.rootOverrideVariable(), path);
        }
        LOG.info("ComfyUI root from {}: {}", options.rootOverrideVariable(), path);
        return Optional.of(new HostRoot(path, DiscoveryStrategy.ENVIRONMENT_OVERRIDE, true));
    }

    private Optional<Path> containerScan(List<Path> chain) {
        for (Path candidate : chain) {
            if (isContainer(candidate)) {
                Path root = candidate.getParent();
                if (root != null && hasMarkers(root)) {
                    return Optional.of(root);
                }
            }
        }
        return Optional.empty();
    }

    private boolean isContainer(Path path) {
        Path name = path.getFileName();
        return name != null && name.toString().equals(options.containerFolderName());
    }

    boolean hasMarkers(Path base) {
        for (ImmutableSet<String> markerSet : options.markerSets()) {
            if (markerSet.stream().allMatch(marker -> Files.exists(base.resolve(marker)))) {
                return true;
            }
        }
        return false;
    }

    private HostRoot found(Path root, DiscoveryStrategy strategy, boolean symlinksPreserved) {
        LOG.info("Found ComfyUI root via {}: {}", strategy, root);
        return new HostRoot(root, strategy, symlinksPreserved);
    }

    /** The path itself followed by each parent up to the filesystem root. */
    static List<Path> ancestors(Path path) {
        List<Path> chain = new ArrayList<>();
        for (Path p = path; p != null; p = p.getParent()) {
            chain.add(p);
        }
        return chain;
    }

    private static Path realPath(Path path) {
        try {
            return path.toRealPath();
        } catch (IOException e) {
            LOG.debug("Cannot resolve {} ({}), scanning normalized path", path, e.getMessage());
            return path.normalize();
        }
    }
}
