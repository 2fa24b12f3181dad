package de.bsommerfeld.promptstore.core.storage;

import de.bsommerfeld.promptstore.core.config.StorageOptions;
import de.bsommerfeld.promptstore.core.error.DiscoveryException;
import de.bsommerfeld.promptstore.core.error.ValidationException;
import de.bsommerfeld.promptstore.core.host.HostEnvironment;
import de.bsommerfeld.promptstore.core.host.HostRoot;
import de.bsommerfeld.promptstore.core.host.RootResolver;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Owns the extension's data directory.
 *
 * <p>
 * The canonical location is {@code <host root>/user/default/<extension>/},
 * or {@code <user dir>/default/<extension>/} when ComfyUI's user directory
 * is moved with {@value StorageOptions#USER_DIR_OVERRIDE_VARIABLE}. It
 * lives outside the extension's own code directory so that updating or
 * reinstalling the extension leaves user data alone. A custom root replaces
 * the canonical location for the lifetime of this instance.
 */
@Singleton
public class DataDirectoryManager {

    private static final Logger LOG = LoggerFactory.getLogger(DataDirectoryManager.class);

    static final String README_FILE = "README.txt";

    private final StorageOptions options;
    private final RootResolver rootResolver;
    private final HostEnvironment environment;

    private volatile Path customRoot;

    @Inject
    public DataDirectoryManager(StorageOptions options, RootResolver rootResolver, HostEnvironment environment) {
        this.options = options;
        this.rootResolver = rootResolver;
        this.environment = environment;
    }

    public HostRoot hostRoot() throws DiscoveryException {
        return rootResolver.resolve();
    }

    /**
     * {@code <user dir>/default/<extension>}, regardless of any custom root.
     * The user directory is {@code <host root>/user} unless overridden.
     */
    public Path canonicalDataDir() throws DiscoveryException {
        return userDir().resolve("default").resolve(options.extensionName());
    }

    private Path userDir() throws DiscoveryException {
        Optional<String> override = environment.getenv(StorageOptions.USER_DIR_OVERRIDE_VARIABLE);
        if (override.isPresent()) {
            Path userDir = expandHome(override.get().strip());
            if (!userDir.isAbsolute()) {
                userDir = environment.workingDirectory().resolve(userDir);
            }
            return userDir.normalize();
        }
        return hostRoot().path().resolve("user");
    }

    private static Path expandHome(String value) {
        if (value.equals("~")) {
            return Path.of(System.getProperty("user.home"));
        }
        if (value.startsWith("~/") || value.startsWith("~" + File.separator)) {
            return Path.of(System.getProperty("user.home")).resolve(value.substring(2));
        }
        return Path.of(value);
    }

    /**
     * Returns the active data directory, creating it when asked.
     * Creation is idempotent.
     */
    public Path getDataDir(boolean create) throws DiscoveryException, IOException {
        Path dir = dataDir();
        if (create && !Files.isDirectory(dir)) {
            Files.createDirectories(dir);
            LOG.info("Created data directory {}", dir);
        }
        return dir;
    }

    /**
     * The active data directory, without creating it.
     */
    public Path dataDir() throws DiscoveryException {
        Path custom = customRoot;
        return custom != null ? custom : canonicalDataDir();
    }

    public boolean isCustomRoot() {
        return customRoot != null;
    }

    /**
     * Switches to {@code path} as data root, or back to the canonical
     * location if {@code path} is {@code null}.
     *
     * @return {@code false} if the path was rejected; state is unchanged then
     */
    public boolean setCustomRoot(Path path) {
        if (path == null) {
            customRoot = null;
            LOG.info("Data directory reset to default location");
            return true;
        }
        try {
            validateCustomRoot(path);
        } catch (ValidationException e) {
            LOG.error("Custom data directory not accepted: {}", e.getMessage());
            return false;
        }
        customRoot = path.normalize();
        LOG.info("Using custom data directory {}", customRoot);
        return true;
    }

    /**
     * Checks a prospective custom root without touching manager state.
     * The write check may create the directory.
     *
     * @throws ValidationException naming the first rule the path breaks
     */
    public void validateCustomRoot(Path path) throws ValidationException {
        if (!path.isAbsolute()) {
            throw new ValidationException(path, "path must be absolute");
        }
        Path normalized = path.normalize();
        if (normalized.getParent() == null) {
            throw new ValidationException(path, "a filesystem root cannot hold the data directory");
        }
        for (Path element : normalized) {
            if (element.toString().equals(options.containerFolderName())) {
                throw new ValidationException(path, "inside " + options.containerFolderName()
                        + ", which is replaced when extensions update");
            }
        }
        if (Files.isRegularFile(normalized)) {
            throw new ValidationException(path, "an existing file is in the way");
        }
        if (!WriteCheck.isWritableDirectory(normalized)) {
            throw new ValidationException(path, "directory is not writable");
        }
    }

    /**
     * Returns a standard subdirectory of the data directory.
     */
    public Path getArea(StorageArea area, boolean create) throws DiscoveryException, IOException {
        Path dir = getDataDir(create).resolve(area.directoryName());
        if (create) {
            Files.createDirectories(dir);
        }
        return dir;
    }

    /**
     * Creates the data directory and every {@link StorageArea}. Writes a
     * {@code README.txt} the first time.
     */
    public Map<StorageArea, Path> ensureDirectoryStructure() throws DiscoveryException, IOException {
        Path dataDir = getDataDir(true);
        Map<StorageArea, Path> areas = new EnumMap<>(StorageArea.class);
        for (StorageArea area : StorageArea.values()) {
            areas.put(area, getArea(area, true));
        }
        Path readme = dataDir.resolve(README_FILE);
        if (!Files.exists(readme)) {
            Files.writeString(readme, readmeText(dataDir));
            LOG.debug("Wrote {}", readme);
        }
        return areas;
    }

    public Path defaultDatabasePath() throws DiscoveryException {
        return dataDir().resolve(options.databaseFileName());
    }

    public Path settingsPath() throws DiscoveryException {
        return dataDir().resolve(options.settingsFileName());
    }

    /**
     * Snapshot of the data directory for status output. Never creates anything.
     */
    public DirectoryInfo directoryInfo(Path databasePath) throws DiscoveryException, IOException {
        Path dir = dataDir();
        boolean exists = Files.isDirectory(dir);
        long totalSize = 0;
        long fileCount = 0;
        long freeSpace = 0;
        boolean writable = false;
        if (exists) {
            try (Stream<Path> files = Files.walk(dir)) {
                for (Path file : (Iterable<Path>) files.filter(Files::isRegularFile)::iterator) {
                    totalSize += Files.size(file);
                    fileCount++;
                }
            }
            freeSpace = Files.getFileStore(dir).getUsableSpace();
            writable = WriteCheck.isWritableDirectory(dir);
        }
        return new DirectoryInfo(dir, isCustomRoot(), exists, writable, totalSize, fileCount, freeSpace,
                databasePath);
    }

    private String readmeText(Path dataDir) {
        return options.extensionName() + " data directory\n"
                + "=".repeat(options.extensionName().length() + 15) + "\n\n"
                + "Location: " + dataDir + "\n\n"
                + "This directory holds your prompt database and settings. It is kept\n"
                + "outside the extension folder so updates do not touch your data.\n\n"
                + options.databaseFileName() + "   prompt database (SQLite)\n"
                + options.settingsFileName() + "  settings\n"
                + "backups/     automatic backups, including imported legacy files\n"
                + "exports/     exported prompts\n"
                + "logs/        log files\n"
                + "cache/       temporary files, safe to delete\n\n"
                + "Back up this directory to keep your prompts.\n";
    }
}
