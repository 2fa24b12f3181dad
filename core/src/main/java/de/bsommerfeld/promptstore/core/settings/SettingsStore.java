package de.bsommerfeld.promptstore.core.settings;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import de.bsommerfeld.promptstore.core.error.DiscoveryException;
import de.bsommerfeld.promptstore.core.error.StorageException;
import de.bsommerfeld.promptstore.core.storage.DataDirectoryManager;
import de.bsommerfeld.promptstore.core.storage.WriteCheck;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The extension's JSON settings document.
 *
 * <p>
 * Only {@value #DATABASE_PATH_KEY} and {@value #DATABASE_CUSTOM_KEY} are
 * interpreted here. Every other key is carried through load and save
 * unchanged and in its original order.
 *
 * <p>
 * Writes go to a sibling temp file that is then renamed over the target,
 * so readers see either the old document or the new one, never a torn
 * write. Concurrent writers are not coordinated: the last rename wins.
 */
@Singleton
public class SettingsStore {

    private static final Logger LOG = LoggerFactory.getLogger(SettingsStore.class);

    public static final String DATABASE_PATH_KEY = "databasePath";
    public static final String DATABASE_CUSTOM_KEY = "databasePathCustom";

    static final String TEMP_SUFFIX = ".tmp";

    private static final TypeReference<LinkedHashMap<String, Object>> DOCUMENT_TYPE = new TypeReference<>() {
    };

    private final DataDirectoryManager directories;
    private final LegacyDatabaseHandler legacyHandler;
    private final ObjectMapper mapper;

    @Inject
    public SettingsStore(DataDirectoryManager directories, LegacyDatabaseHandler legacyHandler) {
        this.directories = directories;
        this.legacyHandler = legacyHandler;
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    // =====================================================================
    // Document
    // =====================================================================

    /**
     * Reads the settings document. Never throws: a missing, unreadable or
     * corrupt file yields an empty map. A corrupt file is moved aside as
     * {@code settings.bad-<millis>.json} so the next save does not destroy it.
     */
    public Map<String, Object> load() {
        Path file;
        try {
            file = directories.settingsPath();
        } catch (DiscoveryException e) {
            LOG.error("Cannot locate settings: {}", e.getMessage());
            return new LinkedHashMap<>();
        }
        if (!Files.exists(file)) {
            LOG.debug("No settings file at {}", file);
            return new LinkedHashMap<>();
        }
        try {
            LinkedHashMap<String, Object> document = mapper.readValue(file.toFile(), DOCUMENT_TYPE);
            return document != null ? document : new LinkedHashMap<>();
        } catch (IOException e) {
            LOG.error("Settings file {} is unreadable, starting with empty settings", file, e);
            preserveCorrupt(file);
            return new LinkedHashMap<>();
        }
    }

    /**
     * Atomically replaces the settings document.
     */
    public void save(Map<String, Object> settings) throws DiscoveryException, IOException {
        Path dir = directories.getDataDir(true);
        Path file = directories.settingsPath();
        Path tmp = dir.resolve(file.getFileName() + TEMP_SUFFIX);
        try {
            mapper.writeValue(tmp.toFile(), settings);
            moveIntoPlace(tmp, file);
            LOG.debug("Saved settings to {}", file);
        } catch (IOException e) {
            Files.deleteIfExists(tmp);
            throw e;
        }
    }

    private void preserveCorrupt(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        String ext = dot > 0 ? name.substring(dot) : "";
        Path aside = file.resolveSibling(base + ".bad-" + System.currentTimeMillis() + ext);
        try {
            Files.move(file, aside);
            LOG.warn("Moved corrupt settings file to {}", aside);
        } catch (IOException e) {
            LOG.warn("Could not move corrupt settings file {} aside", file, e);
        }
    }

    static void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            LOG.warn("Atomic move not supported for {}, falling back to plain replace", target);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    // =====================================================================
    // Database location
    // =====================================================================

    /**
     * Returns the database location, normalizing the stored value first.
     *
     * <ul>
     * <li>Nothing stored: the default, nothing written.</li>
     * <li>Stored path equals the default: forced to non-custom.</li>
     * <li>Stored path directly under the host root, or non-custom and
     * outside the data directory: an old layout. The file is handed to the
     * {@link LegacyDatabaseHandler} and the settings point at the default.
     * If the hand-off fails the stored value is kept and the default is used
     * for this session only.</li>
     * <li>Non-custom inside the data directory but not the default:
     * re-marked as custom.</li>
     * <li>Custom: used if its directory is writable, otherwise the default
     * is used for this session and the stored value is kept.</li>
     * </ul>
     *
     * Failing to persist a normalization is logged, not thrown.
     */
    public DatabaseLocation loadDatabaseLocation() throws DiscoveryException {
        Path defaultPath = normalize(directories.defaultDatabasePath());
        Map<String, Object> settings = load();

        Object rawPath = settings.get(DATABASE_PATH_KEY);
        if (rawPath == null || rawPath.toString().isBlank()) {
            return new DatabaseLocation(defaultPath, false);
        }
        boolean storedCustom = isTrue(settings.get(DATABASE_CUSTOM_KEY));
        Path dataDir = normalize(directories.dataDir());
        Path stored = Path.of(rawPath.toString());
        if (!stored.isAbsolute()) {
            stored = dataDir.resolve(stored);
        }
        stored = normalize(stored);

        if (stored.equals(defaultPath)) {
            if (!Boolean.FALSE.equals(settings.get(DATABASE_CUSTOM_KEY))
                    || !rawPath.toString().equals(defaultPath.toString())) {
                rewrite(settings, defaultPath, false);
            }
            return new DatabaseLocation(defaultPath, false);
        }

        Path hostRoot = normalize(directories.hostRoot().path());
        boolean underHostRoot = hostRoot.equals(stored.getParent());
        if (underHostRoot || (!storedCustom && !stored.startsWith(dataDir))) {
            LOG.info("Settings point at legacy database location {}, moving to {}", stored, defaultPath);
            if (handOff(stored, defaultPath)) {
                rewrite(settings, defaultPath, false);
            } else {
                LOG.error("Keeping stored location {} until it can be imported, using {} for this session",
                        stored, defaultPath);
            }
            return new DatabaseLocation(defaultPath, false);
        }

        if (!storedCustom) {
            LOG.info("Database path {} differs from the default, marking it custom", stored);
            rewrite(settings, stored, true);
            return new DatabaseLocation(stored, true);
        }

        Path parent = stored.getParent();
        if (parent == null || !WriteCheck.isWritableDirectory(parent)) {
            LOG.error("Custom database directory {} is not writable, using {} for this session",
                    parent, defaultPath);
            return new DatabaseLocation(defaultPath, false);
        }
        return new DatabaseLocation(stored, true);
    }

    /**
     * Persists {@code path} as the database location. The custom flag is
     * derived from whether it equals the default.
     */
    public DatabaseLocation saveDatabaseLocation(Path path) throws DiscoveryException, IOException {
        Path target = normalize(path);
        boolean custom = !target.equals(normalize(directories.defaultDatabasePath()));
        Map<String, Object> settings = load();
        settings.put(DATABASE_PATH_KEY, target.toString());
        settings.put(DATABASE_CUSTOM_KEY, custom);
        save(settings);
        LOG.info("Database location set to {} (custom: {})", target, custom);
        return new DatabaseLocation(target, custom);
    }

    /**
     * @return {@code true} if the settings may stop pointing at
     *         {@code legacyPath}: it was adopted, or there is nothing left to adopt
     */
    private boolean handOff(Path legacyPath, Path destination) {
        if (!Files.exists(legacyPath)) {
            LOG.debug("Legacy database {} no longer exists, nothing to import", legacyPath);
            return true;
        }
        try {
            legacyHandler.adopt(legacyPath, destination);
            return true;
        } catch (NoSuchFileException e) {
            LOG.warn("Legacy database {} disappeared during import", legacyPath);
            return !Files.exists(legacyPath);
        } catch (StorageException | IOException e) {
            LOG.error("Importing legacy database {} failed, it stays in place", legacyPath, e);
            return false;
        }
    }

    private void rewrite(Map<String, Object> settings, Path path, boolean custom) {
        settings.put(DATABASE_PATH_KEY, path.toString());
        settings.put(DATABASE_CUSTOM_KEY, custom);
        try {
            save(settings);
        } catch (DiscoveryException | IOException e) {
            LOG.error("Could not persist normalized database location {}", path, e);
        }
    }

    private static boolean isTrue(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return value != null && "true".equalsIgnoreCase(value.toString().strip());
    }

    private static Path normalize(Path path) {
        return path.toAbsolutePath().normalize();
    }
}
