package de.bsommerfeld.promptstore.core.config;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fixed layout knowledge about the host application and this extension's
 * storage. Everything here is read-only during discovery and import.
 *
 * @param extensionName       directory name under {@code user/default/}
 * @param databaseFileName    file name of the prompt database
 * @param settingsFileName    file name of the settings document
 * @param rootOverrideVariable environment variable that pins the host root
 * @param containerFolderName the host's plugin-container folder name
 * @param markerSets          name pairs whose co-occurrence identifies the host root
 * @param legacyFileNames     historical file names found directly under the host root
 */
public record StorageOptions(
        String extensionName,
        String databaseFileName,
        String settingsFileName,
        String rootOverrideVariable,
        String containerFolderName,
        ImmutableList<ImmutableSet<String>> markerSets,
        ImmutableList<String> legacyFileNames) {

    private static final Logger LOG = LoggerFactory.getLogger(StorageOptions.class);

    public static final String DEFAULT_EXTENSION_NAME = "PromptManager";
    public static final String DEFAULT_DATABASE_FILE = "prompts.db";
    public static final String SETTINGS_FILE = "settings.json";
    public static final String ROOT_OVERRIDE_VARIABLE = "COMFYUI_PATH";
    public static final String USER_DIR_OVERRIDE_VARIABLE = "COMFYUI_USER_DIR";
    public static final String CONTAINER_FOLDER = "custom_nodes";

    static final String EXTENSION_NAME_PROPERTY = "promptstore.extension-name";
    static final String DATABASE_FILE_PROPERTY = "promptstore.database-file";

    private static final ImmutableList<ImmutableSet<String>> MARKER_SETS = ImmutableList.of(
            ImmutableSet.of("web", "comfy"),
            ImmutableSet.of("web", "custom_nodes"),
            ImmutableSet.of("server.py", "main.py"));

    private static final ImmutableList<String> LEGACY_FILES = ImmutableList.of(
            "prompts.db",
            "prompts.db.866_backup",
            "example_prompts.db",
            "promptmanager_settings.json",
            "prompt_manager_settings.json");

    public StorageOptions {
        if (extensionName == null || extensionName.isBlank()) {
            throw new IllegalArgumentException("extensionName must not be blank");
        }
        if (databaseFileName == null || databaseFileName.isBlank()) {
            throw new IllegalArgumentException("databaseFileName must not be blank");
        }
    }

    /**
     * Built-in layout of a ComfyUI installation.
     */
    public static StorageOptions defaults() {
        return new StorageOptions(
                DEFAULT_EXTENSION_NAME,
                DEFAULT_DATABASE_FILE,
                SETTINGS_FILE,
                ROOT_OVERRIDE_VARIABLE,
                CONTAINER_FOLDER,
                MARKER_SETS,
                LEGACY_FILES);
    }

    /**
     * Defaults with the extension name and database file taken from system
     * properties or environment variables when present. The environment
     * variable name is the property name upper-cased with separators replaced
     * by underscores ({@code PROMPTSTORE_EXTENSION_NAME}).
     */
    public static StorageOptions fromSystem() {
        String extension = lookup(EXTENSION_NAME_PROPERTY, DEFAULT_EXTENSION_NAME);
        String database = lookup(DATABASE_FILE_PROPERTY, DEFAULT_DATABASE_FILE);
        StorageOptions defaults = defaults();
        return new StorageOptions(extension, database, defaults.settingsFileName(),
                defaults.rootOverrideVariable(), defaults.containerFolderName(),
                defaults.markerSets(), defaults.legacyFileNames());
    }

    /**
     * Returns {@code true} for legacy names that hold SQLite data.
     */
    public boolean isDatabaseFile(String fileName) {
        return fileName.endsWith(".db") || fileName.startsWith(databaseFileName);
    }

    private static String lookup(String property, String fallback) {
        String value = System.getProperty(property);
        if (value == null || value.isBlank()) {
            value = System.getenv(property.toUpperCase().replace('.', '_').replace('-', '_'));
        }
        if (value == null || value.isBlank()) {
            return fallback;
        }
        if (value.contains("/") || value.contains("\\")) {
            LOG.warn("Ignoring '{}' for {}: must be a plain name. Using '{}'.", value, property, fallback);
            return fallback;
        }
        return value.strip();
    }
}
