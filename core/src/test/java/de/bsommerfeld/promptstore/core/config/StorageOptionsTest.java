package de.bsommerfeld.promptstore.core.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StorageOptionsTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty(StorageOptions.EXTENSION_NAME_PROPERTY);
        System.clearProperty(StorageOptions.DATABASE_FILE_PROPERTY);
    }

    @Test
    void defaults_shouldDescribeComfyLayout() {
        StorageOptions options = StorageOptions.defaults();

        assertEquals("PromptManager", options.extensionName());
        assertEquals("prompts.db", options.databaseFileName());
        assertEquals("settings.json", options.settingsFileName());
        assertEquals("COMFYUI_PATH", options.rootOverrideVariable());
        assertEquals("custom_nodes", options.containerFolderName());
        assertEquals(3, options.markerSets().size());
        assertTrue(options.legacyFileNames().contains("prompts.db.866_backup"));
    }

    @Test
    void fromSystem_shouldReadSystemProperties() {
        System.setProperty(StorageOptions.EXTENSION_NAME_PROPERTY, "PromptVault");
        System.setProperty(StorageOptions.DATABASE_FILE_PROPERTY, "vault.db");

        StorageOptions options = StorageOptions.fromSystem();

        assertEquals("PromptVault", options.extensionName());
        assertEquals("vault.db", options.databaseFileName());
    }

    @Test
    void fromSystem_shouldIgnoreValuesContainingSeparators() {
        System.setProperty(StorageOptions.EXTENSION_NAME_PROPERTY, "../escape");

        assertEquals("PromptManager", StorageOptions.fromSystem().extensionName());
    }

    @Test
    void constructor_shouldRejectBlankDatabaseName() {
        StorageOptions d = StorageOptions.defaults();
        assertThrows(IllegalArgumentException.class, () -> new StorageOptions(d.extensionName(), " ",
                d.settingsFileName(), d.rootOverrideVariable(), d.containerFolderName(),
                d.markerSets(), d.legacyFileNames()));
    }

    @Test
    void isDatabaseFile_shouldRecognizeDatabasesAndTheirBackups() {
        StorageOptions options = StorageOptions.defaults();

        assertTrue(options.isDatabaseFile("prompts.db"));
        assertTrue(options.isDatabaseFile("prompts.db.866_backup"));
        assertTrue(options.isDatabaseFile("example_prompts.db"));
        assertFalse(options.isDatabaseFile("promptmanager_settings.json"));
    }
}
