package de.bsommerfeld.promptstore.core.settings;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.bsommerfeld.promptstore.core.TestHosts;
import de.bsommerfeld.promptstore.core.config.StorageOptions;
import de.bsommerfeld.promptstore.core.error.StorageException;
import de.bsommerfeld.promptstore.core.host.HostEnvironment;
import de.bsommerfeld.promptstore.core.host.RootResolver;
import de.bsommerfeld.promptstore.core.storage.DataDirectoryManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Settings document handling and database location normalization. The
 * legacy hand-off is mocked; importing itself is tested with the importer.
 */
@ExtendWith(MockitoExtension.class)
class SettingsStoreTest {

    @TempDir
    Path tempDir;

    @Mock
    private LegacyDatabaseHandler legacyHandler;

    private Path comfy;
    private DataDirectoryManager directories;
    private SettingsStore store;

    @BeforeEach
    void setUp() throws Exception {
        comfy = TestHosts.comfyTree(tempDir.resolve("ComfyUI"));
        StorageOptions options = StorageOptions.defaults();
        HostEnvironment env = TestHosts.pinnedTo(comfy);
        directories = new DataDirectoryManager(options, new RootResolver(options, env), env);
        store = new SettingsStore(directories, legacyHandler);
    }

    // -- Document --

    @Test
    void load_shouldReturnEmptyWhenMissing() {
        assertTrue(store.load().isEmpty());
    }

    @Test
    void save_shouldPreserveUnknownKeysAndOrder() throws Exception {
        Map<String, Object> settings = new LinkedHashMap<>();
        settings.put("theme", "dark");
        settings.put("pageSize", 50);
        settings.put("nested", Map.of("a", true));
        store.save(settings);

        Map<String, Object> loaded = store.load();

        assertEquals(List.of("theme", "pageSize", "nested"), new ArrayList<>(loaded.keySet()));
        assertEquals("dark", loaded.get("theme"));
        assertEquals(50, loaded.get("pageSize"));
    }

    @Test
    void save_shouldLeaveNoTempFile() throws Exception {
        store.save(Map.of("k", "v"));

        Path settingsFile = directories.settingsPath();
        assertTrue(Files.exists(settingsFile));
        assertFalse(Files.exists(settingsFile.resolveSibling("settings.json" + SettingsStore.TEMP_SUFFIX)));
    }

    @Test
    void load_shouldMoveCorruptFileAside() throws Exception {
        Path settingsFile = directories.getDataDir(true).resolve("settings.json");
        Files.writeString(settingsFile, "{\"databasePath\": ");

        assertTrue(store.load().isEmpty());

        assertFalse(Files.exists(settingsFile));
        try (Stream<Path> files = Files.list(settingsFile.getParent())) {
            assertTrue(files.anyMatch(p -> p.getFileName().toString().startsWith("settings.bad-")));
        }
    }

    @Test
    void load_shouldTreatNonObjectDocumentAsCorrupt() throws Exception {
        Path settingsFile = directories.getDataDir(true).resolve("settings.json");
        Files.writeString(settingsFile, "[1, 2, 3]");

        assertTrue(store.load().isEmpty());
    }

    // -- Database location --

    @Test
    void loadDatabaseLocation_shouldReturnDefaultWithoutWriting() throws Exception {
        DatabaseLocation location = store.loadDatabaseLocation();

        assertEquals(directories.defaultDatabasePath(), location.path());
        assertFalse(location.custom());
        assertFalse(Files.exists(directories.settingsPath()));
    }

    @Test
    void loadDatabaseLocation_shouldForceDefaultToNonCustom() throws Exception {
        store.save(settings(directories.defaultDatabasePath(), true));

        DatabaseLocation location = store.loadDatabaseLocation();

        assertFalse(location.custom());
        assertEquals(false, store.load().get(SettingsStore.DATABASE_CUSTOM_KEY));
    }

    @Test
    void loadDatabaseLocation_shouldHandOffDatabaseUnderHostRoot() throws Exception {
        Path legacy = Files.writeString(comfy.resolve("prompts.db"), "legacy");
        store.save(settings(legacy, true));

        DatabaseLocation location = store.loadDatabaseLocation();

        Path expected = directories.defaultDatabasePath();
        verify(legacyHandler).adopt(legacy, expected);
        assertEquals(expected, location.path());
        assertFalse(location.custom());
        Map<String, Object> saved = store.load();
        assertEquals(expected.toString(), saved.get(SettingsStore.DATABASE_PATH_KEY));
        assertEquals(false, saved.get(SettingsStore.DATABASE_CUSTOM_KEY));
    }

    @Test
    void loadDatabaseLocation_shouldTreatNonCustomOutsidePathAsLegacy() throws Exception {
        Path outside = Files.createDirectories(tempDir.resolve("old")).resolve("prompts.db");
        Files.writeString(outside, "legacy");
        store.save(settings(outside, false));

        DatabaseLocation location = store.loadDatabaseLocation();

        verify(legacyHandler).adopt(outside, directories.defaultDatabasePath());
        assertEquals(directories.defaultDatabasePath(), location.path());
    }

    @Test
    void loadDatabaseLocation_shouldSkipHandOffForVanishedLegacyFile() throws Exception {
        store.save(settings(comfy.resolve("prompts.db"), false));

        DatabaseLocation location = store.loadDatabaseLocation();

        verifyNoInteractions(legacyHandler);
        assertEquals(directories.defaultDatabasePath(), location.path());
    }

    @Test
    void loadDatabaseLocation_shouldSurviveFailedHandOff() throws Exception {
        Path legacy = Files.writeString(comfy.resolve("prompts.db"), "legacy");
        store.save(settings(legacy, false));
        doThrow(new StorageException("boom")).when(legacyHandler).adopt(any(), any());

        DatabaseLocation location = store.loadDatabaseLocation();

        assertEquals(directories.defaultDatabasePath(), location.path());
        assertTrue(Files.exists(legacy));
        assertEquals(legacy.toString(), store.load().get(SettingsStore.DATABASE_PATH_KEY));
    }

    @Test
    void loadDatabaseLocation_shouldKeepStoredPathUntilHandOffSucceeds() throws Exception {
        Path legacy = Files.writeString(Files.createDirectories(tempDir.resolve("old")).resolve("mydata.sqlite"),
                "legacy");
        store.save(settings(legacy, false));
        doThrow(new StorageException("locked")).doNothing().when(legacyHandler).adopt(any(), any());

        store.loadDatabaseLocation();
        Map<String, Object> afterFailure = store.load();
        store.loadDatabaseLocation();

        assertEquals(legacy.toString(), afterFailure.get(SettingsStore.DATABASE_PATH_KEY));
        assertEquals(false, afterFailure.get(SettingsStore.DATABASE_CUSTOM_KEY));
        verify(legacyHandler, times(2)).adopt(legacy, directories.defaultDatabasePath());
        assertEquals(directories.defaultDatabasePath().toString(), store.load().get(SettingsStore.DATABASE_PATH_KEY));
    }

    @Test
    void loadDatabaseLocation_shouldMarkNonDefaultInsideDataDirAsCustom() throws Exception {
        Path inside = directories.getDataDir(true).resolve("archive/other.db");
        store.save(settings(inside, false));

        DatabaseLocation location = store.loadDatabaseLocation();

        assertEquals(inside, location.path());
        assertTrue(location.custom());
        assertEquals(true, store.load().get(SettingsStore.DATABASE_CUSTOM_KEY));
        verifyNoInteractions(legacyHandler);
    }

    @Test
    void loadDatabaseLocation_shouldAcceptWritableCustomPath() throws Exception {
        Path custom = tempDir.resolve("nas/prompts.db");
        store.save(settings(custom, true));

        DatabaseLocation location = store.loadDatabaseLocation();

        assertEquals(custom, location.path());
        assertTrue(location.custom());
    }

    @Test
    void loadDatabaseLocation_shouldUseDefaultForUnwritableCustomPathWithoutRewriting() throws Exception {
        Path blocker = Files.writeString(tempDir.resolve("blocker"), "file, not a directory");
        Path custom = blocker.resolve("prompts.db");
        store.save(settings(custom, true));
        String before = Files.readString(directories.settingsPath());

        DatabaseLocation location = store.loadDatabaseLocation();

        assertEquals(directories.defaultDatabasePath(), location.path());
        assertFalse(location.custom());
        assertEquals(before, Files.readString(directories.settingsPath()));
    }

    @Test
    void saveDatabaseLocation_shouldDeriveCustomFlag() throws Exception {
        assertFalse(store.saveDatabaseLocation(directories.defaultDatabasePath()).custom());
        assertTrue(store.saveDatabaseLocation(tempDir.resolve("x/prompts.db")).custom());
    }

    @Test
    void saveDatabaseLocation_shouldNeverWriteNonCustomForOtherPaths() throws Exception {
        List<Path> candidates = List.of(
                directories.defaultDatabasePath(),
                tempDir.resolve("a/prompts.db"),
                directories.getDataDir(true).resolve("b.db"));
        ObjectMapper mapper = new ObjectMapper();
        for (Path candidate : candidates) {
            store.saveDatabaseLocation(candidate);
            Map<?, ?> written = mapper.readValue(directories.settingsPath().toFile(), Map.class);
            if (Boolean.FALSE.equals(written.get(SettingsStore.DATABASE_CUSTOM_KEY))) {
                assertEquals(directories.defaultDatabasePath().toString(), written.get(SettingsStore.DATABASE_PATH_KEY));
            }
        }
    }

    private static Map<String, Object> settings(Path path, boolean custom) {
        Map<String, Object> settings = new LinkedHashMap<>();
        settings.put(SettingsStore.DATABASE_PATH_KEY, path.toString());
        settings.put(SettingsStore.DATABASE_CUSTOM_KEY, custom);
        return settings;
    }
}
