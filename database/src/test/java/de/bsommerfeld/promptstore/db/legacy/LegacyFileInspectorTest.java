package de.bsommerfeld.promptstore.db.legacy;

import de.bsommerfeld.promptstore.core.config.StorageOptions;
import de.bsommerfeld.promptstore.core.host.RootResolver;
import de.bsommerfeld.promptstore.db.TestDatabases;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class LegacyFileInspectorTest {

    @TempDir
    Path tempDir;

    private Path comfy;
    private LegacyFileInspector inspector;

    @BeforeEach
    void setUp() throws Exception {
        comfy = TestDatabases.comfyTree(tempDir.resolve("ComfyUI"));
        StorageOptions options = StorageOptions.defaults();
        inspector = new LegacyFileInspector(options, new RootResolver(options, TestDatabases.pinnedTo(comfy)));
    }

    @Test
    void inspect_shouldFindNothingOnCleanRoot() throws Exception {
        LegacyScan scan = inspector.inspect();

        assertEquals(comfy, scan.root());
        assertFalse(scan.found());
    }

    @Test
    void inspect_shouldReportDatabaseStatistics() throws Exception {
        TestDatabases.legacyPrompts(comfy.resolve("prompts.db"), 7);

        LegacyScan scan = inspector.inspect();

        assertTrue(scan.found());
        LegacyScan.LegacyFile file = scan.files().get(0);
        assertEquals("prompts.db", file.fileName());
        assertTrue(file.size() > 0);
        assertEquals(new LegacyScan.DatabaseStats(7, 0, 3), file.stats());
    }

    @Test
    void inspect_shouldLeaveFilesUntouched() throws Exception {
        Path db = TestDatabases.legacyPrompts(comfy.resolve("prompts.db"), 2);
        byte[] before = Files.readAllBytes(db);

        inspector.inspect();

        assertArrayEquals(before, Files.readAllBytes(db));
        assertFalse(Files.exists(comfy.resolve("prompts.db-journal")));
    }

    @Test
    void inspect_shouldListSettingsFilesWithoutStats() throws Exception {
        Files.writeString(comfy.resolve("promptmanager_settings.json"), "{}");

        LegacyScan.LegacyFile file = inspector.inspect().files().get(0);

        assertEquals("promptmanager_settings.json", file.fileName());
        assertNull(file.stats());
    }

    @Test
    void inspect_shouldReturnNullStatsForUnreadableDatabase() throws Exception {
        Files.writeString(comfy.resolve("example_prompts.db"), "not sqlite\n".repeat(300));

        LegacyScan.LegacyFile file = inspector.inspect().files().get(0);

        assertEquals("example_prompts.db", file.fileName());
        assertNull(file.stats());
    }

    @Test
    void inspect_shouldIgnoreDirectoriesWithLegacyNames() throws Exception {
        Files.createDirectories(comfy.resolve("prompts.db"));

        assertFalse(inspector.inspect().found());
    }
}
