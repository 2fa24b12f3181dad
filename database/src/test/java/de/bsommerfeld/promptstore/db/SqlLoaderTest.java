package de.bsommerfeld.promptstore.db;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SqlLoaderTest {

    @Test
    void load_shouldReturnPromptsTable() {
        String sql = SqlLoader.load("create-prompts");
        assertTrue(sql.toLowerCase().contains("create table if not exists prompts"));
    }

    @Test
    void load_shouldReturnGeneratedImagesWithForeignKey() {
        String sql = SqlLoader.load("create-generated-images");
        assertTrue(sql.contains("REFERENCES prompts(id) ON DELETE CASCADE"));
    }

    @Test
    void load_shouldCacheRepeatCalls() {
        String first = SqlLoader.load("create-prompts");
        String second = SqlLoader.load("create-prompts");
        assertSame(first, second, "Cached calls should return the same String reference");
    }

    @Test
    void load_shouldThrowForNonexistentFile() {
        assertThrows(IllegalStateException.class,
                () -> SqlLoader.load("nonexistent-sql-file"));
    }

    @Test
    void loadStatements_shouldSplitIndexScript() {
        List<String> statements = SqlLoader.loadStatements("create-indexes");
        assertEquals(9, statements.size());
        assertTrue(statements.stream().allMatch(s -> s.startsWith("CREATE INDEX IF NOT EXISTS")));
        assertTrue(statements.stream().noneMatch(s -> s.endsWith(";")));
    }
}
