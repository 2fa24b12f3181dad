package de.bsommerfeld.promptstore.db;

import de.bsommerfeld.promptstore.core.config.StorageOptions;
import de.bsommerfeld.promptstore.core.host.HostEnvironment;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Optional;

import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Fixtures for tests that need real SQLite files or a host tree.
 */
public final class TestDatabases {

    private TestDatabases() {
    }

    /**
     * Creates a SQLite file at {@code file} and runs {@code statements} on it.
     */
    public static Path create(Path file, String... statements) throws SQLException {
        try (Connection conn = SqliteConnections.open(file);
                Statement stmt = conn.createStatement()) {
            for (String sql : statements) {
                stmt.execute(sql);
            }
        }
        return file;
    }

    /**
     * A pre-release {@code prompts} table holding {@code rows} prompts.
     */
    public static Path legacyPrompts(Path file, int rows) throws SQLException {
        create(file, "CREATE TABLE prompts (id INTEGER PRIMARY KEY, text TEXT, category TEXT, "
                + "tags TEXT, rating INTEGER, notes TEXT, hash TEXT, created_at TEXT, updated_at TEXT)");
        try (Connection conn = SqliteConnections.open(file);
                Statement stmt = conn.createStatement()) {
            for (int i = 1; i <= rows; i++) {
                stmt.execute("INSERT INTO prompts (id, text, category, hash) VALUES ("
                        + i + ", 'prompt " + i + "', 'cat" + (i % 3) + "', 'h" + i + "')");
            }
        }
        return file;
    }

    public static long count(Path file, String table) throws SQLException {
        try (Connection conn = SqliteConnections.open(file)) {
            return SqliteConnections.countRows(conn, table);
        }
    }

    public static Path comfyTree(Path root) throws IOException {
        Files.createDirectories(root.resolve("web"));
        Files.createDirectories(root.resolve("comfy"));
        Files.createDirectories(root.resolve("custom_nodes"));
        Files.createDirectories(root.resolve("user"));
        return root;
    }

    public static HostEnvironment pinnedTo(Path root) {
        HostEnvironment env = mock(HostEnvironment.class);
        when(env.getenv(StorageOptions.ROOT_OVERRIDE_VARIABLE)).thenReturn(Optional.of(root.toString()));
        lenient().when(env.getenv(StorageOptions.USER_DIR_OVERRIDE_VARIABLE)).thenReturn(Optional.empty());
        return env;
    }
}
