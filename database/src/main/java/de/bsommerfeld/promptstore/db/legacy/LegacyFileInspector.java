package de.bsommerfeld.promptstore.db.legacy;

import de.bsommerfeld.promptstore.core.config.StorageOptions;
import de.bsommerfeld.promptstore.core.error.DiscoveryException;
import de.bsommerfeld.promptstore.core.host.RootResolver;
import de.bsommerfeld.promptstore.db.SqlLoader;
import de.bsommerfeld.promptstore.db.SqliteConnections;
import de.bsommerfeld.promptstore.db.migration.ManagedTable;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Reports which legacy files {@link LegacyFileImporter} would pick up,
 * without touching them. Databases are opened read-only for statistics.
 */
@Singleton
public class LegacyFileInspector {

    private static final Logger LOG = LoggerFactory.getLogger(LegacyFileInspector.class);

    private final StorageOptions options;
    private final RootResolver rootResolver;

    @Inject
    public LegacyFileInspector(StorageOptions options, RootResolver rootResolver) {
        this.options = options;
        this.rootResolver = rootResolver;
    }

    public LegacyScan inspect() throws DiscoveryException {
        Path root = rootResolver.resolve().path();
        List<LegacyScan.LegacyFile> found = new ArrayList<>();
        for (String name : options.legacyFileNames()) {
            Path path = root.resolve(name);
            if (!Files.isRegularFile(path)) {
                continue;
            }
            try {
                long size = Files.size(path);
                LegacyScan.DatabaseStats stats = options.isDatabaseFile(name) ? stats(path) : null;
                found.add(new LegacyScan.LegacyFile(name, path, size,
                        Files.getLastModifiedTime(path).toInstant(), stats));
            } catch (IOException e) {
                LOG.warn("Cannot read attributes of legacy file {}", path, e);
            }
        }
        return new LegacyScan(root, found);
    }

    private LegacyScan.DatabaseStats stats(Path file) {
        try (Connection conn = SqliteConnections.openReadOnly(file)) {
            Set<String> tables = SqliteConnections.tableNames(conn);
            String prompts = ManagedTable.PROMPTS.tableName();
            String images = ManagedTable.GENERATED_IMAGES.tableName();
            long promptCount = tables.contains(prompts) ? SqliteConnections.countRows(conn, prompts) : 0;
            long imageCount = tables.contains(images) ? SqliteConnections.countRows(conn, images) : 0;
            long categories = 0;
            if (tables.contains(prompts)) {
                try (Statement stmt = conn.createStatement();
                        ResultSet rs = stmt.executeQuery(SqlLoader.load("count-distinct-categories"))) {
                    categories = rs.next() ? rs.getLong(1) : 0;
                } catch (SQLException e) {
                    LOG.debug("No category column in {}: {}", file, e.getMessage());
                }
            }
            return new LegacyScan.DatabaseStats(promptCount, imageCount, categories);
        } catch (SQLException e) {
            LOG.error("Error reading legacy database stats from {}", file, e);
            return null;
        }
    }
}
