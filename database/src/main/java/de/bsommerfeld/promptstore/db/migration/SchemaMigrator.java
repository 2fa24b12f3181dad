package de.bsommerfeld.promptstore.db.migration;

import de.bsommerfeld.promptstore.db.SqlLoader;
import de.bsommerfeld.promptstore.db.SqliteConnections;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Brings the managed tables of a database to the current layout in place.
 *
 * <h3>Rewrite</h3>
 * A table is rewritten when it lacks a current column or still has a column
 * from an older layout. Per table, inside one transaction:
 * <ol>
 * <li>drop a leftover {@code <table>__legacy_backup}</li>
 * <li>rename the table to the backup name</li>
 * <li>create the current table</li>
 * <li>copy each row through {@link RowMapper}, keeping its id</li>
 * <li>drop the backup once every row is either copied or recorded as a
 * {@link RowSkip}</li>
 * </ol>
 * Foreign key enforcement is off for the duration and restored afterwards,
 * including after a rollback. {@code legacy_alter_table} is switched on so
 * renaming a parent table does not rewrite the child's foreign key to point
 * at the backup.
 *
 * <p>
 * Running this on an up-to-date database changes nothing.
 */
@Singleton
public class SchemaMigrator {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaMigrator.class);

    private final Clock clock;

    @Inject
    public SchemaMigrator() {
        this(Clock.systemUTC());
    }

    SchemaMigrator(Clock clock) {
        this.clock = clock;
    }

    /**
     * Migrates every managed table, then (re)creates the indexes. Commits
     * any transaction the caller left open on {@code conn}.
     *
     * @return one outcome per managed table, parents first
     */
    public List<MigrationOutcome> migrate(Connection conn) throws SQLException {
        List<MigrationOutcome> outcomes = new ArrayList<>();
        for (ManagedTable table : ManagedTable.values()) {
            outcomes.add(migrateTable(conn, table));
        }
        createIndexes(conn);
        return outcomes;
    }

    /**
     * Returns {@code true} if {@link #migrate} would rewrite any table.
     */
    public boolean needsMigration(Connection conn) throws SQLException {
        for (ManagedTable table : ManagedTable.values()) {
            Set<String> columns = columns(conn, table.tableName());
            if (!columns.isEmpty() && table.needsRewrite(columns)) {
                return true;
            }
        }
        return false;
    }

    private MigrationOutcome migrateTable(Connection conn, ManagedTable table) throws SQLException {
        Set<String> columns = columns(conn, table.tableName());
        if (columns.isEmpty()) {
            execute(conn, SqlLoader.load(table.createResource()));
            LOG.debug("Created table {}", table.tableName());
            return MigrationOutcome.unchanged(table.tableName());
        }
        if (!table.needsRewrite(columns)) {
            LOG.debug("Table {} is current", table.tableName());
            return MigrationOutcome.unchanged(table.tableName());
        }

        LOG.info("Migrating legacy {} table to the current schema", table.tableName());
        boolean autoCommit = conn.getAutoCommit();
        conn.setAutoCommit(true);
        boolean foreignKeys = pragma(conn, "foreign_keys");
        boolean legacyAlter = pragma(conn, "legacy_alter_table");
        MigrationOutcome outcome;
        try {
            setPragma(conn, "foreign_keys", false);
            setPragma(conn, "legacy_alter_table", true);
            conn.setAutoCommit(false);
            try {
                outcome = rewrite(conn, table);
                conn.commit();
            } catch (SQLException | RuntimeException e) {
                LOG.error("Migration of {} failed, rolling back", table.tableName(), e);
                conn.rollback();
                throw e;
            }
        } finally {
            conn.setAutoCommit(true);
            setPragma(conn, "legacy_alter_table", legacyAlter);
            setPragma(conn, "foreign_keys", foreignKeys);
            conn.setAutoCommit(autoCommit);
        }

        LOG.info("Migrated {}: {} rows carried over, {} skipped",
                table.tableName(), outcome.migrated(), outcome.skipped().size());
        return outcome;
    }

    private MigrationOutcome rewrite(Connection conn, ManagedTable table) throws SQLException {
        String name = table.tableName();
        String backup = table.backupTableName();
        String now = DateTimeFormatter.ISO_INSTANT.format(Instant.now(clock));

        execute(conn, "DROP TABLE IF EXISTS " + SqliteConnections.quote(backup));
        execute(conn, "ALTER TABLE " + SqliteConnections.quote(name)
                + " RENAME TO " + SqliteConnections.quote(backup));
        execute(conn, SqlLoader.load(table.createResource()));

        long legacyCount = SqliteConnections.countRows(conn, backup);
        long migrated = 0;
        List<RowSkip> skipped = new ArrayList<>();

        try (PreparedStatement insert = conn.prepareStatement(insertSql(table));
                Statement select = conn.createStatement();
                ResultSet rs = select.executeQuery("SELECT * FROM " + SqliteConnections.quote(backup))) {
            while (rs.next()) {
                LegacyRow row = LegacyRow.from(rs);
                String rowId = row.get("id").text().orElse(null);
                MappedRow mapped = table.map(row, now);
                if (mapped.skipped()) {
                    skipped.add(skip(name, rowId, mapped.skipReason(), mapped.detail()));
                    continue;
                }
                bind(insert, table, mapped.values());
                try {
                    insert.executeUpdate();
                    migrated++;
                } catch (SQLException e) {
                    skipped.add(skip(name, rowId, SkipReason.INSERT_REJECTED, e.getMessage()));
                }
            }
        }

        long current = SqliteConnections.countRows(conn, name);
        if (current + skipped.size() == legacyCount) {
            execute(conn, "DROP TABLE " + SqliteConnections.quote(backup));
        } else {
            LOG.error("Row count mismatch migrating {}: {} legacy, {} migrated, {} skipped. Keeping {}",
                    name, legacyCount, current, skipped.size(), backup);
        }
        return new MigrationOutcome(name, true, migrated, skipped);
    }

    private static RowSkip skip(String table, String rowId, SkipReason reason, String detail) {
        LOG.warn("Skipping {} row {}: {} ({})", table, rowId, reason, detail);
        return new RowSkip(table, rowId, reason, detail);
    }

    private static String insertSql(ManagedTable table) {
        String columns = String.join(", ", table.columns());
        String placeholders = table.columns().stream().map(c -> "?").collect(Collectors.joining(", "));
        return "INSERT INTO " + SqliteConnections.quote(table.tableName())
                + " (" + columns + ") VALUES (" + placeholders + ")";
    }

    private static void bind(PreparedStatement insert, ManagedTable table, Map<String, Object> values)
            throws SQLException {
        List<String> columns = table.columns();
        for (int i = 0; i < columns.size(); i++) {
            insert.setObject(i + 1, values.get(columns.get(i)));
        }
    }

    private static void createIndexes(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            for (String sql : SqlLoader.loadStatements("create-indexes")) {
                stmt.execute(sql);
            }
        }
    }

    /**
     * Lower-cased column names of {@code table}, empty if it does not exist.
     */
    static Set<String> columns(Connection conn, String table) throws SQLException {
        Set<String> columns = new LinkedHashSet<>();
        try (Statement stmt = conn.createStatement();
                ResultSet rs = stmt.executeQuery("PRAGMA table_info(" + SqliteConnections.quote(table) + ")")) {
            while (rs.next()) {
                columns.add(rs.getString("name").toLowerCase(Locale.ROOT));
            }
        }
        return columns;
    }

    private static boolean pragma(Connection conn, String name) throws SQLException {
        try (Statement stmt = conn.createStatement();
                ResultSet rs = stmt.executeQuery("PRAGMA " + name)) {
            return rs.next() && rs.getInt(1) != 0;
        }
    }

    private static void setPragma(Connection conn, String name, boolean on) throws SQLException {
        execute(conn, "PRAGMA " + name + " = " + (on ? "ON" : "OFF"));
    }

    private static void execute(Connection conn, String sql) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            stmt.execute(sql);
        }
    }
}
