package de.bsommerfeld.promptstore.db.migration;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * A row read from a table of unknown layout. Column lookups ignore case,
 * as SQLite does.
 */
public final class LegacyRow {

    private final Map<String, Value> cells;

    public LegacyRow(Map<String, ?> values) {
        Map<String, Value> copy = new LinkedHashMap<>();
        values.forEach((column, value) -> copy.put(column.toLowerCase(Locale.ROOT), new Value(value)));
        this.cells = Collections.unmodifiableMap(copy);
    }

    /**
     * Reads the current row of {@code rs}.
     */
    public static LegacyRow from(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        Map<String, Object> values = new LinkedHashMap<>();
        for (int i = 1; i <= meta.getColumnCount(); i++) {
            values.put(meta.getColumnName(i), rs.getObject(i));
        }
        return new LegacyRow(values);
    }

    /**
     * The cell for {@code column}, or an absent value if the row has no such
     * column.
     */
    public Value get(String column) {
        return cells.getOrDefault(column.toLowerCase(Locale.ROOT), Value.ABSENT);
    }

    public boolean has(String column) {
        return cells.containsKey(column.toLowerCase(Locale.ROOT));
    }

    @Override
    public String toString() {
        return "LegacyRow" + cells.keySet();
    }
}
