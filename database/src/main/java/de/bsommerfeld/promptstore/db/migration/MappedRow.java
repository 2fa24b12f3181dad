package de.bsommerfeld.promptstore.db.migration;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A legacy row translated to canonical columns, or the reason it could not be.
 *
 * @param values     canonical column to value, in insert order; empty when skipped
 * @param skipReason {@code null} unless the row is skipped
 * @param detail     explanation accompanying {@code skipReason}
 */
public record MappedRow(Map<String, Object> values, SkipReason skipReason, String detail) {

    static MappedRow of(LinkedHashMap<String, Object> values) {
        return new MappedRow(Collections.unmodifiableMap(values), null, null);
    }

    static MappedRow skip(SkipReason reason, String detail) {
        return new MappedRow(Map.of(), reason, detail);
    }

    public boolean skipped() {
        return skipReason != null;
    }
}
