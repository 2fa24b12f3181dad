package de.bsommerfeld.promptstore.db.migration;

import com.google.common.collect.ImmutableList;

import java.util.Optional;

/**
 * Ordered list of legacy column names that may hold a canonical field.
 * The first non-blank one wins.
 */
public record FieldCandidates(ImmutableList<String> columns) {

    public static FieldCandidates of(String... columns) {
        return new FieldCandidates(ImmutableList.copyOf(columns));
    }

    public Optional<Value> first(LegacyRow row) {
        for (String column : columns) {
            Value value = row.get(column);
            if (!value.isBlank()) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    public Optional<String> firstText(LegacyRow row) {
        return first(row).flatMap(Value::text);
    }

    /** Raw value of the first non-blank candidate, or {@code null}. */
    public Object firstRaw(LegacyRow row) {
        return first(row).map(Value::raw).orElse(null);
    }
}
