package de.bsommerfeld.promptstore.db.migration;

import java.util.Optional;

/**
 * One cell of a legacy row as the driver returned it. SQLite columns carry
 * no enforced type, so the same column may hold text in one row and an
 * integer in the next.
 *
 * @param raw the driver value, possibly {@code null}
 */
public record Value(Object raw) {

    static final Value ABSENT = new Value(null);

    /** {@code null} or the empty string. */
    public boolean isBlank() {
        return raw == null || raw.toString().isEmpty();
    }

    public Optional<String> text() {
        return isBlank() ? Optional.empty() : Optional.of(raw.toString());
    }

    /**
     * Integer reading of the cell. Numbers are truncated, strings must parse
     * as a whole number; anything else is empty.
     */
    public Optional<Long> integer() {
        if (raw instanceof Number) {
            return Optional.of(((Number) raw).longValue());
        }
        if (raw instanceof String) {
            try {
                return Optional.of(Long.parseLong(((String) raw).strip()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }
}
