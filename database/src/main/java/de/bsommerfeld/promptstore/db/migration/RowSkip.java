package de.bsommerfeld.promptstore.db.migration;

/**
 * A legacy row that was left out of a rewrite.
 *
 * @param table  the table being rewritten
 * @param rowId  the legacy row's id as text, or {@code null} if it had none
 * @param reason why it was left out
 * @param detail human-readable specifics
 */
public record RowSkip(String table, String rowId, SkipReason reason, String detail) {
}
