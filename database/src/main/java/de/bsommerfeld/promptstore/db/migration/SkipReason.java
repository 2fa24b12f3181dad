package de.bsommerfeld.promptstore.db.migration;

/**
 * Why a legacy row was not carried into the rewritten table.
 */
public enum SkipReason {

    /** The parent reference does not parse as an integer id. */
    UNPARSEABLE_PARENT_REFERENCE,

    /** A column the canonical table requires has no usable source. */
    MISSING_REQUIRED_VALUE,

    /** SQLite refused the mapped row, e.g. a duplicate unique value. */
    INSERT_REJECTED
}
