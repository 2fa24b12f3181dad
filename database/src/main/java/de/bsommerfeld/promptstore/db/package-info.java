/**
 * SQLite side of prompt storage: schema upgrades and import of files left
 * behind by older releases.
 *
 * <h2>Flow</h2>
 *
 * <pre>
 *   host root/prompts.db  (legacy)
 *        │
 *        ▼
 *   LegacyFileImporter   ← backup copy, work copy, rename into place
 *        │
 *        ▼
 *   SchemaMigrator       ← per table: rename → create → copy rows → drop backup
 *        │
 *        ▼
 *   RowMapper            ← pure: LegacyRow + FieldCandidates → MappedRow
 * </pre>
 *
 * <h2>Tables</h2>
 *
 * <pre>
 * ┌───────────────────────────────────────────────────────────────────┐
 * │ prompts                                                           │
 * ├──────────────────┬────────────────────────────────────────────────┤
 * │ id  (PK, auto)   │ kept from the legacy row                       │
 * │ positive_prompt  │ NOT NULL, trimmed, "" if nothing usable        │
 * │ negative_prompt  │ NULL when empty                                │
 * │ rating           │ 1..5 or NULL (CHECK constraint)                │
 * │ hash             │ UNIQUE; duplicates are skipped                 │
 * │ created_at       │ legacy value or migration time (UTC)           │
 * │ updated_at       │ legacy value, else created_at                  │
 * └──────────────────┴────────────────────────────────────────────────┘
 *
 * ┌───────────────────────────────────────────────────────────────────┐
 * │ generated_images                                                  │
 * ├──────────────────┬────────────────────────────────────────────────┤
 * │ id  (PK, auto)   │ kept from the legacy row                       │
 * │ prompt_id        │ FK → prompts(id) ON DELETE CASCADE             │
 * │ image_path       │ NOT NULL; rows without one are skipped         │
 * │ filename         │ legacy value or basename of image_path         │
 * │ format           │ legacy value or file extension                 │
 * └──────────────────┴────────────────────────────────────────────────┘
 * </pre>
 *
 * All DDL lives in {@code sql/*.sql} and is read through {@link de.bsommerfeld.promptstore.db.SqlLoader}.
 */
package de.bsommerfeld.promptstore.db;
