package de.bsommerfeld.promptstore.db.migration;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import java.util.Set;
import java.util.function.BiFunction;

/**
 * Tables the migrator owns, parents before children.
 */
public enum ManagedTable {

    PROMPTS("prompts", "create-prompts", RowMapper.PROMPT_COLUMNS,
            ImmutableSet.of("prompt", "text", "workflow_name"), RowMapper::mapPrompt),

    GENERATED_IMAGES("generated_images", "create-generated-images", RowMapper.IMAGE_COLUMNS,
            ImmutableSet.of("file_path", "file_name", "metadata"), RowMapper::mapGeneratedImage);

    private final String tableName;
    private final String createResource;
    private final ImmutableList<String> columns;
    private final ImmutableSet<String> legacyMarkers;
    private final BiFunction<LegacyRow, String, MappedRow> mapper;

    ManagedTable(String tableName, String createResource, ImmutableList<String> columns,
            ImmutableSet<String> legacyMarkers, BiFunction<LegacyRow, String, MappedRow> mapper) {
        this.tableName = tableName;
        this.createResource = createResource;
        this.columns = columns;
        this.legacyMarkers = legacyMarkers;
        this.mapper = mapper;
    }

    public String tableName() {
        return tableName;
    }

    public String backupTableName() {
        return tableName + "__legacy_backup";
    }

    String createResource() {
        return createResource;
    }

    public ImmutableList<String> columns() {
        return columns;
    }

    /**
     * A table needs rewriting if a canonical column is missing or an
     * old-layout column is present. {@code existing} must be lower case.
     */
    public boolean needsRewrite(Set<String> existing) {
        if (!existing.containsAll(columns)) {
            return true;
        }
        for (String marker : legacyMarkers) {
            if (existing.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    MappedRow map(LegacyRow row, String now) {
        return mapper.apply(row, now);
    }
}
