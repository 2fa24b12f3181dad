package de.bsommerfeld.promptstore.db.migration;

import com.google.common.collect.ImmutableList;

import java.util.LinkedHashMap;
import java.util.Optional;

/**
 * Translates legacy rows into canonical column values. No I/O, no state:
 * the same row and timestamp always produce the same result.
 */
public final class RowMapper {

    public static final ImmutableList<String> PROMPT_COLUMNS = ImmutableList.of(
            "id", "positive_prompt", "negative_prompt", "category", "tags", "rating", "notes",
            "hash", "model_hash", "sampler_settings", "generation_params", "created_at", "updated_at");

    public static final ImmutableList<String> IMAGE_COLUMNS = ImmutableList.of(
            "id", "prompt_id", "image_path", "filename", "generation_time", "file_size",
            "width", "height", "format", "workflow_data", "prompt_metadata", "parameters");

    static final FieldCandidates POSITIVE = FieldCandidates.of("positive_prompt", "prompt", "text", "positive");
    static final FieldCandidates NEGATIVE = FieldCandidates.of("negative_prompt", "negative", "negative_text");
    static final FieldCandidates SAMPLER = FieldCandidates.of("sampler_settings", "sampler_config");
    static final FieldCandidates GENERATION = FieldCandidates.of("generation_params", "metadata");
    static final FieldCandidates CREATED = FieldCandidates.of("created_at", "created");
    static final FieldCandidates UPDATED = FieldCandidates.of("updated_at", "updated");

    static final FieldCandidates IMAGE_PATH = FieldCandidates.of("image_path", "file_path", "path", "filepath");
    static final FieldCandidates FILENAME = FieldCandidates.of("filename", "file_name", "name");
    static final FieldCandidates FORMAT = FieldCandidates.of("format", "image_format");
    static final FieldCandidates WIDTH = FieldCandidates.of("width", "image_width");
    static final FieldCandidates HEIGHT = FieldCandidates.of("height", "image_height");
    static final FieldCandidates WORKFLOW = FieldCandidates.of("workflow_data", "workflow");
    static final FieldCandidates PARAMETERS = FieldCandidates.of("parameters", "metadata");

    private RowMapper() {
    }

    /**
     * Maps a legacy {@code prompts} row. Never skips: a missing prompt text
     * becomes the empty string.
     *
     * @param now timestamp used where the row has none
     */
    public static MappedRow mapPrompt(LegacyRow row, String now) {
        LinkedHashMap<String, Object> values = new LinkedHashMap<>();
        values.put("id", row.get("id").integer().orElse(null));
        values.put("positive_prompt", POSITIVE.firstText(row).orElse("").strip());
        values.put("negative_prompt", NEGATIVE.firstText(row).map(String::strip)
                .filter(s -> !s.isEmpty()).orElse(null));
        values.put("category", row.get("category").raw());
        values.put("tags", row.get("tags").raw());
        values.put("rating", rating(row.get("rating")));
        values.put("notes", row.get("notes").raw());
        values.put("hash", blankToNull(row.get("hash")));
        values.put("model_hash", row.get("model_hash").raw());
        values.put("sampler_settings", SAMPLER.firstRaw(row));
        values.put("generation_params", GENERATION.firstRaw(row));

        Optional<String> created = CREATED.firstText(row);
        String createdAt = created.orElse(now);
        values.put("created_at", createdAt);
        values.put("updated_at", UPDATED.firstText(row).or(() -> created).orElse(now));
        return MappedRow.of(values);
    }

    /**
     * Maps a legacy {@code generated_images} row. Skips rows whose parent
     * reference is not an integer and rows without any image path.
     *
     * @param now timestamp used where the row has none
     */
    public static MappedRow mapGeneratedImage(LegacyRow row, String now) {
        Value parent = row.get("prompt_id");
        Optional<Long> promptId = parent.integer();
        if (promptId.isEmpty()) {
            return MappedRow.skip(SkipReason.UNPARSEABLE_PARENT_REFERENCE,
                    "prompt_id '" + parent.raw() + "' is not an integer");
        }
        Optional<String> imagePath = IMAGE_PATH.firstText(row);
        if (imagePath.isEmpty()) {
            return MappedRow.skip(SkipReason.MISSING_REQUIRED_VALUE,
                    "none of " + IMAGE_PATH.columns() + " holds an image path");
        }
        String path = imagePath.get();

        LinkedHashMap<String, Object> values = new LinkedHashMap<>();
        values.put("id", row.get("id").integer().orElse(null));
        values.put("prompt_id", promptId.get());
        values.put("image_path", path);
        values.put("filename", FILENAME.firstText(row).orElseGet(() -> baseName(path)));
        values.put("generation_time", row.get("generation_time").text().orElse(now));
        values.put("file_size", row.get("file_size").integer().orElse(null));
        values.put("width", WIDTH.first(row).flatMap(Value::integer).orElse(null));
        values.put("height", HEIGHT.first(row).flatMap(Value::integer).orElse(null));
        values.put("format", FORMAT.firstText(row).orElseGet(() -> extension(path)));
        values.put("workflow_data", WORKFLOW.firstRaw(row));
        values.put("prompt_metadata", row.get("prompt_metadata").raw());
        values.put("parameters", PARAMETERS.firstRaw(row));
        return MappedRow.of(values);
    }

    /** Ratings outside 1..5 would violate the table's CHECK constraint. */
    static Long rating(Value value) {
        return value.integer().filter(r -> r >= 1 && r <= 5).orElse(null);
    }

    private static Object blankToNull(Value value) {
        return value.isBlank() ? null : value.raw();
    }

    static String baseName(String path) {
        String normalized = path.replace('\\', '/');
        int slash = normalized.lastIndexOf('/');
        return slash >= 0 ? normalized.substring(slash + 1) : normalized;
    }

    static String extension(String path) {
        String name = baseName(path);
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(dot + 1) : "";
    }
}
