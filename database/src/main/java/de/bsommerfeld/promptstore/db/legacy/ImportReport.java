package de.bsommerfeld.promptstore.db.legacy;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * What a legacy import did, file by file.
 *
 * @param migrated files brought under management
 * @param skipped  files left alone, with the reason
 * @param errors   files whose import failed; they are untouched
 */
public record ImportReport(List<ImportedFile> migrated, List<SkippedFile> skipped, List<FailedFile> errors) {

    public ImportReport {
        migrated = List.copyOf(migrated);
        skipped = List.copyOf(skipped);
        errors = List.copyOf(errors);
    }

    /**
     * @param fileName     legacy file name
     * @param source       where it was found
     * @param destination  where it lives now
     * @param backup       timestamped copy in the backups area
     * @param promptCount  rows in {@code prompts} after import, 0 for non-database files
     */
    public record ImportedFile(String fileName, Path source, Path destination, Path backup, long promptCount) {
    }

    public record SkippedFile(String fileName, String reason) {
    }

    public record FailedFile(String fileName, String error) {
    }

    public boolean isEmpty() {
        return migrated.isEmpty() && skipped.isEmpty() && errors.isEmpty();
    }

    static final class Builder {

        private final List<ImportedFile> migrated = new ArrayList<>();
        private final List<SkippedFile> skipped = new ArrayList<>();
        private final List<FailedFile> errors = new ArrayList<>();

        void imported(ImportedFile file) {
            migrated.add(file);
        }

        void skipped(String fileName, String reason) {
            skipped.add(new SkippedFile(fileName, reason));
        }

        void failed(String fileName, String error) {
            errors.add(new FailedFile(fileName, error));
        }

        ImportReport build() {
            return new ImportReport(migrated, skipped, errors);
        }
    }
}
