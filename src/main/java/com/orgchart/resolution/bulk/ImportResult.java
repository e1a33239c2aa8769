package com.orgchart.resolution.bulk;

import com.orgchart.resolution.core.model.EntityRecord;
import com.orgchart.resolution.diagnostics.Diagnostic;

import java.util.List;

/**
 * Result of a snapshot import.
 *
 * @param totalRecords number of records in the input
 * @param records      records that passed validation, in input order
 * @param errors       records that were skipped
 * @param diagnostics  data-quality events raised while reading, such as malformed buckets
 */
public record ImportResult(
        long totalRecords,
        List<EntityRecord> records,
        List<ImportError> errors,
        List<Diagnostic> diagnostics
) {
    public ImportResult {
        records = records != null ? List.copyOf(records) : List.of();
        errors = errors != null ? List.copyOf(errors) : List.of();
        diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
    }

    /**
     * A result for input that could not be read at all.
     */
    public static ImportResult failed(String message) {
        return new ImportResult(0, List.of(), List.of(new ImportError(0, "", message)), List.of());
    }

    public long successCount() {
        return records.size();
    }

    public long errorCount() {
        return errors.size();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * A record that failed validation.
     *
     * @param recordNumber position of the record in the input (1-based), 0 for whole-input errors
     * @param inputName    the record's name when it had one
     * @param message      the error message
     */
    public record ImportError(long recordNumber, String inputName, String message) {}

    @Override
    public String toString() {
        return "ImportResult{total=" + totalRecords +
                ", imported=" + records.size() +
                ", errors=" + errors.size() +
                ", diagnostics=" + diagnostics.size() + '}';
    }
}
