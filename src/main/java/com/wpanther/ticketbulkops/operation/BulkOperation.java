package com.wpanther.ticketbulkops.operation;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Contract every bulk operation implements.
 * Inputs are the raw form values keyed by field name, as submitted by the caller.
 */
public interface BulkOperation {

    int DEFAULT_SYNC_CEILING = 500;
    int DEFAULT_ASYNC_CEILING = 50_000;

    OperationDescriptor descriptor();

    default String slug() {
        return descriptor().getSlug();
    }

    /**
     * Fields of the operation form. May read from the ticket store to fill select options,
     * but reports lookup failures as an "error" option instead of throwing.
     */
    List<FormField> formSchema();

    /**
     * Check the input without side effects
     */
    ValidationResult validate(Map<String, String> input);

    /**
     * Run inline. Never throws: failures come back as an unsuccessful result.
     */
    OperationResult execute(Map<String, String> input);

    default boolean supportsAsync() {
        return descriptor().isSupportsAsync();
    }

    /**
     * Largest number of tickets accepted in one run
     */
    default int itemCeiling(boolean asyncMode) {
        return asyncMode ? DEFAULT_ASYNC_CEILING : DEFAULT_SYNC_CEILING;
    }

    /**
     * Create the job row, enqueue the work and return without waiting for it.
     * Only called when {@link #supportsAsync()} is true.
     *
     * @param input      validated form values
     * @param externalId fresh task queue id for the job
     * @param ownerId    principal the job belongs to
     */
    default OperationResult executeAsync(Map<String, String> input, String externalId, String ownerId) {
        throw new UnsupportedOperationException("Async execution not implemented for " + slug());
    }

    default Set<String> exportFormats() {
        return descriptor().getExportFormats();
    }

    /**
     * Render a successful result in one of {@link #exportFormats()}
     *
     * @throws com.wpanther.ticketbulkops.exception.UnsupportedExportFormatException for other formats
     */
    default ExportedFile export(OperationResult result, String format) {
        throw new UnsupportedOperationException("Export not implemented for " + slug());
    }
}
