package com.wpanther.ticketbulkops.batch;

/**
 * Notified after each ticket that was updated successfully
 */
@FunctionalInterface
public interface ProgressCallback {

    ProgressCallback NONE = (processed, total) -> { };

    /**
     * @param processed 1-based position of the ticket just handled
     * @param total     number of tickets in the batch
     */
    void onProgress(int processed, int total);
}
