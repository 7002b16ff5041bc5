package com.wpanther.ticketbulkops.entity;

/**
 * Lifecycle of a background job.
 * PENDING -> RUNNING -> COMPLETED | FAILED | CANCELLED; terminal states never change.
 */
public enum JobStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
