package com.wpanther.ticketbulkops.exception;

/**
 * The task queue refused a unit of work
 */
public class TaskSubmissionException extends RuntimeException {

    public TaskSubmissionException(String message, Throwable cause) {
        super(message, cause);
    }
}
