package com.wpanther.ticketbulkops.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Caller is not allowed to run the operation or to touch the job
 */
@ResponseStatus(HttpStatus.FORBIDDEN)
public class OperationAccessDeniedException extends RuntimeException {

    public OperationAccessDeniedException(String message) {
        super(message);
    }
}
