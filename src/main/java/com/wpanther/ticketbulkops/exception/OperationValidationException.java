package com.wpanther.ticketbulkops.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Raised when operation input fails validation, before any remote call is made
 */
@ResponseStatus(HttpStatus.BAD_REQUEST)
public class OperationValidationException extends RuntimeException {

    public OperationValidationException(String message) {
        super(message);
    }
}
