package com.wpanther.ticketbulkops.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class OperationNotFoundException extends RuntimeException {

    public OperationNotFoundException(String slug) {
        super("Operation \"" + slug + "\" not found");
    }
}
