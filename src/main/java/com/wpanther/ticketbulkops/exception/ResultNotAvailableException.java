package com.wpanther.ticketbulkops.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class ResultNotAvailableException extends RuntimeException {

    public ResultNotAvailableException(String message) {
        super(message);
    }
}
