package com.wpanther.ticketbulkops.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * The remote ticket store client is missing or unusable
 */
@ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
public class TicketStoreConfigurationException extends RuntimeException {

    public TicketStoreConfigurationException(String message) {
        super(message);
    }

    public TicketStoreConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
