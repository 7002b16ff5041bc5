package com.wpanther.ticketbulkops.exception;

/**
 * Two operations were registered under the same slug. Fatal at startup.
 */
public class DuplicateSlugException extends RuntimeException {

    public DuplicateSlugException(String slug) {
        super("Operation with slug '" + slug + "' is already registered");
    }
}
