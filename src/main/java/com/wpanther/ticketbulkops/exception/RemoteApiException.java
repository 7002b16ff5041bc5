package com.wpanther.ticketbulkops.exception;

import java.util.Locale;

/**
 * Failure reported by the remote ticket store for a single call.
 * Carries the HTTP status so callers can detect throttling without parsing text.
 */
public class RemoteApiException extends RuntimeException {

    public static final int STATUS_TOO_MANY_REQUESTS = 429;

    private final int statusCode;

    public RemoteApiException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public RemoteApiException(int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status of the failed call, or 0 when no response was received
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * Whether the remote store asked us to slow down.
     * The message check keeps compatibility with errors that only mention the limit in text.
     */
    public boolean isRateLimited() {
        if (statusCode == STATUS_TOO_MANY_REQUESTS) {
            return true;
        }
        String message = getMessage();
        return message != null && message.toLowerCase(Locale.ROOT).contains("rate limit");
    }
}
