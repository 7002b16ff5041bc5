package com.wpanther.ticketbulkops.controller;

/**
 * Request headers identifying the caller, set by the fronting gateway
 */
final class CallerHeaders {

    static final String OWNER_ID = "X-Owner-Id";
    static final String ADMIN = "X-Admin";

    static final String DEFAULT_OWNER = "anonymous";

    private CallerHeaders() {
    }
}
