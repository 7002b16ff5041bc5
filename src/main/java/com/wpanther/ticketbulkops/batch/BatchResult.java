package com.wpanther.ticketbulkops.batch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one batch run: which tickets were updated, which failed and why
 */
public class BatchResult {

    private final List<Long> successful = new ArrayList<>();
    private final List<Long> failed = new ArrayList<>();
    private final List<String> errors = new ArrayList<>();

    void recordSuccess(long ticketId) {
        successful.add(ticketId);
    }

    void recordFailure(long ticketId, String message) {
        failed.add(ticketId);
        errors.add("Ticket " + ticketId + ": " + message);
    }

    public List<Long> getSuccessful() {
        return Collections.unmodifiableList(successful);
    }

    public List<Long> getFailed() {
        return Collections.unmodifiableList(failed);
    }

    public List<String> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public int successCount() {
        return successful.size();
    }

    public int failureCount() {
        return failed.size();
    }

    /**
     * Error text recorded for a failed ticket, if any
     */
    public String errorFor(long ticketId) {
        String prefix = "Ticket " + ticketId + ": ";
        return errors.stream()
                .filter(error -> error.startsWith(prefix))
                .findFirst()
                .orElse("Unknown error");
    }

    /**
     * Counts and id lists in the shape stored as job result and shown to callers
     */
    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("successful", successCount());
        payload.put("failed", failureCount());
        payload.put("successful_tickets", new ArrayList<>(successful));
        payload.put("failed_tickets", new ArrayList<>(failed));
        payload.put("errors", new ArrayList<>(errors));
        return payload;
    }
}
