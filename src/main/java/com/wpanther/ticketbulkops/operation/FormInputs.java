package com.wpanther.ticketbulkops.operation;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Parsing of raw form values shared by the operations
 */
public final class FormInputs {

    public static final String DRY_RUN = "dry_run";
    public static final String TICKET_LIMIT = "ticket_limit";
    public static final String VIEW_ID = "view_id";

    // Value of a select whose options could not be loaded
    public static final String ERROR_OPTION = "error";

    private FormInputs() {
    }

    /**
     * Trimmed value, empty string when absent
     */
    public static String text(Map<String, String> input, String name) {
        String value = input.get(name);
        return value == null ? "" : value.trim();
    }

    /**
     * Checkboxes submit "on"; JSON callers may send "true"
     */
    public static boolean isDryRun(Map<String, String> input) {
        String value = text(input, DRY_RUN);
        return "on".equalsIgnoreCase(value) || "true".equalsIgnoreCase(value);
    }

    /**
     * Requested number of tickets, 0 when the operation has no limit field or it is not a number
     */
    public static int requestedItems(Map<String, String> input) {
        try {
            return Integer.parseInt(text(input, TICKET_LIMIT));
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    /**
     * Comma separated tags, blanks dropped
     */
    public static List<String> parseTags(String raw) {
        if (raw == null) {
            return List.of();
        }
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(tag -> !tag.isEmpty())
                .distinct()
                .collect(Collectors.toList());
    }

    /**
     * Validate a ticket limit field
     *
     * @return error message, or null when the value is acceptable
     */
    public static String checkTicketLimit(Map<String, String> input, int ceiling, String overCeilingMessage) {
        String raw = text(input, TICKET_LIMIT);
        if (raw.isEmpty()) {
            return "Please specify a ticket limit";
        }
        int limit;
        try {
            limit = Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            return "Ticket limit must be a valid number";
        }
        if (limit < 1) {
            return "Ticket limit must be at least 1";
        }
        if (limit > ceiling) {
            return overCeilingMessage;
        }
        return null;
    }

    /**
     * Validate a select field that must hold a loaded numeric id
     *
     * @return error message, or null when the value is acceptable
     */
    public static String checkIdSelection(Map<String, String> input, String name,
                                          String missingMessage, String loadErrorMessage) {
        String value = text(input, name);
        if (value.isEmpty()) {
            return missingMessage;
        }
        if (ERROR_OPTION.equals(value)) {
            return loadErrorMessage;
        }
        try {
            Long.parseLong(value);
        } catch (NumberFormatException e) {
            return "Invalid selection for " + name.replace('_', ' ');
        }
        return null;
    }
}
