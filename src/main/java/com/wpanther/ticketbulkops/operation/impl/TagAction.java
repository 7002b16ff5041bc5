package com.wpanther.ticketbulkops.operation.impl;

import java.util.Locale;
import java.util.Optional;

/**
 * What the tag manager does with the given tags
 */
public enum TagAction {

    ADD("add", "Add tags", "added", "to"),
    REMOVE("remove", "Remove tags", "removed", "from");

    private final String value;
    private final String label;
    private final String pastTense;
    private final String preposition;

    TagAction(String value, String label, String pastTense, String preposition) {
        this.value = value;
        this.label = label;
        this.pastTense = pastTense;
        this.preposition = preposition;
    }

    public String getValue() {
        return value;
    }

    public String getLabel() {
        return label;
    }

    public String getPastTense() {
        return pastTense;
    }

    public String getPreposition() {
        return preposition;
    }

    public static Optional<TagAction> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (TagAction action : values()) {
            if (action.value.equals(normalized)) {
                return Optional.of(action);
            }
        }
        return Optional.empty();
    }
}
