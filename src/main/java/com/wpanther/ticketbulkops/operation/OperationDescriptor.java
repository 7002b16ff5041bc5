package com.wpanther.ticketbulkops.operation;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.util.Set;

/**
 * Immutable metadata describing a registered operation
 */
@Getter
@Builder
@ToString
public class OperationDescriptor {

    private final String name;

    // URL-safe unique key, e.g. "tag-manager"
    private final String slug;

    private final String description;

    @Builder.Default
    private final String category = "General";

    private final boolean adminOnly;

    private final boolean supportsAsync;

    @Singular
    private final Set<String> exportFormats;
}
