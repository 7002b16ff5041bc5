package com.wpanther.ticketbulkops.dto;

import com.wpanther.ticketbulkops.operation.OperationDescriptor;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;
import java.util.TreeSet;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OperationSummaryResponse {

    private String slug;

    private String name;

    private String description;

    private String category;

    private boolean adminOnly;

    private boolean supportsAsync;

    private Set<String> exportFormats;

    public static OperationSummaryResponse from(OperationDescriptor descriptor) {
        return OperationSummaryResponse.builder()
                .slug(descriptor.getSlug())
                .name(descriptor.getName())
                .description(descriptor.getDescription())
                .category(descriptor.getCategory())
                .adminOnly(descriptor.isAdminOnly())
                .supportsAsync(descriptor.isSupportsAsync())
                .exportFormats(new TreeSet<>(descriptor.getExportFormats()))
                .build();
    }
}
