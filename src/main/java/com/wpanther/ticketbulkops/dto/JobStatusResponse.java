package com.wpanther.ticketbulkops.dto;

import com.wpanther.ticketbulkops.entity.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Snapshot of a job as returned to callers polling for progress
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobStatusResponse {

    private Long id;

    private String externalId;

    private String operationSlug;

    private JobStatus status;

    private int progress;

    private int totalItems;

    private int processedItems;

    private String errorMessage;

    private String elapsedTime;

    private Instant createdAt;

    private Instant startedAt;

    private Instant completedAt;

    // Only filled for completed jobs on the detail endpoint
    private Map<String, Object> result;
}
