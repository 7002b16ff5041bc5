package com.wpanther.ticketbulkops.operation;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Outcome of running an operation. Inline runs carry data; background runs carry the job reference.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OperationResult {

    private boolean success;

    private String message;

    private Map<String, Object> data;

    // Task queue id of the started job
    private String jobId;

    // Database id of the started job
    private Long jobDbId;

    public static OperationResult success(String message, Map<String, Object> data) {
        return OperationResult.builder().success(true).message(message).data(data).build();
    }

    public static OperationResult failure(String message) {
        return OperationResult.builder().success(false).message(message).build();
    }

    public static OperationResult jobStarted(String jobId, Long jobDbId, String message) {
        return OperationResult.builder().success(true).jobId(jobId).jobDbId(jobDbId).message(message).build();
    }

    public boolean hasJob() {
        return jobId != null;
    }
}
