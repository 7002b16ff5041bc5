package com.wpanther.ticketbulkops.service;

import com.wpanther.ticketbulkops.entity.Job;
import com.wpanther.ticketbulkops.entity.JobStatus;
import com.wpanther.ticketbulkops.exception.JobStateException;
import com.wpanther.ticketbulkops.exception.OperationNotFoundException;
import com.wpanther.ticketbulkops.exception.ResultNotAvailableException;
import com.wpanther.ticketbulkops.exception.UnsupportedExportFormatException;
import com.wpanther.ticketbulkops.operation.BulkOperation;
import com.wpanther.ticketbulkops.operation.ExportedFile;
import com.wpanther.ticketbulkops.operation.OperationRegistry;
import com.wpanther.ticketbulkops.operation.OperationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Map;

/**
 * Exports of inline results and of completed job results, rendered by the owning operation
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ResultExportService {

    private final DispatchService dispatchService;
    private final OperationRegistry registry;
    private final ResultStore resultStore;
    private final JobService jobService;

    public ExportedFile exportLastResult(String slug, String format, String ownerId, boolean admin) {
        BulkOperation operation = dispatchService.requireAccessible(slug, admin);
        String normalized = checkFormat(operation, format);

        OperationResult result = resultStore.find(ownerId, slug)
                .filter(r -> r.isSuccess() && r.getData() != null)
                .orElseThrow(() -> new ResultNotAvailableException(
                        "No results available to export. Please run the operation first."));

        log.info("Exporting last {} result as {} for {}", slug, normalized, ownerId);
        return operation.export(result, normalized);
    }

    public ExportedFile exportJobResult(Long jobId, String format, String ownerId) {
        Job job = jobService.getJob(jobId, ownerId);
        if (job.getStatus() != JobStatus.COMPLETED) {
            throw new JobStateException("Only completed jobs can be exported.");
        }

        BulkOperation operation = registry.get(job.getOperationSlug())
                .orElseThrow(() -> new OperationNotFoundException(job.getOperationSlug()));
        String normalized = checkFormat(operation, format);

        Map<String, Object> data = jobService.getResult(job)
                .orElseThrow(() -> new ResultNotAvailableException("No results available for this job."));

        log.info("Exporting result of job {} as {}", jobId, normalized);
        return operation.export(OperationResult.success("Job " + jobId + " result", data), normalized);
    }

    private static String checkFormat(BulkOperation operation, String format) {
        String normalized = format == null ? "" : format.toLowerCase(Locale.ROOT);
        if (!operation.exportFormats().contains(normalized)) {
            throw new UnsupportedExportFormatException(format);
        }
        return normalized;
    }
}
