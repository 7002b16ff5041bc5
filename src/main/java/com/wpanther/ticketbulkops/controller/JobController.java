package com.wpanther.ticketbulkops.controller;

import com.wpanther.ticketbulkops.dto.JobStatusResponse;
import com.wpanther.ticketbulkops.entity.Job;
import com.wpanther.ticketbulkops.entity.JobStatus;
import com.wpanther.ticketbulkops.exception.OperationValidationException;
import com.wpanther.ticketbulkops.service.JobService;
import com.wpanther.ticketbulkops.service.ResultExportService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Locale;

/**
 * Controller for following and managing the caller's background jobs
 */
@RestController
@RequestMapping("/api/v1/jobs")
@RequiredArgsConstructor
@Slf4j
public class JobController {

    private static final int MAX_PAGE_SIZE = 100;

    private final JobService jobService;
    private final ResultExportService exportService;

    /**
     * One page of the caller's jobs, newest first
     *
     * @param status    state filter, "all" or absent for every state
     * @param operation operation slug filter, "all" or absent for every operation
     * @param page      1-based page number
     * @param size      jobs per page, at most 100
     */
    @GetMapping
    public ResponseEntity<Page<JobStatusResponse>> listJobs(
            @RequestHeader(value = CallerHeaders.OWNER_ID, defaultValue = CallerHeaders.DEFAULT_OWNER) String ownerId,
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String operation,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "20") int size) {
        if (page < 1) {
            throw new OperationValidationException("page must be 1 or greater");
        }
        if (size < 1 || size > MAX_PAGE_SIZE) {
            throw new OperationValidationException("size must be between 1 and " + MAX_PAGE_SIZE);
        }
        return ResponseEntity.ok(jobService.listJobs(ownerId, parseStatus(status), parseOperation(operation),
                PageRequest.of(page - 1, size)));
    }

    /**
     * Operation slugs that have jobs
     */
    @GetMapping("/operations")
    public ResponseEntity<List<String>> listJobOperations() {
        return ResponseEntity.ok(jobService.listJobOperations());
    }

    @GetMapping("/{jobId}")
    public ResponseEntity<JobStatusResponse> getJobStatus(
            @PathVariable Long jobId,
            @RequestHeader(value = CallerHeaders.OWNER_ID, defaultValue = CallerHeaders.DEFAULT_OWNER) String ownerId) {
        return ResponseEntity.ok(jobService.getJobStatus(jobId, ownerId));
    }

    @PostMapping("/{jobId}/cancel")
    public ResponseEntity<JobStatusResponse> cancelJob(
            @PathVariable Long jobId,
            @RequestHeader(value = CallerHeaders.OWNER_ID, defaultValue = CallerHeaders.DEFAULT_OWNER) String ownerId) {
        Job cancelled = jobService.cancelJob(jobId, ownerId);
        log.info("Job {} cancelled by {}", cancelled.getId(), ownerId);
        return ResponseEntity.ok(jobService.getJobStatus(jobId, ownerId));
    }

    @DeleteMapping("/{jobId}")
    public ResponseEntity<Void> deleteJob(
            @PathVariable Long jobId,
            @RequestHeader(value = CallerHeaders.OWNER_ID, defaultValue = CallerHeaders.DEFAULT_OWNER) String ownerId) {
        jobService.deleteJob(jobId, ownerId);
        return ResponseEntity.noContent().build();
    }

    /**
     * Download the result of a completed job
     */
    @GetMapping("/{jobId}/export/{format}")
    public ResponseEntity<byte[]> exportJob(
            @PathVariable Long jobId,
            @PathVariable String format,
            @RequestHeader(value = CallerHeaders.OWNER_ID, defaultValue = CallerHeaders.DEFAULT_OWNER) String ownerId) {
        return ExportResponses.download(exportService.exportJobResult(jobId, format, ownerId));
    }

    private static String parseOperation(String operation) {
        if (!StringUtils.hasText(operation) || "all".equalsIgnoreCase(operation)) {
            return null;
        }
        return operation.trim();
    }

    private static JobStatus parseStatus(String status) {
        if (!StringUtils.hasText(status) || "all".equalsIgnoreCase(status)) {
            return null;
        }
        try {
            return JobStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new OperationValidationException("Unknown job status: " + status);
        }
    }
}
