package com.wpanther.ticketbulkops.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wpanther.ticketbulkops.dto.JobStatusResponse;
import com.wpanther.ticketbulkops.entity.Job;
import com.wpanther.ticketbulkops.entity.JobStatus;
import com.wpanther.ticketbulkops.exception.JobNotFoundException;
import com.wpanther.ticketbulkops.exception.JobStateException;
import com.wpanther.ticketbulkops.exception.OperationAccessDeniedException;
import com.wpanther.ticketbulkops.exception.TaskSubmissionException;
import com.wpanther.ticketbulkops.queue.TaskQueue;
import com.wpanther.ticketbulkops.repository.JobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.util.StringUtils;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Service for creating, tracking and controlling background bulk jobs.
 * The database row is the only source of truth for job state. Every transition re-reads the row
 * under a write lock, so a worker and a cancelling caller never both act on a stale status.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JobService {

    private static final TypeReference<Map<String, Object>> RESULT_TYPE = new TypeReference<>() {
    };

    private final JobRepository jobRepository;
    private final TaskQueue taskQueue;
    private final ObjectMapper objectMapper;

    /**
     * Persist a new PENDING job and enqueue its work.
     * Not transactional: the row has to be committed before a worker can look it up.
     * If the queue refuses the work the row is removed again and the error is rethrown.
     *
     * @param externalId    task queue id, generated by the caller
     * @param operationSlug operation that owns the job
     * @param totalItems    number of tickets to process
     * @param ownerId       principal the job belongs to
     * @param work          unit of work run by the queue
     * @return the persisted job
     */
    public Job submitJob(String externalId, String operationSlug, int totalItems, String ownerId, Runnable work) {
        Job job = jobRepository.save(Job.create(externalId, operationSlug, totalItems, ownerId));
        log.info("Created job: id={}, externalId={}, operation={}, totalItems={}, owner={}",
                job.getId(), externalId, operationSlug, totalItems, ownerId);

        try {
            taskQueue.submit(externalId, work);
        } catch (TaskSubmissionException e) {
            log.error("Could not enqueue job {}, removing it", externalId);
            jobRepository.delete(job);
            throw e;
        }
        return job;
    }

    /**
     * Move a job to RUNNING before its first item
     *
     * @return false when the job is missing or already terminal, e.g. cancelled while queued
     */
    @Transactional
    public boolean markStarted(String externalId) {
        Optional<Job> found = jobRepository.findByExternalIdForUpdate(externalId);
        if (found.isEmpty()) {
            log.warn("Job {} not found, nothing to start", externalId);
            return false;
        }
        Job job = found.get();
        if (!job.advance(0)) {
            log.info("Job {} is already {}, not starting", externalId, job.getStatus());
            return false;
        }
        jobRepository.save(job);
        log.info("Job started: id={}, externalId={}", job.getId(), externalId);
        return true;
    }

    /**
     * Record the number of processed items. Ignored for unknown or terminal jobs.
     */
    @Transactional
    public void recordProgress(String externalId, int processed) {
        jobRepository.findByExternalIdForUpdate(externalId).ifPresent(job -> {
            if (job.advance(processed)) {
                jobRepository.save(job);
                log.debug("Job {} progress: {}/{} ({}%)",
                        externalId, job.getProcessedItems(), job.getTotalItems(), job.getProgress());
            }
        });
    }

    /**
     * Complete a job with its result
     *
     * @param externalId task queue id
     * @param result     result object to serialize and store
     */
    @Transactional
    public void completeJob(String externalId, Object result) {
        try {
            Job job = jobRepository.findByExternalIdForUpdate(externalId)
                    .orElseThrow(() -> new JobNotFoundException(externalId));

            String serialized = objectMapper.writeValueAsString(result);
            if (!job.complete(serialized)) {
                log.info("Job {} is already {}, result discarded", externalId, job.getStatus());
                return;
            }
            jobRepository.save(job);
            log.info("Job completed: id={}, externalId={}", job.getId(), externalId);

        } catch (Exception e) {
            log.error("Error completing job: externalId={}", externalId, e);
            failJob(externalId, "Failed to store result: " + e.getMessage());
        }
    }

    /**
     * Mark a job failed. No-op for terminal jobs, so a cancelled job stays cancelled.
     *
     * @return true when the failure was recorded
     */
    @Transactional
    public boolean failJob(String externalId, String errorMessage) {
        try {
            Job job = jobRepository.findByExternalIdForUpdate(externalId)
                    .orElseThrow(() -> new JobNotFoundException(externalId));

            if (!job.fail(errorMessage)) {
                log.info("Job {} is already {}, failure not recorded", externalId, job.getStatus());
                return false;
            }
            jobRepository.save(job);
            log.error("Job failed: id={}, externalId={}, error={}", job.getId(), externalId, errorMessage);
            return true;

        } catch (Exception e) {
            log.error("Error recording job failure: externalId={}", externalId, e);
            return false;
        }
    }

    /**
     * Whether the job has reached a terminal state. Unknown jobs count as finished.
     */
    @Transactional(readOnly = true)
    public boolean isFinished(String externalId) {
        return jobRepository.findByExternalId(externalId).map(Job::isTerminal).orElse(true);
    }

    /**
     * Mark the job cancelled, then revoke its queued work once the cancellation is committed.
     * The interrupted worker therefore always finds the job terminal.
     *
     * @throws JobStateException when the job is already terminal
     */
    @Transactional
    public Job cancelJob(Long jobId, String ownerId) {
        Job job = jobRepository.findByIdForUpdate(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        checkOwner(job, ownerId);
        if (!job.cancel()) {
            throw new JobStateException("Job is already " + job.getStatus().name().toLowerCase()
                    + " and cannot be cancelled.");
        }
        jobRepository.saveAndFlush(job);

        String externalId = job.getExternalId();
        afterCommit(() -> {
            boolean revoked = taskQueue.revoke(externalId);
            log.info("Job cancelled: id={}, externalId={}, revoked={}", jobId, externalId, revoked);
        });
        return job;
    }

    /**
     * @throws JobStateException when the job has not reached a terminal state
     */
    @Transactional
    public void deleteJob(Long jobId, String ownerId) {
        Job job = getJob(jobId, ownerId);
        if (!job.isTerminal()) {
            throw new JobStateException("Cannot delete a running job. Please cancel it first.");
        }
        jobRepository.delete(job);
        log.info("Job deleted: id={}, status={}", jobId, job.getStatus());
    }

    /**
     * Job by database id, visible only to its owner
     *
     * @throws JobNotFoundException          when no such job exists
     * @throws OperationAccessDeniedException when the job belongs to someone else
     */
    @Transactional(readOnly = true)
    public Job getJob(Long jobId, String ownerId) {
        Job job = jobRepository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        checkOwner(job, ownerId);
        return job;
    }

    @Transactional(readOnly = true)
    public JobStatusResponse getJobStatus(Long jobId, String ownerId) {
        Job job = getJob(jobId, ownerId);
        JobStatusResponse response = toStatusResponse(job);
        if (job.getStatus() == JobStatus.COMPLETED) {
            getResult(job).ifPresent(response::setResult);
        }
        return response;
    }

    /**
     * One page of an owner's jobs, newest first, optionally filtered
     *
     * @param status        only jobs in this state, or null for all
     * @param operationSlug only jobs of this operation, or null/blank for all
     * @param pageable      page to return
     */
    @Transactional(readOnly = true)
    public Page<JobStatusResponse> listJobs(String ownerId, JobStatus status, String operationSlug,
                                            Pageable pageable) {
        boolean bySlug = StringUtils.hasText(operationSlug);
        Page<Job> jobs;
        if (status != null && bySlug) {
            jobs = jobRepository.findByOwnerIdAndStatusAndOperationSlugOrderByCreatedAtDesc(
                    ownerId, status, operationSlug, pageable);
        } else if (status != null) {
            jobs = jobRepository.findByOwnerIdAndStatusOrderByCreatedAtDesc(ownerId, status, pageable);
        } else if (bySlug) {
            jobs = jobRepository.findByOwnerIdAndOperationSlugOrderByCreatedAtDesc(ownerId, operationSlug, pageable);
        } else {
            jobs = jobRepository.findByOwnerIdOrderByCreatedAtDesc(ownerId, pageable);
        }
        return jobs.map(this::toStatusResponse);
    }

    /**
     * Operation slugs that have jobs, for filter choices
     */
    @Transactional(readOnly = true)
    public List<String> listJobOperations() {
        return jobRepository.findDistinctOperationSlugs();
    }

    /**
     * Stored result of a completed job, empty when there is none or it cannot be read
     */
    public Optional<Map<String, Object>> getResult(Job job) {
        if (job.getResultData() == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(job.getResultData(), RESULT_TYPE));
        } catch (Exception e) {
            log.error("Error reading result of job {}", job.getId(), e);
            return Optional.empty();
        }
    }

    private static void checkOwner(Job job, String ownerId) {
        if (!job.getOwnerId().equals(ownerId)) {
            log.warn("Job {} requested by {} but owned by {}", job.getId(), ownerId, job.getOwnerId());
            throw new OperationAccessDeniedException("You do not have permission to view this job.");
        }
    }

    /**
     * Run after the current transaction commits, or right away when there is none
     */
    private static void afterCommit(Runnable action) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            action.run();
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                action.run();
            }
        });
    }

    private JobStatusResponse toStatusResponse(Job job) {
        return JobStatusResponse.builder()
                .id(job.getId())
                .externalId(job.getExternalId())
                .operationSlug(job.getOperationSlug())
                .status(job.getStatus())
                .progress(job.getProgress())
                .totalItems(job.getTotalItems())
                .processedItems(job.getProcessedItems())
                .errorMessage(job.getErrorMessage())
                .elapsedTime(job.elapsedTime(Instant.now()))
                .createdAt(job.getCreatedAt())
                .startedAt(job.getStartedAt())
                .completedAt(job.getCompletedAt())
                .build();
    }
}
