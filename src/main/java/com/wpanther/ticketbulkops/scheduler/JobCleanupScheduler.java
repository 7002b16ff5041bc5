package com.wpanther.ticketbulkops.scheduler;

import com.wpanther.ticketbulkops.entity.Job;
import com.wpanther.ticketbulkops.entity.JobStatus;
import com.wpanther.ticketbulkops.queue.TaskQueue;
import com.wpanther.ticketbulkops.repository.JobRepository;
import com.wpanther.ticketbulkops.service.JobService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.EnumSet;
import java.util.List;

/**
 * Scheduled housekeeping of the job table.
 * Fails jobs that ran past the time limit and deletes finished jobs after the retention period.
 */
@Component
@EnableScheduling
@RequiredArgsConstructor
@Slf4j
public class JobCleanupScheduler {

    private static final EnumSet<JobStatus> ACTIVE = EnumSet.of(JobStatus.PENDING, JobStatus.RUNNING);
    private static final EnumSet<JobStatus> TERMINAL =
            EnumSet.of(JobStatus.COMPLETED, JobStatus.FAILED, JobStatus.CANCELLED);

    private final JobRepository jobRepository;
    private final JobService jobService;
    private final TaskQueue taskQueue;

    @Value("${app.jobs.retention-days:7}")
    private int retentionDays = 7;

    @Value("${app.jobs.max-runtime-hours:4}")
    private int maxRuntimeHours = 4;

    /**
     * Fail PENDING or RUNNING jobs created longer ago than the time limit, then revoke their work.
     * The failure is committed before the revoke, so the interrupted worker finds the job terminal.
     * Runs every 15 minutes by default (configurable via app.jobs.stale-check-cron)
     */
    @Scheduled(cron = "${app.jobs.stale-check-cron:0 */15 * * * *}")
    public void failStaleJobs() {
        log.info("Checking for jobs running longer than {} hours", maxRuntimeHours);

        try {
            Instant cutoff = Instant.now().minus(maxRuntimeHours, ChronoUnit.HOURS);
            List<Job> active = jobRepository.findByStatusIn(ACTIVE);

            int failedCount = 0;
            for (Job job : active) {
                if (job.getCreatedAt().isBefore(cutoff)
                        && jobService.failJob(job.getExternalId(),
                        "Job exceeded the time limit of " + maxRuntimeHours + " hours")) {
                    taskQueue.revoke(job.getExternalId());
                    failedCount++;
                    log.warn("Failed stale job: id={}, externalId={}, createdAt={}",
                            job.getId(), job.getExternalId(), job.getCreatedAt());
                }
            }

            log.info("Stale job check completed: {} jobs marked as failed", failedCount);

        } catch (Exception e) {
            log.error("Error during stale job check", e);
        }
    }

    /**
     * Delete completed, failed and cancelled jobs older than the retention period
     * Runs daily at 2 AM by default (configurable via app.jobs.cleanup-cron)
     */
    @Scheduled(cron = "${app.jobs.cleanup-cron:0 0 2 * * *}")
    public void deleteOldJobs() {
        log.info("Starting deletion of old jobs (retention: {} days)", retentionDays);

        try {
            Instant cutoff = Instant.now().minus(retentionDays, ChronoUnit.DAYS);
            List<Job> old = jobRepository.findByStatusInAndCompletedAtBefore(TERMINAL, cutoff);

            jobRepository.deleteAll(old);

            log.info("Deletion completed: {} old jobs removed", old.size());

        } catch (Exception e) {
            log.error("Error during old job deletion", e);
        }
    }
}
