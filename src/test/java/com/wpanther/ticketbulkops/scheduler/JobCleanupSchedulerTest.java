package com.wpanther.ticketbulkops.scheduler;

import com.wpanther.ticketbulkops.entity.Job;
import com.wpanther.ticketbulkops.entity.JobStatus;
import com.wpanther.ticketbulkops.queue.TaskQueue;
import com.wpanther.ticketbulkops.repository.JobRepository;
import com.wpanther.ticketbulkops.service.JobService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Unit tests for JobCleanupScheduler
 */
@ExtendWith(MockitoExtension.class)
class JobCleanupSchedulerTest {

    @Mock
    private JobRepository jobRepository;

    @Mock
    private JobService jobService;

    @Mock
    private TaskQueue taskQueue;

    @InjectMocks
    private JobCleanupScheduler scheduler;

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(scheduler, "retentionDays", 7);
        ReflectionTestUtils.setField(scheduler, "maxRuntimeHours", 4);
    }

    @Test
    void testFailStaleJobs_FailsOnlyJobsPastTheLimit() {
        // Arrange
        Job stale = createJob("stale", Instant.now().minus(5, ChronoUnit.HOURS));
        stale.advance(1);
        Job fresh = createJob("fresh", Instant.now().minus(1, ChronoUnit.HOURS));
        when(jobRepository.findByStatusIn(anyCollection())).thenReturn(List.of(stale, fresh));
        when(jobService.failJob("stale", "Job exceeded the time limit of 4 hours")).thenReturn(true);

        // Act
        scheduler.failStaleJobs();

        // Assert
        InOrder order = inOrder(jobService, taskQueue);
        order.verify(jobService).failJob("stale", "Job exceeded the time limit of 4 hours");
        order.verify(taskQueue).revoke("stale");
        verify(jobService, never()).failJob(eq("fresh"), anyString());
        verify(taskQueue, never()).revoke("fresh");
        verify(jobRepository, never()).save(any(Job.class));
    }

    @Test
    void testFailStaleJobs_SkipsRevokeWhenJobFinishedMeanwhile() {
        // Arrange
        Job stale = createJob("stale", Instant.now().minus(5, ChronoUnit.HOURS));
        when(jobRepository.findByStatusIn(anyCollection())).thenReturn(List.of(stale));
        when(jobService.failJob(eq("stale"), anyString())).thenReturn(false);

        // Act
        scheduler.failStaleJobs();

        // Assert
        verify(taskQueue, never()).revoke(anyString());
        assertThat(stale.getStatus()).isEqualTo(JobStatus.PENDING);
    }

    @Test
    void testFailStaleJobs_QueriesActiveStates() {
        // Arrange
        when(jobRepository.findByStatusIn(anyCollection())).thenReturn(List.of());

        // Act
        scheduler.failStaleJobs();

        // Assert
        verify(jobRepository).findByStatusIn(argThat((Collection<JobStatus> statuses) ->
                statuses.size() == 2 && statuses.contains(JobStatus.PENDING) && statuses.contains(JobStatus.RUNNING)));
        verifyNoInteractions(jobService);
    }

    @Test
    void testFailStaleJobs_HandlesException() {
        // Arrange
        when(jobRepository.findByStatusIn(anyCollection())).thenThrow(new RuntimeException("Database error"));

        // Act: should not throw
        scheduler.failStaleJobs();

        // Assert
        verifyNoInteractions(jobService, taskQueue);
    }

    @Test
    void testDeleteOldJobs_DeletesTerminalJobsBeforeCutoff() {
        // Arrange
        Job old = createJob("old", Instant.now().minus(10, ChronoUnit.DAYS));
        old.complete("{}");
        when(jobRepository.findByStatusInAndCompletedAtBefore(anyCollection(), any(Instant.class)))
                .thenReturn(List.of(old));

        // Act
        scheduler.deleteOldJobs();

        // Assert
        verify(jobRepository).deleteAll(List.of(old));
        verify(jobRepository).findByStatusInAndCompletedAtBefore(
                argThat((Collection<JobStatus> statuses) -> statuses.size() == 3
                        && !statuses.contains(JobStatus.RUNNING) && !statuses.contains(JobStatus.PENDING)),
                argThat(cutoff -> cutoff.isBefore(Instant.now().minus(6, ChronoUnit.DAYS))));
    }

    @Test
    void testDeleteOldJobs_HandlesException() {
        // Arrange
        when(jobRepository.findByStatusInAndCompletedAtBefore(anyCollection(), any(Instant.class)))
                .thenThrow(new RuntimeException("Database error"));

        // Act: should not throw
        scheduler.deleteOldJobs();

        // Assert
        verify(jobRepository, never()).deleteAll(any());
    }

    private Job createJob(String externalId, Instant createdAt) {
        Job job = Job.create(externalId, "tag-manager", 100, "owner-1");
        ReflectionTestUtils.setField(job, "createdAt", createdAt);
        return job;
    }
}
