package com.wpanther.ticketbulkops.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wpanther.ticketbulkops.batch.BatchExecutor;
import com.wpanther.ticketbulkops.batch.TicketMutations;
import com.wpanther.ticketbulkops.client.TicketStoreClient;
import com.wpanther.ticketbulkops.client.TicketStoreClientProvider;
import com.wpanther.ticketbulkops.dto.zendesk.Ticket;
import com.wpanther.ticketbulkops.entity.Job;
import com.wpanther.ticketbulkops.entity.JobStatus;
import com.wpanther.ticketbulkops.exception.TicketStoreConfigurationException;
import com.wpanther.ticketbulkops.queue.TaskQueue;
import com.wpanther.ticketbulkops.repository.JobRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for BulkJobWorker, running the real batch and job bookkeeping against mocked storage
 */
@ExtendWith(MockitoExtension.class)
class BulkJobWorkerTest {

    private static final String EXTERNAL_ID = "ext-1";

    @Mock
    private JobRepository jobRepository;

    @Mock
    private TaskQueue taskQueue;

    @Mock
    private TicketStoreClientProvider clientProvider;

    @Mock
    private TicketStoreClient client;

    private Job job;

    @BeforeEach
    void setUp() {
        job = Job.create(EXTERNAL_ID, "tag-manager", 3, "owner-1");
        lenient().when(jobRepository.findByExternalIdForUpdate(EXTERNAL_ID)).thenReturn(Optional.of(job));
        lenient().when(jobRepository.findByExternalId(EXTERNAL_ID)).thenReturn(Optional.of(job));
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    void testRun_CompletesJobWithFullProgress() throws Exception {
        // Arrange
        when(clientProvider.requireClient()).thenReturn(client);
        when(client.getTicket(anyLong())).thenAnswer(invocation ->
                Ticket.builder().id(invocation.<Long>getArgument(0)).tags(List.of("vip")).build());
        BulkJobWorker worker = worker(new BatchExecutor(duration -> { }));

        // Act
        worker.run(EXTERNAL_ID, List.of(1L, 2L, 3L),
                c -> TicketMutations.addTags(c, List.of("urgent")), Map.of("operation", "add"));

        // Assert
        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.getProgress()).isEqualTo(100);
        assertThat(job.getProcessedItems()).isEqualTo(3);

        ArgumentCaptor<Ticket> updates = ArgumentCaptor.forClass(Ticket.class);
        verify(client, times(3)).updateTicket(updates.capture());
        assertThat(updates.getAllValues()).allSatisfy(ticket ->
                assertThat(ticket.getTags()).containsExactly("vip", "urgent"));

        Map<?, ?> result = new ObjectMapper().readValue(job.getResultData(), Map.class);
        assertThat(result.get("operation")).isEqualTo("add");
        assertThat(result.get("successful")).isEqualTo(3);
        assertThat(result.get("failed")).isEqualTo(0);
    }

    @Test
    void testRun_SkipsJobCancelledWhileQueued() {
        // Arrange
        job.cancel();
        BulkJobWorker worker = worker(new BatchExecutor(duration -> { }));

        // Act
        worker.run(EXTERNAL_ID, List.of(1L), c -> ticketId -> { }, Map.of());

        // Assert
        assertThat(job.getStatus()).isEqualTo(JobStatus.CANCELLED);
        verifyNoInteractions(clientProvider);
    }

    @Test
    void testRun_MissingCredentialsFailJob() {
        // Arrange
        when(clientProvider.requireClient()).thenThrow(new TicketStoreConfigurationException("Zendesk client not configured"));
        BulkJobWorker worker = worker(new BatchExecutor(duration -> { }));

        // Act
        worker.run(EXTERNAL_ID, List.of(1L), c -> ticketId -> { }, Map.of());

        // Assert
        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(job.getErrorMessage()).isEqualTo("Zendesk client not configured");
    }

    @Test
    void testRun_InterruptFailsJobAndRestoresFlag() {
        // Arrange
        when(clientProvider.requireClient()).thenReturn(client);
        BulkJobWorker worker = worker(new BatchExecutor(duration -> {
            throw new InterruptedException("revoked");
        }));

        // Act
        worker.run(EXTERNAL_ID, List.of(1L, 2L), c -> ticketId -> { }, Map.of());

        // Assert
        assertThat(Thread.currentThread().isInterrupted()).isTrue();
        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(job.getErrorMessage()).isEqualTo("Job was interrupted before it finished");
        assertThat(job.getProcessedItems()).isEqualTo(1);
    }

    @Test
    void testRun_InterruptAfterCancellationKeepsJobCancelled() {
        // Arrange: the cancellation is committed before the worker is interrupted
        when(clientProvider.requireClient()).thenReturn(client);
        BulkJobWorker worker = worker(new BatchExecutor(duration -> {
            job.cancel();
            throw new InterruptedException("revoked");
        }));

        // Act
        worker.run(EXTERNAL_ID, List.of(1L, 2L), c -> ticketId -> { }, Map.of());

        // Assert
        assertThat(Thread.currentThread().isInterrupted()).isTrue();
        assertThat(job.getStatus()).isEqualTo(JobStatus.CANCELLED);
        assertThat(job.getErrorMessage()).isNull();
        assertThat(job.getResultData()).isNull();
    }

    @Test
    void testRun_CancellationDuringRunIsKept() {
        // Arrange
        when(clientProvider.requireClient()).thenReturn(client);
        BulkJobWorker worker = worker(new BatchExecutor(duration -> { }));

        // Act: the job is cancelled while the first ticket is processed
        worker.run(EXTERNAL_ID, List.of(1L, 2L), c -> ticketId -> {
            if (ticketId == 1L) {
                job.cancel();
            }
        }, Map.of());

        // Assert
        assertThat(job.getStatus()).isEqualTo(JobStatus.CANCELLED);
        assertThat(job.getResultData()).isNull();
        verify(jobRepository, never()).delete(any(Job.class));
    }

    private BulkJobWorker worker(BatchExecutor batchExecutor) {
        JobService jobService = new JobService(jobRepository, taskQueue, new ObjectMapper());
        BulkJobWorker worker = new BulkJobWorker(jobService, batchExecutor, clientProvider);
        ReflectionTestUtils.setField(worker, "itemDelayMs", 0L);
        return worker;
    }
}
