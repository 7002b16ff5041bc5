package com.wpanther.ticketbulkops.service;

import com.wpanther.ticketbulkops.batch.BatchExecutor;
import com.wpanther.ticketbulkops.batch.BatchResult;
import com.wpanther.ticketbulkops.batch.TicketMutation;
import com.wpanther.ticketbulkops.client.TicketStoreClient;
import com.wpanther.ticketbulkops.client.TicketStoreClientProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Body of a background job: runs the batch on a queue thread and records the outcome on the job.
 * Nothing escapes {@link #run}; every failure ends up on the job row.
 */
@Component
@Slf4j
public class BulkJobWorker {

    private final JobService jobService;
    private final BatchExecutor batchExecutor;
    private final TicketStoreClientProvider clientProvider;

    @Value("${app.batch.item-delay-ms:1000}")
    private long itemDelayMs = 1000;

    public BulkJobWorker(JobService jobService, BatchExecutor batchExecutor,
                         TicketStoreClientProvider clientProvider) {
        this.jobService = jobService;
        this.batchExecutor = batchExecutor;
        this.clientProvider = clientProvider;
    }

    /**
     * Process the tickets of one job
     *
     * @param externalId      task queue id of the job
     * @param ticketIds       tickets in processing order
     * @param mutationFactory builds the per-ticket change from a client created on this thread
     * @param context         operation specific fields stored in front of the batch counts
     */
    public void run(String externalId, List<Long> ticketIds,
                    Function<TicketStoreClient, TicketMutation> mutationFactory,
                    Map<String, Object> context) {
        log.info("Worker picked up job {} with {} tickets", externalId, ticketIds.size());
        try {
            if (!jobService.markStarted(externalId)) {
                return;
            }

            TicketStoreClient client = clientProvider.requireClient();
            TicketMutation mutation = mutationFactory.apply(client);

            BatchResult batch = batchExecutor.execute(ticketIds, mutation, Duration.ofMillis(itemDelayMs),
                    (processed, total) -> jobService.recordProgress(externalId, processed));

            Map<String, Object> result = new LinkedHashMap<>(context);
            result.putAll(batch.toPayload());
            jobService.completeJob(externalId, result);

        } catch (InterruptedException e) {
            // a cancelled job is terminal before its worker is interrupted
            if (jobService.isFinished(externalId)) {
                log.info("Job {} stopped after cancellation", externalId);
            } else {
                log.info("Job {} interrupted", externalId);
                jobService.failJob(externalId, "Job was interrupted before it finished");
            }
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            log.error("Job {} failed", externalId, e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            jobService.failJob(externalId, message);
        }
    }
}
