package com.wpanther.ticketbulkops.operation.impl;

import com.wpanther.ticketbulkops.batch.BatchExecutor;
import com.wpanther.ticketbulkops.batch.BatchResult;
import com.wpanther.ticketbulkops.client.TicketStoreClient;
import com.wpanther.ticketbulkops.client.TicketStoreClientProvider;
import com.wpanther.ticketbulkops.dto.zendesk.Ticket;
import com.wpanther.ticketbulkops.dto.zendesk.View;
import com.wpanther.ticketbulkops.entity.Job;
import com.wpanther.ticketbulkops.operation.FieldOption;
import com.wpanther.ticketbulkops.operation.FormInputs;
import com.wpanther.ticketbulkops.operation.OperationResult;
import com.wpanther.ticketbulkops.service.BulkJobWorker;
import com.wpanther.ticketbulkops.service.JobService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Runs an action over the tickets of a view, inline or as a background job
 */
@Component
@Slf4j
public class ViewBatchRunner {

    private final TicketStoreClientProvider clientProvider;
    private final BatchExecutor batchExecutor;
    private final JobService jobService;
    private final BulkJobWorker worker;

    @Value("${app.batch.item-delay-ms:1000}")
    private long itemDelayMs = 1000;

    public ViewBatchRunner(TicketStoreClientProvider clientProvider, BatchExecutor batchExecutor,
                           JobService jobService, BulkJobWorker worker) {
        this.clientProvider = clientProvider;
        this.batchExecutor = batchExecutor;
        this.jobService = jobService;
        this.worker = worker;
    }

    /**
     * Active views as select options; a single "error" option when they cannot be loaded
     */
    public List<FieldOption> viewOptions() {
        try {
            TicketStoreClient client = clientProvider.requireClient();
            return client.getViews().stream()
                    .filter(View::isActive)
                    .map(view -> new FieldOption(String.valueOf(view.getId()), view.getTitle()))
                    .collect(Collectors.toList());
        } catch (RuntimeException e) {
            log.warn("Could not load views: {}", e.getMessage());
            return List.of(new FieldOption(FormInputs.ERROR_OPTION, "Error loading views: " + e.getMessage()));
        }
    }

    /**
     * Run inline, or only preview the tickets when dryRun is set
     */
    OperationResult runInline(long viewId, int limit, boolean dryRun, ViewBatchAction action) {
        try {
            TicketStoreClient client = clientProvider.requireClient();
            List<Ticket> tickets = client.getViewTickets(viewId, limit);

            Map<String, Object> data = new LinkedHashMap<>();
            data.put("view_id", viewId);
            if (tickets.isEmpty()) {
                data.putAll(action.describe(client));
                data.put("total_tickets", 0);
                data.put("processed", 0);
                data.put("dry_run", dryRun);
                return OperationResult.success("No tickets found in the selected view.", data);
            }

            String viewName = viewName(client, viewId);
            data.put("view_name", viewName);
            data.putAll(action.describe(client));
            data.put("total_tickets", tickets.size());
            data.put("dry_run", dryRun);

            if (dryRun) {
                List<Map<String, Object>> preview = new ArrayList<>();
                for (Ticket ticket : tickets) {
                    preview.add(action.preview(ticket));
                }
                data.put("tickets", preview);
                return OperationResult.success("DRY RUN: Found " + tickets.size() + " ticket(s) in view \""
                        + viewName + "\". No changes were made.", data);
            }

            BatchResult batch = batchExecutor.execute(ticketIds(tickets), action.mutation(client),
                    Duration.ofMillis(itemDelayMs));
            data.putAll(batch.toPayload());

            String message = batch.failureCount() == 0
                    ? action.successMessage(batch.successCount(), viewName)
                    : action.partialMessage(batch.successCount(), batch.failureCount());
            return OperationResult.success(message, data);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Inline run over view {} interrupted", viewId);
            return OperationResult.failure("Error: operation was interrupted");
        } catch (RuntimeException e) {
            log.error("Inline run over view {} failed", viewId, e);
            return OperationResult.failure("Error: " + e.getMessage());
        }
    }

    /**
     * Snapshot the view's tickets, create the job and enqueue the batch
     */
    OperationResult startJob(String operationSlug, long viewId, int limit, ViewBatchAction action,
                             String externalId, String ownerId) {
        try {
            TicketStoreClient client = clientProvider.requireClient();
            List<Ticket> tickets = client.getViewTickets(viewId, limit);
            if (tickets.isEmpty()) {
                return OperationResult.failure("No tickets found in the selected view.");
            }

            List<Long> ids = ticketIds(tickets);
            Map<String, Object> context = new LinkedHashMap<>();
            context.put("view_id", viewId);
            context.put("view_name", viewName(client, viewId));
            context.putAll(action.describe(client));
            context.put("total_tickets", ids.size());
            context.put("dry_run", false);

            Job job = jobService.submitJob(externalId, operationSlug, ids.size(), ownerId,
                    () -> worker.run(externalId, ids, action::mutation, context));

            return OperationResult.jobStarted(externalId, job.getId(),
                    "Job started. Processing " + ids.size() + " tickets in the background...");

        } catch (RuntimeException e) {
            log.error("Could not start {} job over view {}", operationSlug, viewId, e);
            return OperationResult.failure("Error starting background job: " + e.getMessage());
        }
    }

    private static List<Long> ticketIds(List<Ticket> tickets) {
        return tickets.stream().map(Ticket::getId).collect(Collectors.toList());
    }

    private static String viewName(TicketStoreClient client, long viewId) {
        return client.getViews().stream()
                .filter(view -> view.getId() != null && view.getId() == viewId)
                .map(View::getTitle)
                .findFirst()
                .orElse("Unknown View");
    }
}
