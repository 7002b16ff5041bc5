package com.wpanther.ticketbulkops.operation.impl;

import com.wpanther.ticketbulkops.batch.TicketMutation;
import com.wpanther.ticketbulkops.client.TicketStoreClient;
import com.wpanther.ticketbulkops.dto.zendesk.Ticket;

import java.util.Map;

/**
 * The operation specific part of a run over the tickets of a view
 */
interface ViewBatchAction {

    /**
     * Fields describing the change, stored in the result next to the view and the counts
     */
    Map<String, Object> describe(TicketStoreClient client);

    TicketMutation mutation(TicketStoreClient client);

    /**
     * Row shown for a ticket in a dry run
     */
    Map<String, Object> preview(Ticket ticket);

    String successMessage(int updated, String viewName);

    String partialMessage(int updated, int failed);
}
