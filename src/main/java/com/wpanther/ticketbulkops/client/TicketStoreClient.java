package com.wpanther.ticketbulkops.client;

import com.wpanther.ticketbulkops.dto.zendesk.Macro;
import com.wpanther.ticketbulkops.dto.zendesk.Ticket;
import com.wpanther.ticketbulkops.dto.zendesk.View;
import com.wpanther.ticketbulkops.exception.RemoteApiException;

import java.util.List;

/**
 * Remote record store holding the tickets that bulk operations act on.
 * Every method reports failures as {@link RemoteApiException}.
 */
public interface TicketStoreClient {

    List<View> getViews();

    List<Macro> getMacros();

    /**
     * Tickets currently matched by a view
     *
     * @param viewId view to read
     * @param limit  maximum number of tickets to return, or null for all
     */
    List<Ticket> getViewTickets(long viewId, Integer limit);

    Ticket getTicket(long ticketId);

    Ticket updateTicket(Ticket ticket);

    /**
     * Email of the authenticated API user, used to check the credentials
     */
    String testConnection();

    String getSubdomain();
}
