package com.wpanther.ticketbulkops.batch;

import com.wpanther.ticketbulkops.client.TicketStoreClient;
import com.wpanther.ticketbulkops.dto.zendesk.Ticket;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The ticket changes bulk operations can make, each as a {@link TicketMutation}
 */
public final class TicketMutations {

    private TicketMutations() {
    }

    /**
     * Add tags, keeping the ones already on the ticket
     */
    public static TicketMutation addTags(TicketStoreClient client, Collection<String> tags) {
        List<String> toAdd = List.copyOf(tags);
        return ticketId -> {
            Ticket ticket = client.getTicket(ticketId);
            Set<String> updated = currentTags(ticket);
            updated.addAll(toAdd);
            client.updateTicket(Ticket.builder().id(ticketId).tags(new ArrayList<>(updated)).build());
        };
    }

    /**
     * Remove tags; tags not on the ticket are ignored
     */
    public static TicketMutation removeTags(TicketStoreClient client, Collection<String> tags) {
        Set<String> toRemove = Set.copyOf(tags);
        return ticketId -> {
            Ticket ticket = client.getTicket(ticketId);
            Set<String> updated = currentTags(ticket);
            updated.removeAll(toRemove);
            client.updateTicket(Ticket.builder().id(ticketId).tags(new ArrayList<>(updated)).build());
        };
    }

    /**
     * Apply a macro by associating it with the ticket on update
     */
    public static TicketMutation applyMacro(TicketStoreClient client, long macroId) {
        return ticketId -> {
            client.getTicket(ticketId);
            client.updateTicket(Ticket.builder().id(ticketId).macroIds(List.of(macroId)).build());
        };
    }

    private static Set<String> currentTags(Ticket ticket) {
        Set<String> tags = new LinkedHashSet<>();
        if (ticket != null && ticket.getTags() != null) {
            tags.addAll(ticket.getTags());
        }
        return tags;
    }
}
