package com.wpanther.ticketbulkops.batch;

/**
 * One remote change applied to a single ticket
 */
@FunctionalInterface
public interface TicketMutation {

    void apply(long ticketId);
}
