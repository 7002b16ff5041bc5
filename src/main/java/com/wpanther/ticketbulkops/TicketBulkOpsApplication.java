package com.wpanther.ticketbulkops;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Bulk ticket operations service: runs tag and macro changes over Zendesk views,
 * inline for small batches and as tracked background jobs for large ones.
 */
@SpringBootApplication
public class TicketBulkOpsApplication {

    public static void main(String[] args) {
        SpringApplication.run(TicketBulkOpsApplication.class, args);
    }
}
