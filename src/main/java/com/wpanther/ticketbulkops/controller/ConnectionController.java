package com.wpanther.ticketbulkops.controller;

import com.wpanther.ticketbulkops.client.TicketStoreClientProvider;
import com.wpanther.ticketbulkops.client.TicketStoreClientProvider.ConnectionStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/connection")
@RequiredArgsConstructor
public class ConnectionController {

    private final TicketStoreClientProvider clientProvider;

    /**
     * Check the configured Zendesk credentials
     */
    @GetMapping
    public ResponseEntity<ConnectionStatus> testConnection() {
        return ResponseEntity.ok(clientProvider.testConnection());
    }

    /**
     * Forget the cached client, e.g. after rotating the API token
     */
    @PostMapping("/reset")
    public ResponseEntity<Void> resetClient() {
        clientProvider.clearClient();
        return ResponseEntity.noContent().build();
    }
}
