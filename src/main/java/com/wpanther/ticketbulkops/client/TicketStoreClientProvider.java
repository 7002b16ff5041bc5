package com.wpanther.ticketbulkops.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wpanther.ticketbulkops.exception.RemoteApiException;
import com.wpanther.ticketbulkops.exception.TicketStoreConfigurationException;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Optional;

/**
 * Builds and caches the ticket store client from the configured credentials.
 * The client is created lazily so the service starts without credentials.
 */
@Component
@Slf4j
public class TicketStoreClientProvider {

    private final ObjectMapper objectMapper;

    @Value("${app.zendesk.subdomain:}")
    private String subdomain;

    @Value("${app.zendesk.email:}")
    private String email;

    @Value("${app.zendesk.api-token:}")
    private String apiToken;

    @Value("${app.zendesk.timeout-seconds:30}")
    private int timeoutSeconds;

    private TicketStoreClient client;

    public TicketStoreClientProvider(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public boolean isConfigured() {
        return StringUtils.hasText(subdomain) && StringUtils.hasText(email) && StringUtils.hasText(apiToken);
    }

    /**
     * Client for the configured account, empty when credentials are missing
     */
    public synchronized Optional<TicketStoreClient> getClient() {
        if (!isConfigured()) {
            return Optional.empty();
        }
        if (client == null) {
            Duration timeout = Duration.ofSeconds(timeoutSeconds);
            HttpClient httpClient = HttpClient.newBuilder()
                    .version(HttpClient.Version.HTTP_1_1)
                    .connectTimeout(timeout)
                    .build();
            client = new ZendeskTicketStoreClient(httpClient, objectMapper, subdomain, email, apiToken, timeout);
            log.info("Zendesk client created for subdomain: {}", subdomain);
        }
        return Optional.of(client);
    }

    /**
     * @throws TicketStoreConfigurationException when no credentials are configured
     */
    public TicketStoreClient requireClient() {
        return getClient().orElseThrow(() ->
                new TicketStoreConfigurationException("Zendesk client not configured"));
    }

    /**
     * Drop the cached client so the next call rebuilds it
     */
    public synchronized void clearClient() {
        client = null;
        log.info("Zendesk client cache cleared");
    }

    /**
     * Check the credentials against the remote API
     *
     * @return user facing outcome message
     */
    public ConnectionStatus testConnection() {
        Optional<TicketStoreClient> configured = getClient();
        if (configured.isEmpty()) {
            return new ConnectionStatus(false, "Zendesk credentials not configured");
        }
        try {
            String user = configured.get().testConnection();
            return new ConnectionStatus(true, "Connection successful! Connected as: " + user);
        } catch (RemoteApiException e) {
            log.warn("Zendesk connection test failed: {}", e.getMessage());
            return new ConnectionStatus(false, "Connection failed: " + e.getMessage());
        }
    }

    @Getter
    @AllArgsConstructor
    public static class ConnectionStatus {
        private final boolean connected;
        private final String message;
    }
}
