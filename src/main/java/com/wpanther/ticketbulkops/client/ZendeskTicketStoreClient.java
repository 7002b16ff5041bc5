package com.wpanther.ticketbulkops.client;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.wpanther.ticketbulkops.dto.zendesk.Macro;
import com.wpanther.ticketbulkops.dto.zendesk.Ticket;
import com.wpanther.ticketbulkops.dto.zendesk.View;
import com.wpanther.ticketbulkops.exception.RemoteApiException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * Zendesk REST API v2 client authenticated with an API token
 */
@Slf4j
public class ZendeskTicketStoreClient implements TicketStoreClient {

    private static final int MAX_ERROR_BODY = 300;

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String subdomain;
    private final String baseUrl;
    private final String authorization;
    private final Duration timeout;

    public ZendeskTicketStoreClient(HttpClient httpClient, ObjectMapper objectMapper,
                                    String subdomain, String email, String apiToken, Duration timeout) {
        this(httpClient, objectMapper, subdomain, "https://" + subdomain + ".zendesk.com", email, apiToken, timeout);
    }

    ZendeskTicketStoreClient(HttpClient httpClient, ObjectMapper objectMapper, String subdomain,
                             String baseUrl, String email, String apiToken, Duration timeout) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.subdomain = subdomain;
        this.baseUrl = baseUrl;
        this.timeout = timeout;
        String credentials = email + "/token:" + apiToken;
        this.authorization = "Basic " + Base64.getEncoder()
                .encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public List<View> getViews() {
        return readPaged(baseUrl + "/api/v2/views.json", "views", new TypeReference<List<View>>() {}, null);
    }

    @Override
    public List<Macro> getMacros() {
        return readPaged(baseUrl + "/api/v2/macros.json", "macros", new TypeReference<List<Macro>>() {}, null);
    }

    @Override
    public List<Ticket> getViewTickets(long viewId, Integer limit) {
        return readPaged(baseUrl + "/api/v2/views/" + viewId + "/tickets.json", "tickets",
                new TypeReference<List<Ticket>>() {}, limit);
    }

    @Override
    public Ticket getTicket(long ticketId) {
        JsonNode body = send(request(baseUrl + "/api/v2/tickets/" + ticketId + ".json").GET().build());
        return convert(body.path("ticket"), Ticket.class);
    }

    @Override
    public Ticket updateTicket(Ticket ticket) {
        if (ticket.getId() == null) {
            throw new IllegalArgumentException("Ticket id is required for update");
        }
        ObjectNode payload = objectMapper.createObjectNode();
        ObjectNode ticketNode = payload.putObject("ticket");
        if (ticket.getTags() != null) {
            ticketNode.set("tags", objectMapper.valueToTree(ticket.getTags()));
        }
        if (ticket.getMacroIds() != null) {
            ticketNode.set("macro_ids", objectMapper.valueToTree(ticket.getMacroIds()));
        }

        HttpRequest httpRequest = request(baseUrl + "/api/v2/tickets/" + ticket.getId() + ".json")
                .header("Content-Type", "application/json")
                .PUT(HttpRequest.BodyPublishers.ofString(payload.toString(), StandardCharsets.UTF_8))
                .build();
        JsonNode body = send(httpRequest);
        return convert(body.path("ticket"), Ticket.class);
    }

    @Override
    public String testConnection() {
        JsonNode body = send(request(baseUrl + "/api/v2/users/me.json").GET().build());
        return body.path("user").path("email").asText();
    }

    @Override
    public String getSubdomain() {
        return subdomain;
    }

    /**
     * Follows next_page links until exhausted or until limit items were read
     */
    private <T> List<T> readPaged(String firstPage, String collectionKey, TypeReference<List<T>> type, Integer limit) {
        List<T> items = new ArrayList<>();
        String url = firstPage;
        while (url != null) {
            JsonNode body = send(request(url).GET().build());
            List<T> page = convert(body.path(collectionKey), type);
            for (T item : page) {
                if (limit != null && items.size() >= limit) {
                    return items;
                }
                items.add(item);
            }
            if (limit != null && items.size() >= limit) {
                return items;
            }
            JsonNode next = body.path("next_page");
            url = next.isTextual() && !next.asText().isEmpty() ? next.asText() : null;
        }
        return items;
    }

    private HttpRequest.Builder request(String url) {
        return HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(timeout)
                .header("Authorization", authorization)
                .header("Accept", "application/json");
    }

    private JsonNode send(HttpRequest httpRequest) {
        HttpResponse<String> response;
        try {
            response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new RemoteApiException(0, "Zendesk request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteApiException(0, "Zendesk request interrupted", e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            String body = response.body() == null ? "" : response.body();
            if (body.length() > MAX_ERROR_BODY) {
                body = body.substring(0, MAX_ERROR_BODY);
            }
            log.debug("Zendesk {} {} returned {}", httpRequest.method(), httpRequest.uri(), status);
            throw new RemoteApiException(status, "Zendesk API returned HTTP " + status + ": " + body);
        }

        try {
            String body = response.body();
            return body == null || body.isEmpty() ? objectMapper.createObjectNode() : objectMapper.readTree(body);
        } catch (IOException e) {
            throw new RemoteApiException(status, "Invalid JSON from Zendesk: " + e.getMessage(), e);
        }
    }

    private <T> T convert(JsonNode node, Class<T> type) {
        try {
            return objectMapper.treeToValue(node, type);
        } catch (IOException e) {
            throw new RemoteApiException(0, "Unexpected Zendesk payload: " + e.getMessage(), e);
        }
    }

    private <T> List<T> convert(JsonNode node, TypeReference<List<T>> type) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return new ArrayList<>();
        }
        try {
            return objectMapper.readValue(objectMapper.treeAsTokens(node), type);
        } catch (IOException e) {
            throw new RemoteApiException(0, "Unexpected Zendesk payload: " + e.getMessage(), e);
        }
    }
}
