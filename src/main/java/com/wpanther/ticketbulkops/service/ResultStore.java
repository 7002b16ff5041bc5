package com.wpanther.ticketbulkops.service;

import com.wpanther.ticketbulkops.operation.OperationResult;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Last inline result per caller and operation, kept in memory so it can be exported afterwards.
 * Least recently used entries are dropped once the store is full.
 */
@Component
public class ResultStore {

    private final Map<String, OperationResult> results;

    public ResultStore(@Value("${app.results.max-entries:1000}") int maxEntries) {
        this.results = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, OperationResult> eldest) {
                return size() > maxEntries;
            }
        };
    }

    public synchronized void save(String ownerId, String operationSlug, OperationResult result) {
        results.put(key(ownerId, operationSlug), result);
    }

    public synchronized Optional<OperationResult> find(String ownerId, String operationSlug) {
        return Optional.ofNullable(results.get(key(ownerId, operationSlug)));
    }

    public synchronized int size() {
        return results.size();
    }

    private static String key(String ownerId, String operationSlug) {
        return ownerId + "\u0000" + operationSlug;
    }
}
