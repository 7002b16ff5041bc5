package com.wpanther.ticketbulkops.operation;

import com.wpanther.ticketbulkops.exception.DuplicateSlugException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Catalog of operations keyed by slug.
 * Filled once at startup by {@code OperationRegistryConfig}; append-only afterwards.
 */
@Slf4j
public class OperationRegistry {

    // Insertion ordered, so listings follow registration order
    private final Map<String, BulkOperation> operations = Collections.synchronizedMap(new LinkedHashMap<>());

    /**
     * @throws DuplicateSlugException if the slug is already registered
     */
    public void register(BulkOperation operation) {
        OperationDescriptor descriptor = Objects.requireNonNull(operation.descriptor(), "descriptor");
        String slug = descriptor.getSlug();
        if (slug == null || slug.isBlank()) {
            throw new IllegalArgumentException(
                    "Operation " + operation.getClass().getSimpleName() + " must define a slug");
        }
        synchronized (operations) {
            if (operations.containsKey(slug)) {
                throw new DuplicateSlugException(slug);
            }
            operations.put(slug, operation);
        }
        log.info("Registered operation: {} ({})", descriptor.getName(), slug);
    }

    public Optional<BulkOperation> get(String slug) {
        if (slug == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(operations.get(slug));
    }

    public boolean contains(String slug) {
        return slug != null && operations.containsKey(slug);
    }

    /**
     * Descriptors of all operations, in registration order
     */
    public Map<String, OperationDescriptor> all() {
        synchronized (operations) {
            Map<String, OperationDescriptor> descriptors = new LinkedHashMap<>();
            operations.forEach((slug, operation) -> descriptors.put(slug, operation.descriptor()));
            return descriptors;
        }
    }

    public Map<String, OperationDescriptor> byCategory(String category) {
        return all().entrySet().stream()
                .filter(entry -> Objects.equals(entry.getValue().getCategory(), category))
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue,
                        (first, second) -> first, LinkedHashMap::new));
    }

    /**
     * Distinct categories, sorted
     */
    public List<String> categories() {
        return new ArrayList<>(all().values().stream()
                .map(OperationDescriptor::getCategory)
                .collect(Collectors.toCollection(TreeSet::new)));
    }

    /**
     * Remove everything. For test isolation only.
     */
    public void clear() {
        synchronized (operations) {
            operations.clear();
        }
    }
}
