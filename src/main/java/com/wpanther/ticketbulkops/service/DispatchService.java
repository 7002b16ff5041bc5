package com.wpanther.ticketbulkops.service;

import com.wpanther.ticketbulkops.exception.OperationAccessDeniedException;
import com.wpanther.ticketbulkops.exception.OperationNotFoundException;
import com.wpanther.ticketbulkops.exception.OperationValidationException;
import com.wpanther.ticketbulkops.operation.BulkOperation;
import com.wpanther.ticketbulkops.operation.FormInputs;
import com.wpanther.ticketbulkops.operation.OperationRegistry;
import com.wpanther.ticketbulkops.operation.OperationResult;
import com.wpanther.ticketbulkops.operation.ValidationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.UUID;

/**
 * Entry point for running an operation: access check, validation, then inline or background execution.
 * Dry runs are always inline. Async-capable operations go to the background once the requested
 * ticket count exceeds their inline ceiling.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DispatchService {

    private final OperationRegistry registry;
    private final ResultStore resultStore;

    /**
     * @param slug    operation to run
     * @param input   raw form values
     * @param ownerId calling principal
     * @param admin   whether the caller holds administrator rights
     * @return the inline result, or a reference to the started job
     * @throws OperationNotFoundException     for an unknown slug
     * @throws OperationAccessDeniedException for an admin-only operation and a non-admin caller
     * @throws OperationValidationException   when the input is rejected
     */
    public OperationResult dispatch(String slug, Map<String, String> input, String ownerId, boolean admin) {
        BulkOperation operation = requireAccessible(slug, admin);

        ValidationResult validation = operation.validate(input);
        if (!validation.isValid()) {
            throw new OperationValidationException(validation.getError());
        }

        boolean dryRun = FormInputs.isDryRun(input);
        int requested = FormInputs.requestedItems(input);

        if (shouldRunAsync(operation, requested, dryRun)) {
            String externalId = UUID.randomUUID().toString();
            log.info("Dispatching {} for {} tickets to the background as {}", slug, requested, externalId);
            return operation.executeAsync(input, externalId, ownerId);
        }

        log.info("Running {} inline (requested={}, dryRun={})", slug, requested, dryRun);
        OperationResult result;
        try {
            result = operation.execute(input);
        } catch (RuntimeException e) {
            log.error("Operation {} threw instead of reporting a failure", slug, e);
            result = OperationResult.failure("Error executing operation: " + e.getMessage());
        }
        resultStore.save(ownerId, slug, result);
        return result;
    }

    /**
     * @throws OperationNotFoundException     for an unknown slug
     * @throws OperationAccessDeniedException for an admin-only operation and a non-admin caller
     */
    public BulkOperation requireAccessible(String slug, boolean admin) {
        BulkOperation operation = registry.get(slug).orElseThrow(() -> new OperationNotFoundException(slug));
        if (operation.descriptor().isAdminOnly() && !admin) {
            log.warn("Non-admin caller denied access to {}", slug);
            throw new OperationAccessDeniedException("This operation requires administrator privileges.");
        }
        return operation;
    }

    static boolean shouldRunAsync(BulkOperation operation, int requested, boolean dryRun) {
        return !dryRun && operation.supportsAsync() && requested > operation.itemCeiling(false);
    }
}
