package com.wpanther.ticketbulkops.controller;

import com.wpanther.ticketbulkops.dto.OperationDetailResponse;
import com.wpanther.ticketbulkops.dto.OperationSummaryResponse;
import com.wpanther.ticketbulkops.operation.BulkOperation;
import com.wpanther.ticketbulkops.operation.OperationDescriptor;
import com.wpanther.ticketbulkops.operation.OperationRegistry;
import com.wpanther.ticketbulkops.operation.OperationResult;
import com.wpanther.ticketbulkops.service.DispatchService;
import com.wpanther.ticketbulkops.service.ResultExportService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Catalog of bulk operations and the endpoints to run and export them
 */
@RestController
@RequestMapping("/api/v1/operations")
@RequiredArgsConstructor
@Slf4j
public class OperationController {

    private final OperationRegistry registry;
    private final DispatchService dispatchService;
    private final ResultExportService exportService;

    /**
     * List registered operations, optionally of one category
     */
    @GetMapping
    public ResponseEntity<List<OperationSummaryResponse>> listOperations(
            @RequestParam(required = false) String category) {
        Map<String, OperationDescriptor> descriptors = StringUtils.hasText(category)
                ? registry.byCategory(category)
                : registry.all();
        List<OperationSummaryResponse> response = descriptors.values().stream()
                .map(OperationSummaryResponse::from)
                .collect(Collectors.toList());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/categories")
    public ResponseEntity<List<String>> listCategories() {
        return ResponseEntity.ok(registry.categories());
    }

    /**
     * Operation metadata and its form
     */
    @GetMapping("/{slug}")
    public ResponseEntity<OperationDetailResponse> getOperation(
            @PathVariable String slug,
            @RequestHeader(value = CallerHeaders.ADMIN, defaultValue = "false") boolean admin) {
        BulkOperation operation = dispatchService.requireAccessible(slug, admin);
        return ResponseEntity.ok(new OperationDetailResponse(
                OperationSummaryResponse.from(operation.descriptor()), operation.formSchema()));
    }

    /**
     * Run an operation. Answers 202 when the work was handed to a background job.
     */
    @PostMapping("/{slug}")
    public ResponseEntity<OperationResult> runOperation(
            @PathVariable String slug,
            @RequestBody Map<String, String> input,
            @RequestHeader(value = CallerHeaders.OWNER_ID, defaultValue = CallerHeaders.DEFAULT_OWNER) String ownerId,
            @RequestHeader(value = CallerHeaders.ADMIN, defaultValue = "false") boolean admin) {
        log.debug("Run request for {} from {}", slug, ownerId);
        OperationResult result = dispatchService.dispatch(slug, input, ownerId, admin);
        HttpStatus status = result.hasJob() ? HttpStatus.ACCEPTED : HttpStatus.OK;
        return ResponseEntity.status(status).body(result);
    }

    /**
     * Download the caller's last inline result of an operation
     */
    @GetMapping("/{slug}/export/{format}")
    public ResponseEntity<byte[]> exportResult(
            @PathVariable String slug,
            @PathVariable String format,
            @RequestHeader(value = CallerHeaders.OWNER_ID, defaultValue = CallerHeaders.DEFAULT_OWNER) String ownerId,
            @RequestHeader(value = CallerHeaders.ADMIN, defaultValue = "false") boolean admin) {
        return ExportResponses.download(exportService.exportLastResult(slug, format, ownerId, admin));
    }
}
