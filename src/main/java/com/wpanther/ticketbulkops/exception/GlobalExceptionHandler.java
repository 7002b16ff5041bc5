package com.wpanther.ticketbulkops.exception;

import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import lombok.extern.slf4j.Slf4j;

import java.time.Instant;

@ControllerAdvice
@Slf4j
@Order(Ordered.HIGHEST_PRECEDENCE)
public class GlobalExceptionHandler {

    @ExceptionHandler(OperationValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(OperationValidationException ex) {
        log.warn("Validation error: {}", ex.getMessage());
        return createErrorResponse("Validation error: " + ex.getMessage(), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(UnsupportedExportFormatException.class)
    public ResponseEntity<ErrorResponse> handleUnsupportedExportFormat(UnsupportedExportFormatException ex) {
        log.warn("Export rejected: {}", ex.getMessage());
        return createErrorResponse(ex.getMessage(), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(OperationAccessDeniedException.class)
    public ResponseEntity<ErrorResponse> handleAccessDenied(OperationAccessDeniedException ex) {
        log.warn("Access denied: {}", ex.getMessage());
        return createErrorResponse(ex.getMessage(), HttpStatus.FORBIDDEN);
    }

    @ExceptionHandler({JobNotFoundException.class, OperationNotFoundException.class, ResultNotAvailableException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(RuntimeException ex) {
        log.debug("Not found: {}", ex.getMessage());
        return createErrorResponse(ex.getMessage(), HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(JobStateException.class)
    public ResponseEntity<ErrorResponse> handleJobStateException(JobStateException ex) {
        log.warn("Job state conflict: {}", ex.getMessage());
        return createErrorResponse(ex.getMessage(), HttpStatus.CONFLICT);
    }

    @ExceptionHandler(TicketStoreConfigurationException.class)
    public ResponseEntity<ErrorResponse> handleConfigurationException(TicketStoreConfigurationException ex) {
        log.error("Ticket store not usable", ex);
        return createErrorResponse(ex.getMessage(), HttpStatus.SERVICE_UNAVAILABLE);
    }

    @ExceptionHandler({Exception.class})
    public ResponseEntity<ErrorResponse> handleException(Exception ex) {
        log.error("Unexpected error", ex);
        return createErrorResponse("An unexpected error occurred: " + ex.getMessage(),
                HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private ResponseEntity<ErrorResponse> createErrorResponse(String message, HttpStatus status) {
        ErrorResponse errorResponse = new ErrorResponse(
            message,
            status.value(),
            Instant.now()
        );
        return new ResponseEntity<>(errorResponse, status);
    }

    public static class ErrorResponse {
        private final String message;
        private final int status;
        private final Instant timestamp;

        public ErrorResponse(String message, int status, Instant timestamp) {
            this.message = message;
            this.status = status;
            this.timestamp = timestamp;
        }

        public String getMessage() {
            return message;
        }

        public int getStatus() {
            return status;
        }

        public Instant getTimestamp() {
            return timestamp;
        }
    }
}
