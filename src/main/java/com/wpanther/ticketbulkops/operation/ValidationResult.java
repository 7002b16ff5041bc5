package com.wpanther.ticketbulkops.operation;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Optional;

@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ValidationResult {

    private static final ValidationResult OK = new ValidationResult(true, null);

    private final boolean valid;

    private final String error;

    public static ValidationResult ok() {
        return OK;
    }

    public static ValidationResult invalid(String error) {
        return new ValidationResult(false, error);
    }

    public Optional<String> errorMessage() {
        return Optional.ofNullable(error);
    }
}
