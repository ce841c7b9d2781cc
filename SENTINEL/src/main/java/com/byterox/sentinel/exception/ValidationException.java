package com.byterox.sentinel.exception;

import java.util.List;

/**
 * Rejected configuration: bad cron, rule, step or channel settings.
 * Raised synchronously at create/update time.
 */
public class ValidationException extends SentinelException {

    private final List<String> errors;

    public ValidationException(String message) {
        this(message, List.of(message));
    }

    public ValidationException(String message, List<String> errors) {
        super(message);
        this.errors = List.copyOf(errors);
    }

    public static ValidationException of(String subject, List<String> errors) {
        return new ValidationException("Invalid " + subject + ": " + String.join("; ", errors), errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
