package com.ledgerpilot.budget.error;

import java.util.Map;

/**
 * Caller input rejected before anything is staged or sent.
 */
public class ValidationException extends RuntimeException {

    private final Map<String, Object> details;

    public ValidationException(String message) {
        this(message, Map.of());
    }

    public ValidationException(String message, Map<String, Object> details) {
        super(message);
        this.details = details == null ? Map.of() : Map.copyOf(details);
    }

    public Map<String, Object> details() {
        return details;
    }
}
