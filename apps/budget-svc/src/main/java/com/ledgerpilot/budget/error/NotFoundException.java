package com.ledgerpilot.budget.error;

import java.util.List;

/**
 * A name or id supplied by the caller does not match anything known locally.
 * {@link #alternatives()} lists valid choices where they are cheap to enumerate.
 */
public class NotFoundException extends RuntimeException {

    private final String entityType;
    private final String query;
    private final List<String> alternatives;

    public NotFoundException(String entityType, String query, List<String> alternatives) {
        this(entityType, query, alternatives, defaultMessage(entityType, query, alternatives));
    }

    protected NotFoundException(String entityType, String query, List<String> alternatives, String message) {
        super(message);
        this.entityType = entityType;
        this.query = query;
        this.alternatives = alternatives == null ? List.of() : List.copyOf(alternatives);
    }

    public String entityType() {
        return entityType;
    }

    public String query() {
        return query;
    }

    public List<String> alternatives() {
        return alternatives;
    }

    private static String defaultMessage(String entityType, String query, List<String> alternatives) {
        String available = alternatives == null || alternatives.isEmpty() ? "none" : String.join(", ", alternatives);
        return "%s not found: \"%s\". Available: %s".formatted(capitalize(entityType), query, available);
    }

    private static String capitalize(String value) {
        if (value == null || value.isEmpty()) {
            return "Entity";
        }
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }
}
