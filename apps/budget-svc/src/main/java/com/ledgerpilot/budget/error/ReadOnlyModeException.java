package com.ledgerpilot.budget.error;

public class ReadOnlyModeException extends RuntimeException {

    public ReadOnlyModeException(String operation) {
        super("Server is in read-only mode; '" + operation + "' is disabled");
    }
}
