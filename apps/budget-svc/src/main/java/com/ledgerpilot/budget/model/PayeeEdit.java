package com.ledgerpilot.budget.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PayeeEdit(@JsonProperty("name") String name) {

    public PayeeEdit {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("payee name must be provided");
        }
    }
}
