package com.ledgerpilot.budget.staging;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ChangeType {
    @JsonProperty("categorization")
    CATEGORIZATION,
    @JsonProperty("split")
    SPLIT,
    @JsonProperty("update")
    UPDATE
}
