package com.ledgerpilot.budget.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Payee(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("transfer_account_id") String transferAccountId,
        @JsonProperty("deleted") boolean deleted
) implements ReferenceEntity {
}
