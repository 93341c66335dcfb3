package com.ledgerpilot.budget.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Account(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("type") String type,
        @JsonProperty("on_budget") boolean onBudget,
        @JsonProperty("closed") boolean closed,
        @JsonProperty("note") String note,
        @JsonProperty("balance") long balance,
        @JsonProperty("cleared_balance") long clearedBalance,
        @JsonProperty("uncleared_balance") long unclearedBalance,
        @JsonProperty("transfer_payee_id") String transferPayeeId,
        @JsonProperty("deleted") boolean deleted
) implements ReferenceEntity {
}
