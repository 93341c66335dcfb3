package com.ledgerpilot.budget.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonUnwrapped;

/**
 * Entry of a batch update: the transaction id followed by the fields to merge.
 */
public record TransactionPatch(
        @JsonProperty("id") String id,
        @JsonUnwrapped TransactionFields fields
) {
}
