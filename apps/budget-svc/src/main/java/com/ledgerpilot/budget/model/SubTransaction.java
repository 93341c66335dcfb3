package com.ledgerpilot.budget.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SubTransaction(
        @JsonProperty("id") String id,
        @JsonProperty("transaction_id") String transactionId,
        @JsonProperty("amount") long amount,
        @JsonProperty("memo") String memo,
        @JsonProperty("payee_id") String payeeId,
        @JsonProperty("payee_name") String payeeName,
        @JsonProperty("category_id") String categoryId,
        @JsonProperty("category_name") String categoryName,
        @JsonProperty("deleted") boolean deleted
) {
}
