package com.ledgerpilot.budget.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TransactionDetail(
        @JsonProperty("id") String id,
        @JsonProperty("date") String date,
        @JsonProperty("amount") long amount,
        @JsonProperty("memo") String memo,
        @JsonProperty("cleared") String cleared,
        @JsonProperty("approved") boolean approved,
        @JsonProperty("flag_color") String flagColor,
        @JsonProperty("flag_name") String flagName,
        @JsonProperty("account_id") String accountId,
        @JsonProperty("account_name") String accountName,
        @JsonProperty("payee_id") String payeeId,
        @JsonProperty("payee_name") String payeeName,
        @JsonProperty("category_id") String categoryId,
        @JsonProperty("category_name") String categoryName,
        @JsonProperty("transfer_account_id") String transferAccountId,
        @JsonProperty("deleted") boolean deleted,
        @JsonProperty("subtransactions") List<SubTransaction> subtransactions
) {

    public TransactionDetail {
        subtransactions = subtransactions == null ? List.of() : List.copyOf(subtransactions);
    }
}
