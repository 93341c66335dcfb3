package com.ledgerpilot.budget.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record NewTransaction(
        @JsonProperty("account_id") String accountId,
        @JsonProperty("date") String date,
        @JsonProperty("amount") long amount,
        @JsonProperty("payee_id") String payeeId,
        @JsonProperty("payee_name") String payeeName,
        @JsonProperty("category_id") String categoryId,
        @JsonProperty("memo") String memo,
        @JsonProperty("cleared") String cleared,
        @JsonProperty("approved") Boolean approved,
        @JsonProperty("flag_color") String flagColor
) {

    public NewTransaction {
        if (accountId == null || accountId.isBlank()) {
            throw new IllegalArgumentException("accountId must be provided");
        }
        if (date == null || date.isBlank()) {
            throw new IllegalArgumentException("date must be provided");
        }
    }
}
