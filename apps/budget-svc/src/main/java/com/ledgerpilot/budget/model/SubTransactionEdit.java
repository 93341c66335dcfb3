package com.ledgerpilot.budget.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One part of a split as written back to the ledger. {@code amount} is in milliunits.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record SubTransactionEdit(
        @JsonProperty("amount") long amount,
        @JsonProperty("payee_id") String payeeId,
        @JsonProperty("payee_name") String payeeName,
        @JsonProperty("category_id") String categoryId,
        @JsonProperty("memo") String memo
) {

    public static SubTransactionEdit from(SubTransaction existing) {
        return new SubTransactionEdit(existing.amount(), existing.payeeId(), null, existing.categoryId(), existing.memo());
    }
}
