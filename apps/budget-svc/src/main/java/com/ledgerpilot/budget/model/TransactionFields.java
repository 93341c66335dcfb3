package com.ledgerpilot.budget.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Partial set of transaction fields. A null component means "not touched" and is left out of the
 * request body, so merging these fields never clears a value by accident.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record TransactionFields(
        @JsonProperty("category_id") String categoryId,
        @JsonProperty("payee_id") String payeeId,
        @JsonProperty("memo") String memo,
        @JsonProperty("cleared") String cleared,
        @JsonProperty("approved") Boolean approved,
        @JsonProperty("flag_color") String flagColor,
        @JsonProperty("flag_name") String flagName,
        @JsonProperty("subtransactions") List<SubTransactionEdit> subtransactions
) {

    public TransactionFields {
        subtransactions = subtransactions == null ? null : List.copyOf(subtransactions);
    }

    public static TransactionFields categorization(String categoryId, String memo) {
        return new TransactionFields(categoryId, null, memo, null, null, null, null, null);
    }

    public static TransactionFields split(List<SubTransactionEdit> parts) {
        return new TransactionFields(null, null, null, null, null, null, null, parts);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return categoryId == null && payeeId == null && memo == null && cleared == null && approved == null
                && flagColor == null && flagName == null && subtransactions == null;
    }

    /**
     * Captures the current values of exactly the fields this instance touches.
     */
    public TransactionFields snapshotOf(TransactionDetail current) {
        return new TransactionFields(
                categoryId != null ? current.categoryId() : null,
                payeeId != null ? current.payeeId() : null,
                memo != null ? current.memo() : null,
                cleared != null ? current.cleared() : null,
                approved != null ? current.approved() : null,
                flagColor != null ? current.flagColor() : null,
                flagName != null ? current.flagName() : null,
                subtransactions != null
                        ? current.subtransactions().stream().map(SubTransactionEdit::from).toList()
                        : null
        );
    }
}
