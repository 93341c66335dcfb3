package com.ledgerpilot.budget.staging;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChangeOutcome(String changeId, String transactionId, String budgetId, Status status, String error) {

    public enum Status {
        SUCCESS,
        FAILED
    }

    static ChangeOutcome applied(StagedChange change) {
        return new ChangeOutcome(change.id(), change.transactionId(), change.budgetId(), Status.SUCCESS, null);
    }

    static ChangeOutcome failed(StagedChange change, String error) {
        return new ChangeOutcome(change.id(), change.transactionId(), change.budgetId(), Status.FAILED, error);
    }
}
