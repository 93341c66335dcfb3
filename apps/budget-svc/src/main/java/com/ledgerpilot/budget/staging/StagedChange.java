package com.ledgerpilot.budget.staging;

import com.ledgerpilot.budget.model.TransactionFields;
import java.time.Instant;

/**
 * A proposed transaction edit waiting for an explicit apply. {@code originalTransaction} holds the
 * values of the touched fields at staging time so a reviewer can compare.
 */
public record StagedChange(
        String id,
        ChangeType type,
        String budgetId,
        String transactionId,
        String description,
        Instant timestamp,
        TransactionFields originalTransaction,
        TransactionFields proposedChanges
) {
}
