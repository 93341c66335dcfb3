package com.ledgerpilot.budget.staging;

/**
 * A freshly staged change with a one-line human summary of what it will do.
 */
public record StagingReceipt(StagedChange change, String summary) {
}
