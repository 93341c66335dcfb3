package com.ledgerpilot.budget.staging;

/**
 * One requested part of a split. {@code category} may be null for an uncategorized part.
 */
public record SplitPart(long amount, String payeeId, String payeeName, CategoryReference category, String memo) {
}
