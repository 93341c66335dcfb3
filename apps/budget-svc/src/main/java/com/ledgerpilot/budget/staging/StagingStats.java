package com.ledgerpilot.budget.staging;

public record StagingStats(String sessionId, int stagedCount) {
}
