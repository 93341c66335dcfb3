package com.ledgerpilot.budget.staging;

import java.util.List;

public record BulkStagingResult(
        String categoryId,
        String categoryName,
        List<StagedChange> staged,
        List<Failure> failures
) {

    public BulkStagingResult {
        staged = List.copyOf(staged);
        failures = List.copyOf(failures);
    }

    public record Failure(String transactionId, String error) {
    }
}
