package com.ledgerpilot.budget.staging;

import java.util.List;

/**
 * Summary of one apply run. {@code batchCount} is the number of per-budget batch requests issued.
 */
public record ApplyResult(int appliedCount, int failedCount, int batchCount, List<ChangeOutcome> results) {

    public ApplyResult {
        results = List.copyOf(results);
    }

    static ApplyResult of(int batchCount, List<ChangeOutcome> results) {
        int applied = (int) results.stream().filter(r -> r.status() == ChangeOutcome.Status.SUCCESS).count();
        return new ApplyResult(applied, results.size() - applied, batchCount, results);
    }
}
