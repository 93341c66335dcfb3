package com.ledgerpilot.budget.budget;

import com.ledgerpilot.budget.model.BudgetSummary;
import java.util.List;

/**
 * Read-only picture of the budget context for callers: known budgets, the active one, and when the
 * list was last fetched (ISO-8601, null before the first successful fetch).
 */
public record BudgetContextView(
        List<BudgetSummary> budgets,
        String activeBudgetId,
        String activeBudgetName,
        String lastFetched,
        String sessionId
) {
}
