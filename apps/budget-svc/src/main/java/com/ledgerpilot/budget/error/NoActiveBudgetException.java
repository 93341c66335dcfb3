package com.ledgerpilot.budget.error;

import java.util.List;

public class NoActiveBudgetException extends NotFoundException {

    public NoActiveBudgetException(List<String> knownBudgets) {
        super("budget", null, knownBudgets, message(knownBudgets));
    }

    private static String message(List<String> knownBudgets) {
        if (knownBudgets == null || knownBudgets.isEmpty()) {
            return "No active budget and no budgets are known (none). Pass a budget id explicitly or refresh the budget context.";
        }
        return "No active budget set. Choose one with setActiveBudget. Available budgets: " + String.join(", ", knownBudgets);
    }
}
