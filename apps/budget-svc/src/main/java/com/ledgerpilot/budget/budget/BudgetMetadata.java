package com.ledgerpilot.budget.budget;

import com.ledgerpilot.budget.model.BudgetSummary;
import com.ledgerpilot.budget.model.CurrencyFormat;
import com.ledgerpilot.budget.model.DateFormat;

public record BudgetMetadata(String name, CurrencyFormat currencyFormat, DateFormat dateFormat, String lastModifiedOn) {

    static BudgetMetadata of(BudgetSummary budget) {
        return new BudgetMetadata(budget.name(), budget.currencyFormat(), budget.dateFormat(), budget.lastModifiedOn());
    }
}
