package com.ledgerpilot.budget.cache;

import com.ledgerpilot.budget.budget.BudgetContext;
import com.ledgerpilot.budget.model.Payee;
import com.ledgerpilot.budget.remote.BudgetApi;
import com.ledgerpilot.budget.remote.DeltaPage;
import java.time.Clock;
import java.util.OptionalLong;
import org.springframework.stereotype.Component;

@Component
public class PayeeCacheStore extends DeltaCacheStore<Payee> {

    private final BudgetApi budgetApi;

    public PayeeCacheStore(BudgetApi budgetApi, BudgetContext budgetContext) {
        super("payees", budgetContext, Clock.systemUTC());
        this.budgetApi = budgetApi;
    }

    @Override
    protected DeltaPage<Payee> fetch(String budgetId, OptionalLong sinceToken) {
        return budgetApi.getPayees(budgetId, sinceToken);
    }
}
