package com.ledgerpilot.budget.cache;

import com.ledgerpilot.budget.budget.BudgetContext;
import com.ledgerpilot.budget.model.Account;
import com.ledgerpilot.budget.remote.BudgetApi;
import com.ledgerpilot.budget.remote.DeltaPage;
import java.time.Clock;
import java.util.OptionalLong;
import org.springframework.stereotype.Component;

/**
 * Accounts per budget. Balances travel with the account records, so deltas also refresh them.
 */
@Component
public class AccountCacheStore extends DeltaCacheStore<Account> {

    private final BudgetApi budgetApi;

    public AccountCacheStore(BudgetApi budgetApi, BudgetContext budgetContext) {
        super("accounts", budgetContext, Clock.systemUTC());
        this.budgetApi = budgetApi;
    }

    @Override
    protected DeltaPage<Account> fetch(String budgetId, OptionalLong sinceToken) {
        return budgetApi.getAccounts(budgetId, sinceToken);
    }
}
