package com.ledgerpilot.budget.service;

import com.ledgerpilot.budget.cache.AccountCacheStore;
import com.ledgerpilot.budget.cache.CategoryCacheStore;
import com.ledgerpilot.budget.cache.PayeeCacheStore;
import com.ledgerpilot.budget.model.Account;
import com.ledgerpilot.budget.model.Category;
import com.ledgerpilot.budget.model.CategoryEdit;
import com.ledgerpilot.budget.model.NewAccount;
import com.ledgerpilot.budget.model.Payee;
import com.ledgerpilot.budget.model.PayeeEdit;
import com.ledgerpilot.budget.remote.BudgetApi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Writes to reference data. A successful write drops the budget's cached collection so the next
 * read performs a full fetch; a failed write leaves the cache as it was.
 */
@Service
public class ReferenceDataService {

    private static final Logger log = LoggerFactory.getLogger(ReferenceDataService.class);

    private final BudgetApi budgetApi;
    private final AccountCacheStore accountCacheStore;
    private final PayeeCacheStore payeeCacheStore;
    private final CategoryCacheStore categoryCacheStore;

    public ReferenceDataService(
            BudgetApi budgetApi,
            AccountCacheStore accountCacheStore,
            PayeeCacheStore payeeCacheStore,
            CategoryCacheStore categoryCacheStore
    ) {
        this.budgetApi = budgetApi;
        this.accountCacheStore = accountCacheStore;
        this.payeeCacheStore = payeeCacheStore;
        this.categoryCacheStore = categoryCacheStore;
    }

    public Category updateCategory(String budgetId, String categoryId, CategoryEdit edit) {
        if (edit == null || edit.isEmpty()) {
            throw new IllegalArgumentException("At least one category field to update must be provided");
        }
        Category updated = budgetApi.updateCategory(budgetId, categoryId, edit);
        categoryCacheStore.invalidate(budgetId);
        log.info("Updated category {} in budget {}", categoryId, budgetId);
        return updated;
    }

    public Payee updatePayee(String budgetId, String payeeId, PayeeEdit edit) {
        Payee updated = budgetApi.updatePayee(budgetId, payeeId, edit);
        payeeCacheStore.invalidate(budgetId);
        log.info("Updated payee {} in budget {}", payeeId, budgetId);
        return updated;
    }

    public Account createAccount(String budgetId, NewAccount account) {
        Account created = budgetApi.createAccount(budgetId, account);
        accountCacheStore.invalidate(budgetId);
        log.info("Created {} account {} in budget {}", account.type(), created.id(), budgetId);
        return created;
    }
}
