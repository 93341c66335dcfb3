package com.ledgerpilot.budget.controller;

import com.ledgerpilot.budget.cache.AccountCacheStore;
import com.ledgerpilot.budget.cache.CategoryCacheStore;
import com.ledgerpilot.budget.cache.PayeeCacheStore;
import com.ledgerpilot.budget.cache.SettingsCacheStore;
import com.ledgerpilot.budget.model.Account;
import com.ledgerpilot.budget.model.BudgetSettings;
import com.ledgerpilot.budget.model.Category;
import com.ledgerpilot.budget.model.CategoryEdit;
import com.ledgerpilot.budget.model.CategoryGroup;
import com.ledgerpilot.budget.model.NewAccount;
import com.ledgerpilot.budget.model.Payee;
import com.ledgerpilot.budget.model.PayeeEdit;
import com.ledgerpilot.budget.service.ReferenceDataService;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Cached reference data. Every read goes through the delta caches, so repeated calls only transfer
 * what changed remotely. Writes are refused in read-only mode and drop the affected cache.
 */
@RestController
@RequestMapping("/budgets/{budgetId}")
public class ReferenceDataController {

    private final AccountCacheStore accountCacheStore;
    private final PayeeCacheStore payeeCacheStore;
    private final CategoryCacheStore categoryCacheStore;
    private final SettingsCacheStore settingsCacheStore;
    private final ReferenceDataService referenceDataService;
    private final ReadOnlyGuard readOnlyGuard;

    public ReferenceDataController(
            AccountCacheStore accountCacheStore,
            PayeeCacheStore payeeCacheStore,
            CategoryCacheStore categoryCacheStore,
            SettingsCacheStore settingsCacheStore,
            ReferenceDataService referenceDataService,
            ReadOnlyGuard readOnlyGuard
    ) {
        this.accountCacheStore = accountCacheStore;
        this.payeeCacheStore = payeeCacheStore;
        this.categoryCacheStore = categoryCacheStore;
        this.settingsCacheStore = settingsCacheStore;
        this.referenceDataService = referenceDataService;
        this.readOnlyGuard = readOnlyGuard;
    }

    @GetMapping("/accounts")
    public ResponseEntity<List<Account>> accounts(
            @PathVariable("budgetId") String budgetId,
            @RequestParam(value = "includeClosed", required = false, defaultValue = "true") boolean includeClosed
    ) {
        List<Account> accounts = accountCacheStore.get(budgetId);
        if (!includeClosed) {
            accounts = accounts.stream().filter(account -> !account.closed()).toList();
        }
        return ResponseEntity.ok(accounts);
    }

    @GetMapping("/payees")
    public ResponseEntity<List<Payee>> payees(@PathVariable("budgetId") String budgetId) {
        return ResponseEntity.ok(payeeCacheStore.get(budgetId));
    }

    @GetMapping("/categories")
    public ResponseEntity<List<CategoryGroup>> categories(
            @PathVariable("budgetId") String budgetId,
            @RequestParam(value = "includeHidden", required = false, defaultValue = "true") boolean includeHidden
    ) {
        List<CategoryGroup> groups = categoryCacheStore.get(budgetId);
        if (!includeHidden) {
            groups = groups.stream()
                    .filter(group -> !group.hidden())
                    .map(group -> group.withCategories(group.categories().stream()
                            .filter(category -> !category.hidden())
                            .toList()))
                    .toList();
        }
        return ResponseEntity.ok(groups);
    }

    @GetMapping("/settings")
    public ResponseEntity<BudgetSettings> settings(@PathVariable("budgetId") String budgetId) {
        return ResponseEntity.ok(settingsCacheStore.getSettings(budgetId));
    }

    @PostMapping("/accounts")
    public ResponseEntity<Account> createAccount(
            @PathVariable("budgetId") String budgetId,
            @RequestBody NewAccount account
    ) {
        readOnlyGuard.requireWritable("createAccount");
        return ResponseEntity.status(HttpStatus.CREATED).body(referenceDataService.createAccount(budgetId, account));
    }

    @PatchMapping("/payees/{payeeId}")
    public ResponseEntity<Payee> updatePayee(
            @PathVariable("budgetId") String budgetId,
            @PathVariable("payeeId") String payeeId,
            @RequestBody PayeeEdit edit
    ) {
        readOnlyGuard.requireWritable("updatePayee");
        return ResponseEntity.ok(referenceDataService.updatePayee(budgetId, payeeId, edit));
    }

    @PatchMapping("/categories/{categoryId}")
    public ResponseEntity<Category> updateCategory(
            @PathVariable("budgetId") String budgetId,
            @PathVariable("categoryId") String categoryId,
            @RequestBody CategoryEdit edit
    ) {
        readOnlyGuard.requireWritable("updateCategory");
        return ResponseEntity.ok(referenceDataService.updateCategory(budgetId, categoryId, edit));
    }
}
