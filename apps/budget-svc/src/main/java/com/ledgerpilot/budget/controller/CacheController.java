package com.ledgerpilot.budget.controller;

import com.ledgerpilot.budget.budget.BudgetContext;
import com.ledgerpilot.budget.cache.AccountCacheStore;
import com.ledgerpilot.budget.cache.CategoryCacheStore;
import com.ledgerpilot.budget.cache.PayeeCacheStore;
import com.ledgerpilot.budget.cache.SettingsCacheStore;
import com.ledgerpilot.budget.controller.dto.CollectionRefreshResponseDto;
import com.ledgerpilot.budget.security.RequestContextHolder;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/caches")
public class CacheController {

    private static final Logger log = LoggerFactory.getLogger(CacheController.class);

    private final BudgetContext budgetContext;
    private final AccountCacheStore accountCacheStore;
    private final PayeeCacheStore payeeCacheStore;
    private final CategoryCacheStore categoryCacheStore;
    private final SettingsCacheStore settingsCacheStore;

    public CacheController(
            BudgetContext budgetContext,
            AccountCacheStore accountCacheStore,
            PayeeCacheStore payeeCacheStore,
            CategoryCacheStore categoryCacheStore,
            SettingsCacheStore settingsCacheStore
    ) {
        this.budgetContext = budgetContext;
        this.accountCacheStore = accountCacheStore;
        this.payeeCacheStore = payeeCacheStore;
        this.categoryCacheStore = categoryCacheStore;
        this.settingsCacheStore = settingsCacheStore;
    }

    /**
     * Forces a full fetch of one collection for the given budget, or the active one.
     */
    @PostMapping("/{collection}/refresh")
    public ResponseEntity<CollectionRefreshResponseDto> refresh(
            @PathVariable("collection") String collection,
            @RequestParam(value = "budgetId", required = false) String budgetId
    ) {
        String targetBudget = budgetContext.resolveBudgetId(budgetId);
        int count = switch (collection) {
            case "accounts" -> accountCacheStore.refreshCache(targetBudget).size();
            case "payees" -> payeeCacheStore.refreshCache(targetBudget).size();
            case "categories" -> categoryCacheStore.refreshCache(targetBudget).size();
            case "settings" -> {
                settingsCacheStore.refreshCache(targetBudget);
                yield 1;
            }
            default -> throw new IllegalArgumentException(
                    "Unknown cache collection '" + collection + "'; expected accounts, payees, categories or settings");
        };
        log.info("Refreshed {} cache for budget {}", collection, targetBudget);
        String traceId = RequestContextHolder.traceId().orElse(null);
        return ResponseEntity.ok(new CollectionRefreshResponseDto(collection, targetBudget, count, traceId));
    }

    @DeleteMapping
    public ResponseEntity<Map<String, String>> clearAll() {
        accountCacheStore.reset();
        payeeCacheStore.reset();
        categoryCacheStore.reset();
        settingsCacheStore.reset();
        log.info("Cleared all reference data caches");
        return ResponseEntity.ok(Map.of("status", "CLEARED"));
    }
}
