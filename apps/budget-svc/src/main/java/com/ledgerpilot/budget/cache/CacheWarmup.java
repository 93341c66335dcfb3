package com.ledgerpilot.budget.cache;

import com.ledgerpilot.budget.budget.BudgetContext;
import com.ledgerpilot.budget.config.LedgerpilotProperties;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Loads the budget list, then the reference caches for the active budget, once the application is
 * up. Failures are logged by each step and never stop startup.
 */
@Component
public class CacheWarmup {

    private static final Logger log = LoggerFactory.getLogger(CacheWarmup.class);

    private final LedgerpilotProperties properties;
    private final BudgetContext budgetContext;
    private final List<DeltaCacheStore<?>> deltaStores;
    private final SettingsCacheStore settingsCacheStore;

    public CacheWarmup(
            LedgerpilotProperties properties,
            BudgetContext budgetContext,
            AccountCacheStore accountCacheStore,
            PayeeCacheStore payeeCacheStore,
            CategoryCacheStore categoryCacheStore,
            SettingsCacheStore settingsCacheStore
    ) {
        this.properties = properties;
        this.budgetContext = budgetContext;
        this.deltaStores = List.of(accountCacheStore, payeeCacheStore, categoryCacheStore);
        this.settingsCacheStore = settingsCacheStore;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!properties.cache().warmOnStartupFlag()) {
            log.info("Cache warm-up disabled (ledgerpilot.cache.warm-on-startup=false)");
            return;
        }
        warm();
    }

    public void warm() {
        budgetContext.initialize();
        deltaStores.forEach(DeltaCacheStore::initialize);
        settingsCacheStore.initialize();
    }
}
