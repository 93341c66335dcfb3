package com.ledgerpilot.budget.cache;

import com.ledgerpilot.budget.budget.BudgetContext;
import com.ledgerpilot.budget.config.LedgerpilotProperties;
import com.ledgerpilot.budget.model.BudgetSettings;
import com.ledgerpilot.budget.model.CurrencyFormat;
import com.ledgerpilot.budget.remote.BudgetApi;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Budget settings with absolute expiry. Settings have no delta protocol, so an expired entry is
 * simply fetched again; once primed, a failed fetch serves the expired value instead of failing.
 */
@Component
public class SettingsCacheStore {

    private static final Logger log = LoggerFactory.getLogger(SettingsCacheStore.class);

    private final BudgetApi budgetApi;
    private final BudgetContext budgetContext;
    private final Duration ttl;
    private final Clock clock;
    private final ConcurrentMap<String, TtlCacheEntry<BudgetSettings>> cache = new ConcurrentHashMap<>();

    @Autowired
    public SettingsCacheStore(BudgetApi budgetApi, BudgetContext budgetContext, LedgerpilotProperties properties) {
        this(budgetApi, budgetContext, properties.cache().settingsTtl(), Clock.systemUTC());
    }

    SettingsCacheStore(BudgetApi budgetApi, BudgetContext budgetContext, Duration ttl, Clock clock) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        this.budgetApi = budgetApi;
        this.budgetContext = budgetContext;
        this.ttl = ttl;
        this.clock = clock;
    }

    public BudgetSettings getSettings(String budgetId) {
        TtlCacheEntry<BudgetSettings> cached = cache.get(budgetId);
        Instant now = clock.instant();
        if (cached != null && cached.isFresh(now)) {
            return cached.value();
        }
        try {
            BudgetSettings settings = budgetApi.getBudgetSettings(budgetId);
            cache.put(budgetId, new TtlCacheEntry<>(settings, now.plus(ttl)));
            return settings;
        } catch (RuntimeException ex) {
            if (cached != null) {
                log.warn("Fetching settings for budget {} failed; using stale value that expired at {}: {}",
                        budgetId, cached.expiresAt(), ex.getMessage());
                return cached.value();
            }
            log.error("Fetching settings for budget {} failed with nothing cached: {}", budgetId, ex.getMessage());
            throw ex;
        }
    }

    public Optional<CurrencyFormat> getCurrencyFormat(String budgetId) {
        return Optional.ofNullable(getSettings(budgetId).currencyFormat());
    }

    public Optional<Instant> expiresAt(String budgetId) {
        return Optional.ofNullable(cache.get(budgetId)).map(TtlCacheEntry::expiresAt);
    }

    public Duration ttl() {
        return ttl;
    }

    public void invalidate(String budgetId) {
        cache.remove(budgetId);
    }

    public BudgetSettings refreshCache(String budgetId) {
        invalidate(budgetId);
        return getSettings(budgetId);
    }

    public void initialize() {
        Optional<String> active = budgetContext.getActiveBudgetId();
        if (active.isEmpty()) {
            log.info("No active budget; skipping settings cache warm-up");
            return;
        }
        try {
            getSettings(active.get());
            log.info("Settings cache initialized for budget {}", active.get());
        } catch (RuntimeException ex) {
            log.warn("Failed to initialize settings cache for budget {}: {}", active.get(), ex.getMessage());
        }
    }

    public void reset() {
        cache.clear();
    }
}
