package com.ledgerpilot.budget.budget;

import com.ledgerpilot.budget.error.NoActiveBudgetException;
import com.ledgerpilot.budget.error.NotFoundException;
import com.ledgerpilot.budget.model.BudgetSummary;
import com.ledgerpilot.budget.remote.BudgetApi;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Known budgets and the one implicitly addressed when a caller passes no budget id.
 *
 * <p>The budget list is fetched once ({@link #initialize()}) and re-fetched only on
 * {@link #refreshCache()}; every other operation is local. This class is the only writer of the
 * active budget id, which is always either null or one of the known budget ids.
 */
@Component
public class BudgetContext {

    private static final Logger log = LoggerFactory.getLogger(BudgetContext.class);

    private final BudgetApi budgetApi;
    private final Clock clock;

    private List<BudgetSummary> budgets = List.of();
    private Map<String, BudgetMetadata> metadata = new LinkedHashMap<>();
    private String activeBudgetId;
    private Instant lastFetched;
    private String sessionId = UUID.randomUUID().toString();

    @Autowired
    public BudgetContext(BudgetApi budgetApi) {
        this(budgetApi, Clock.systemUTC());
    }

    BudgetContext(BudgetApi budgetApi, Clock clock) {
        this.budgetApi = budgetApi;
        this.clock = clock;
    }

    /**
     * Fetches the budget list and rebuilds the metadata index. A failure is logged and leaves the
     * context as it was, so callers can still pass budget ids explicitly.
     */
    public void initialize() {
        List<BudgetSummary> fetched;
        try {
            fetched = budgetApi.listBudgets();
        } catch (RuntimeException ex) {
            log.error("Budget context initialization failed; keeping {} cached budget(s): {}", knownBudgetCount(), ex.getMessage(), ex);
            return;
        }
        replaceBudgets(fetched);
    }

    public void refreshCache() {
        initialize();
    }

    private synchronized void replaceBudgets(List<BudgetSummary> fetched) {
        Map<String, BudgetMetadata> index = new LinkedHashMap<>();
        for (BudgetSummary budget : fetched) {
            index.put(budget.id(), BudgetMetadata.of(budget));
        }
        String previous = activeBudgetId;
        String next;
        if (previous != null && index.containsKey(previous)) {
            next = previous;
        } else {
            next = index.size() == 1 ? index.keySet().iterator().next() : null;
            if (previous != null) {
                log.warn("Active budget {} is no longer available; active budget is now {}", previous, next == null ? "unset" : next);
            }
        }
        this.budgets = List.copyOf(fetched);
        this.metadata = index;
        this.activeBudgetId = next;
        this.lastFetched = clock.instant();
        log.info("Budget context loaded: {} budget(s), active={}", budgets.size(), next);
    }

    public synchronized void setActiveBudget(String budgetId) {
        if (budgetId == null || !metadata.containsKey(budgetId)) {
            throw new NotFoundException("budget", budgetId, List.copyOf(metadata.keySet()));
        }
        this.activeBudgetId = budgetId;
    }

    public synchronized Optional<String> getActiveBudgetId() {
        return Optional.ofNullable(activeBudgetId);
    }

    /**
     * @throws NoActiveBudgetException listing the known budgets when none is active
     */
    public synchronized String getActiveBudgetIdOrError() {
        if (activeBudgetId != null) {
            return activeBudgetId;
        }
        List<String> known = new ArrayList<>();
        metadata.forEach((id, meta) -> known.add(meta.name() + " (" + id + ")"));
        throw new NoActiveBudgetException(known);
    }

    /**
     * Returns {@code explicitBudgetId} when given, otherwise the active budget.
     */
    public String resolveBudgetId(String explicitBudgetId) {
        if (explicitBudgetId != null && !explicitBudgetId.isBlank()) {
            return explicitBudgetId;
        }
        return getActiveBudgetIdOrError();
    }

    public synchronized List<BudgetSummary> getAllBudgets() {
        return budgets;
    }

    public synchronized Optional<BudgetMetadata> getBudgetMetadata(String budgetId) {
        return Optional.ofNullable(metadata.get(budgetId));
    }

    public synchronized BudgetContextView getBudgetContext() {
        String activeName = activeBudgetId == null ? null
                : Optional.ofNullable(metadata.get(activeBudgetId)).map(BudgetMetadata::name).orElse(null);
        return new BudgetContextView(
                budgets,
                activeBudgetId,
                activeName,
                lastFetched == null ? null : lastFetched.toString(),
                sessionId
        );
    }

    public synchronized boolean isLoaded() {
        return lastFetched != null;
    }

    public synchronized void clearActiveBudget() {
        this.activeBudgetId = null;
    }

    public synchronized void reset() {
        this.budgets = List.of();
        this.metadata = new LinkedHashMap<>();
        this.activeBudgetId = null;
        this.lastFetched = null;
        this.sessionId = UUID.randomUUID().toString();
    }

    private synchronized int knownBudgetCount() {
        return budgets.size();
    }
}
