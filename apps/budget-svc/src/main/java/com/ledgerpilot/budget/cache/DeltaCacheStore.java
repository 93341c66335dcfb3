package com.ledgerpilot.budget.cache;

import com.ledgerpilot.budget.budget.BudgetContext;
import com.ledgerpilot.budget.model.ReferenceEntity;
import com.ledgerpilot.budget.remote.DeltaPage;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-budget cache of one reference-data collection kept fresh with delta fetches.
 *
 * <p>The first {@link #get(String)} for a budget performs a full fetch. Later calls send the stored
 * sync token and merge the returned changes: tombstoned items are removed by id, everything else is
 * upserted, and items the delta does not mention are kept as they are. The stored token is always
 * the one returned by the most recent merged response.
 *
 * <p>When a fetch fails and a snapshot exists, the snapshot is returned unchanged. Without a
 * snapshot the failure propagates and nothing is stored.
 *
 * <p>Concurrent {@code get} calls for the same budget share a single in-flight fetch, so a cold
 * budget is fetched once and merges for a budget never interleave. Each budget carries a
 * generation that {@link #invalidate(String)} and {@link #reset()} advance; a fetch that started
 * under an older generation neither stores its result nor is joined by later callers.
 *
 * @param <T> entity type held by the collection
 */
public abstract class DeltaCacheStore<T extends ReferenceEntity> {

    private final Logger log = LoggerFactory.getLogger(getClass());

    private final String collectionName;
    private final BudgetContext budgetContext;
    private final Clock clock;
    private final ConcurrentMap<String, CacheEntry<T>> cache = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Flight<T>> inFlight = new ConcurrentHashMap<>();
    private final Object generationLock = new Object();
    private final Map<String, Long> generations = new HashMap<>();
    private long resetEpoch;

    protected DeltaCacheStore(String collectionName, BudgetContext budgetContext, Clock clock) {
        this.collectionName = collectionName;
        this.budgetContext = budgetContext;
        this.clock = clock;
    }

    /**
     * Full fetch when {@code sinceToken} is empty, delta fetch otherwise.
     */
    protected abstract DeltaPage<T> fetch(String budgetId, OptionalLong sinceToken);

    /**
     * Applies {@code delta} on top of {@code current} and returns the new map; {@code current} is
     * never modified.
     */
    protected Map<String, T> merge(Map<String, T> current, List<T> delta) {
        Map<String, T> merged = new LinkedHashMap<>(current);
        for (T item : delta) {
            if (item.deleted()) {
                merged.remove(item.id());
            } else {
                merged.put(item.id(), item);
            }
        }
        return merged;
    }

    public String collectionName() {
        return collectionName;
    }

    public List<T> get(String budgetId) {
        if (budgetId == null || budgetId.isBlank()) {
            throw new IllegalArgumentException("budgetId must be provided");
        }
        while (true) {
            long generation = currentGeneration(budgetId);
            Flight<T> mine = new Flight<>(generation, new CompletableFuture<>());
            Flight<T> running = inFlight.putIfAbsent(budgetId, mine);
            if (running == null) {
                // removed before completion: a finished flight is never joined
                try {
                    List<T> result = load(budgetId, generation);
                    inFlight.remove(budgetId, mine);
                    mine.future().complete(result);
                    return result;
                } catch (RuntimeException | Error ex) {
                    inFlight.remove(budgetId, mine);
                    mine.future().completeExceptionally(ex);
                    throw ex;
                }
            }
            if (running.generation() == generation) {
                return await(running.future());
            }
            // started before an invalidation; wait it out, then fetch again
            running.future().handle((items, ex) -> null).join();
        }
    }

    private List<T> load(String budgetId, long generation) {
        CacheEntry<T> cached = cache.get(budgetId);
        OptionalLong sinceToken = cached == null ? OptionalLong.empty() : OptionalLong.of(cached.syncToken());
        DeltaPage<T> page;
        try {
            page = fetch(budgetId, sinceToken);
        } catch (RuntimeException ex) {
            if (cached != null) {
                log.warn("Fetching {} for budget {} failed; serving cached snapshot from {}: {}",
                        collectionName, budgetId, cached.lastFetched(), ex.getMessage());
                return cached.values();
            }
            log.error("Fetching {} for budget {} failed with no cached snapshot: {}", collectionName, budgetId, ex.getMessage());
            throw ex;
        }
        Map<String, T> base = cached == null ? Map.of() : cached.items();
        CacheEntry<T> updated = new CacheEntry<>(merge(base, page.items()), page.syncToken(), clock.instant());
        synchronized (generationLock) {
            if (currentGeneration(budgetId) != generation) {
                log.debug("{} cache for budget {} was invalidated during the fetch; result not stored",
                        collectionName, budgetId);
                return updated.values();
            }
            cache.put(budgetId, updated);
        }
        log.debug("{} cache for budget {}: {} fetch, {} changed item(s), {} cached, token {} -> {}",
                collectionName, budgetId, cached == null ? "full" : "delta", page.items().size(),
                updated.items().size(), cached == null ? "none" : cached.syncToken(), page.syncToken());
        return updated.values();
    }

    private List<T> await(CompletableFuture<List<T>> running) {
        try {
            return running.join();
        } catch (CompletionException ex) {
            if (ex.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            if (ex.getCause() instanceof Error error) {
                throw error;
            }
            throw ex;
        }
    }

    /**
     * Drops the snapshot. A fetch already running for the budget can no longer store its result.
     */
    public void invalidate(String budgetId) {
        synchronized (generationLock) {
            generations.merge(budgetId, 1L, Long::sum);
            cache.remove(budgetId);
        }
    }

    /**
     * Drops the snapshot and performs a full fetch whose result reflects remote state no older than
     * this call.
     */
    public List<T> refreshCache(String budgetId) {
        invalidate(budgetId);
        return get(budgetId);
    }

    /**
     * Warms the cache for the active budget, if there is one. Never throws.
     */
    public void initialize() {
        Optional<String> active = budgetContext.getActiveBudgetId();
        if (active.isEmpty()) {
            log.info("No active budget; skipping {} cache warm-up", collectionName);
            return;
        }
        try {
            List<T> items = get(active.get());
            log.info("{} cache initialized for budget {} ({} item(s))", collectionName, active.get(), items.size());
        } catch (RuntimeException ex) {
            log.warn("Failed to initialize {} cache for budget {}: {}", collectionName, active.get(), ex.getMessage());
        }
    }

    public void reset() {
        synchronized (generationLock) {
            resetEpoch++;
            cache.clear();
        }
    }

    /**
     * Current snapshot without contacting the remote API.
     */
    public Optional<List<T>> peek(String budgetId) {
        return Optional.ofNullable(cache.get(budgetId)).map(CacheEntry::values);
    }

    public OptionalLong syncToken(String budgetId) {
        CacheEntry<T> entry = cache.get(budgetId);
        return entry == null ? OptionalLong.empty() : OptionalLong.of(entry.syncToken());
    }

    public Optional<Instant> lastFetched(String budgetId) {
        return Optional.ofNullable(cache.get(budgetId)).map(CacheEntry::lastFetched);
    }

    public Set<String> cachedBudgetIds() {
        return Set.copyOf(cache.keySet());
    }

    private long currentGeneration(String budgetId) {
        synchronized (generationLock) {
            return resetEpoch + generations.getOrDefault(budgetId, 0L);
        }
    }

    private record Flight<T>(long generation, CompletableFuture<List<T>> future) {
    }
}
