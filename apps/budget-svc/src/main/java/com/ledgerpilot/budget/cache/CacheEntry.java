package com.ledgerpilot.budget.cache;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cached snapshot of one collection for one budget. {@code syncToken} is always the token returned
 * by the fetch that produced {@code items}.
 */
public record CacheEntry<T>(Map<String, T> items, long syncToken, Instant lastFetched) {

    public CacheEntry {
        items = Collections.unmodifiableMap(new LinkedHashMap<>(items));
    }

    public List<T> values() {
        return List.copyOf(items.values());
    }
}
