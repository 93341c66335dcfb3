package com.ledgerpilot.budget.cache;

import java.time.Instant;

public record TtlCacheEntry<T>(T value, Instant expiresAt) {

    public boolean isFresh(Instant now) {
        return now.isBefore(expiresAt);
    }
}
