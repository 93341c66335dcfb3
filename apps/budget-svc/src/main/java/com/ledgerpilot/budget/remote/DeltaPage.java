package com.ledgerpilot.budget.remote;

import java.util.List;

/**
 * One page of a full or delta fetch: the items plus the sync token to echo back next time.
 */
public record DeltaPage<T>(List<T> items, long syncToken) {

    public DeltaPage {
        items = items == null ? List.of() : List.copyOf(items);
    }
}
