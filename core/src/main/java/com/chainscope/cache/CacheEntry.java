package com.chainscope.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * Stored value with the time it was written and its time-to-live. Replaced wholesale on re-store.
 */
public record CacheEntry<T>(T value, Instant storedAt, Duration ttl) {

    /** Expired strictly after storedAt + ttl. */
    public boolean isExpired(Instant now) {
        return now.isAfter(storedAt.plus(ttl));
    }
}
