package com.chainscope.cache;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Per-kind bounded LRU store with lazy expiry. Reading an expired entry evicts it and reports
 * absence. When disabled every get misses and every put is dropped.
 * <p>
 * Each kind is guarded by its own lock, so reads and writes are linearizable per key.
 */
@Slf4j
public class CacheStore {

    private final boolean enabled;
    private final Map<CacheKind, Duration> ttls;
    private final Map<CacheKind, KindStore> stores = new EnumMap<>(CacheKind.class);
    private final Clock clock;

    public CacheStore(boolean enabled, int maxEntriesPerKind, Map<CacheKind, Duration> ttls, Clock clock) {
        if (maxEntriesPerKind < 1) {
            throw new IllegalArgumentException("maxEntriesPerKind must be positive: " + maxEntriesPerKind);
        }
        this.enabled = enabled;
        this.ttls = new EnumMap<>(CacheKind.class);
        this.clock = clock;
        for (CacheKind kind : CacheKind.values()) {
            Duration ttl = ttls.get(kind);
            if (ttl == null || ttl.isNegative()) {
                throw new IllegalArgumentException("Missing or negative TTL for " + kind);
            }
            this.ttls.put(kind, ttl);
            stores.put(kind, new KindStore(maxEntriesPerKind));
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    public Duration ttl(CacheKind kind) {
        return ttls.get(kind);
    }

    /**
     * Returns the live value for the key. Values are stored untyped; the caller picks the type
     * that matches the kind (see {@link CacheKind}).
     */
    @SuppressWarnings("unchecked")
    public <T> Optional<T> get(CacheKind kind, Object key) {
        if (!enabled) {
            return Optional.empty();
        }
        KindStore store = stores.get(kind);
        synchronized (store) {
            CacheEntry<Object> entry = store.entries.get(key);
            if (entry == null) {
                return Optional.empty();
            }
            if (entry.isExpired(clock.instant())) {
                store.entries.remove(key);
                log.debug("Cache entry expired: {} {}", kind, key);
                return Optional.empty();
            }
            return Optional.of((T) entry.value());
        }
    }

    public void put(CacheKind kind, Object key, Object value) {
        if (!enabled || value == null) {
            return;
        }
        KindStore store = stores.get(kind);
        Instant now = clock.instant();
        synchronized (store) {
            store.entries.put(key, new CacheEntry<>(value, now, ttls.get(kind)));
        }
    }

    public void clearAll() {
        for (KindStore store : stores.values()) {
            synchronized (store) {
                store.entries.clear();
            }
        }
        log.info("Cache cleared");
    }

    public CacheStats stats() {
        Map<CacheKind, Integer> counts = new EnumMap<>(CacheKind.class);
        stores.forEach((kind, store) -> {
            synchronized (store) {
                counts.put(kind, store.entries.size());
            }
        });
        return new CacheStats(counts);
    }

    /** Access-ordered map that drops the least recently used entry above capacity. */
    private static final class KindStore {

        private final LinkedHashMap<Object, CacheEntry<Object>> entries;

        private KindStore(int capacity) {
            this.entries = new LinkedHashMap<>(16, 0.75f, true) {
                @Override
                protected boolean removeEldestEntry(Map.Entry<Object, CacheEntry<Object>> eldest) {
                    return size() > capacity;
                }
            };
        }
    }
}
