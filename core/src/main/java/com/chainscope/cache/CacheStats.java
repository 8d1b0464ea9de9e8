package com.chainscope.cache;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Entry counts per kind at the time of the snapshot. Expired entries that have not been read yet
 * are still counted.
 */
public record CacheStats(Map<CacheKind, Integer> counts) {

    public CacheStats {
        counts = Collections.unmodifiableMap(new EnumMap<>(counts));
    }

    public int count(CacheKind kind) {
        return counts.getOrDefault(kind, 0);
    }

    public int total() {
        return counts.values().stream().mapToInt(Integer::intValue).sum();
    }
}
