package com.chainscope.cache;

import com.chainscope.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CacheStoreTest {

    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    }

    @Test
    @DisplayName("get right after put returns the value")
    void putThenGet() {
        CacheStore store = store(true, 10, Duration.ofMinutes(1));

        store.put(CacheKind.ADDRESSES, "0xabc", "info");

        Optional<String> value = store.get(CacheKind.ADDRESSES, "0xabc");
        assertThat(value).contains("info");
        assertThat(store.stats().count(CacheKind.ADDRESSES)).isEqualTo(1);
    }

    @Test
    @DisplayName("entry expires after ttl and the read evicts it")
    void expiresLazily() {
        CacheStore store = store(true, 10, Duration.ofSeconds(1));
        store.put(CacheKind.BLOCKS, 42L, "block");

        clock.advance(Duration.ofSeconds(1));
        assertThat(store.<String>get(CacheKind.BLOCKS, 42L)).contains("block");

        clock.advance(Duration.ofMillis(100));
        assertThat(store.stats().count(CacheKind.BLOCKS)).isEqualTo(1);
        assertThat(store.<String>get(CacheKind.BLOCKS, 42L)).isEmpty();
        assertThat(store.stats().count(CacheKind.BLOCKS)).isZero();
    }

    @Test
    @DisplayName("disabled store never returns anything")
    void disabledIsNoOp() {
        CacheStore store = store(false, 10, Duration.ofMinutes(1));

        store.put(CacheKind.TRANSACTIONS, "0x1", "tx");

        assertThat(store.<String>get(CacheKind.TRANSACTIONS, "0x1")).isEmpty();
        assertThat(store.stats().total()).isZero();
    }

    @Test
    @DisplayName("inserting capacity + 1 keys evicts the least recently used one")
    void evictsLeastRecentlyUsed() {
        CacheStore store = store(true, 3, Duration.ofMinutes(1));
        store.put(CacheKind.TOKENS, "a", 1);
        store.put(CacheKind.TOKENS, "b", 2);
        store.put(CacheKind.TOKENS, "c", 3);

        // touch "a" so "b" becomes the eldest
        assertThat(store.<Integer>get(CacheKind.TOKENS, "a")).contains(1);
        store.put(CacheKind.TOKENS, "d", 4);

        assertThat(store.<Integer>get(CacheKind.TOKENS, "b")).isEmpty();
        assertThat(store.<Integer>get(CacheKind.TOKENS, "a")).contains(1);
        assertThat(store.<Integer>get(CacheKind.TOKENS, "c")).contains(3);
        assertThat(store.<Integer>get(CacheKind.TOKENS, "d")).contains(4);
        assertThat(store.stats().count(CacheKind.TOKENS)).isEqualTo(3);
    }

    @Test
    @DisplayName("kinds are bounded and expire independently")
    void kindsAreIndependent() {
        Map<CacheKind, Duration> ttls = ttls(Duration.ofHours(1));
        ttls.put(CacheKind.TOKEN_BALANCES, Duration.ofSeconds(5));
        CacheStore store = new CacheStore(true, 10, ttls, clock);
        store.put(CacheKind.TOKEN_BALANCES, "0xabc", List.of("usdc"));
        store.put(CacheKind.CONTRACTS, "0xabc", "contract");

        clock.advance(Duration.ofSeconds(6));

        assertThat(store.<List<String>>get(CacheKind.TOKEN_BALANCES, "0xabc")).isEmpty();
        assertThat(store.<String>get(CacheKind.CONTRACTS, "0xabc")).contains("contract");
    }

    @Test
    @DisplayName("re-store replaces the entry and restarts its ttl")
    void reStoreReplaces() {
        CacheStore store = store(true, 10, Duration.ofSeconds(10));
        store.put(CacheKind.ENS_NAMES, "0xabc", Optional.empty());
        clock.advance(Duration.ofSeconds(8));
        store.put(CacheKind.ENS_NAMES, "0xabc", Optional.of("vitalik.eth"));
        clock.advance(Duration.ofSeconds(8));

        Optional<Optional<String>> cached = store.get(CacheKind.ENS_NAMES, "0xabc");
        assertThat(cached).contains(Optional.of("vitalik.eth"));
    }

    @Test
    @DisplayName("clearAll empties every kind and stats report totals")
    void clearAllAndStats() {
        CacheStore store = store(true, 10, Duration.ofMinutes(1));
        store.put(CacheKind.BLOCKS, 1L, "b1");
        store.put(CacheKind.BLOCKS, 2L, "b2");
        store.put(CacheKind.ADDRESSES, "0xabc", "info");

        CacheStats stats = store.stats();
        assertThat(stats.count(CacheKind.BLOCKS)).isEqualTo(2);
        assertThat(stats.total()).isEqualTo(3);

        store.clearAll();

        assertThat(store.stats().total()).isZero();
        assertThat(store.<String>get(CacheKind.ADDRESSES, "0xabc")).isEmpty();
    }

    @Test
    @DisplayName("every kind needs a ttl")
    void missingTtlRejected() {
        Map<CacheKind, Duration> ttls = ttls(Duration.ofMinutes(1));
        ttls.remove(CacheKind.ENS_NAMES);

        assertThatThrownBy(() -> new CacheStore(true, 10, ttls, clock))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("ENS_NAMES");
    }

    private CacheStore store(boolean enabled, int capacity, Duration ttl) {
        return new CacheStore(enabled, capacity, ttls(ttl), clock);
    }

    private static Map<CacheKind, Duration> ttls(Duration ttl) {
        Map<CacheKind, Duration> ttls = new EnumMap<>(CacheKind.class);
        for (CacheKind kind : CacheKind.values()) {
            ttls.put(kind, ttl);
        }
        return ttls;
    }
}
