package com.chainscope.config;

import com.chainscope.cache.CacheKind;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Cache toggle, capacity and per-kind time-to-live.
 */
@ConfigurationProperties(prefix = "chainscope.cache")
@NoArgsConstructor
@Getter
@Setter
public class CacheProperties {

    private boolean enabled = true;

    private int maxEntriesPerKind = 1_000;

    private Duration blockTtl = Duration.ofHours(1);
    private Duration transactionTtl = Duration.ofHours(2);
    private Duration addressTtl = Duration.ofMinutes(30);
    private Duration contractTtl = Duration.ofHours(24);
    private Duration tokenTtl = Duration.ofHours(24);
    private Duration addressTransactionsTtl = Duration.ofMinutes(5);
    private Duration tokenTransfersTtl = Duration.ofMinutes(5);
    private Duration internalTransactionsTtl = Duration.ofMinutes(5);
    private Duration tokenBalancesTtl = Duration.ofMinutes(1);
    private Duration ensNamesTtl = Duration.ofHours(6);

    public Map<CacheKind, Duration> ttls() {
        Map<CacheKind, Duration> ttls = new EnumMap<>(CacheKind.class);
        ttls.put(CacheKind.BLOCKS, blockTtl);
        ttls.put(CacheKind.TRANSACTIONS, transactionTtl);
        ttls.put(CacheKind.ADDRESSES, addressTtl);
        ttls.put(CacheKind.CONTRACTS, contractTtl);
        ttls.put(CacheKind.TOKENS, tokenTtl);
        ttls.put(CacheKind.ADDRESS_TRANSACTIONS, addressTransactionsTtl);
        ttls.put(CacheKind.TOKEN_TRANSFERS, tokenTransfersTtl);
        ttls.put(CacheKind.INTERNAL_TRANSACTIONS, internalTransactionsTtl);
        ttls.put(CacheKind.TOKEN_BALANCES, tokenBalancesTtl);
        ttls.put(CacheKind.ENS_NAMES, ensNamesTtl);
        return ttls;
    }
}
