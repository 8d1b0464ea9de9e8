package com.chainscope.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Chains the indexed API knows by name. Any other chain id is passed through numerically.
 */
public enum KnownChain {
    ETHEREUM(1L, "Ethereum"),
    GOERLI(5L, "Goerli"),
    SEPOLIA(11_155_111L, "Sepolia"),
    POLYGON(137L, "Polygon"),
    ARBITRUM(42_161L, "Arbitrum"),
    OPTIMISM(10L, "Optimism"),
    BASE(8_453L, "Base");

    private final long chainId;
    private final String displayName;

    KnownChain(long chainId, String displayName) {
        this.chainId = chainId;
        this.displayName = displayName;
    }

    public long getChainId() {
        return chainId;
    }

    public String getDisplayName() {
        return displayName;
    }

    public static Optional<KnownChain> fromChainId(long chainId) {
        return Arrays.stream(values()).filter(c -> c.chainId == chainId).findFirst();
    }

    /** Human-readable name, "Custom(id)" for unknown chains. */
    public static String displayNameOf(long chainId) {
        return fromChainId(chainId).map(KnownChain::getDisplayName).orElse("Custom(" + chainId + ")");
    }
}
