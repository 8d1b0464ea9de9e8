package com.chainscope.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Node connection settings.
 */
@ConfigurationProperties(prefix = "chainscope.network")
@NoArgsConstructor
@Getter
@Setter
public class NetworkProperties {

    /** Display name of the network. */
    private String name = "Ethereum Mainnet";

    /** JSON-RPC HTTP endpoint. */
    private String rpcUrl = "http://localhost:8545";

    /** Optional WebSocket endpoint; enables push subscriptions when set. */
    private String wsUrl;

    private long chainId = 1;

    /** Per-call timeout for JSON-RPC requests. */
    private long timeoutSeconds = 30;

    /** True for anvil, hardhat and other local dev nodes; such nodes are always read over RPC. */
    private boolean localNode = false;

    /** Local budget for JSON-RPC calls. */
    private int maxRequestsPerSecond = 25;

    /** How long a call may wait for a local rate-limit permit before failing. */
    private long limiterTimeoutMs = 5_000;

    public boolean hasWebSocket() {
        return wsUrl != null && !wsUrl.isBlank();
    }
}
