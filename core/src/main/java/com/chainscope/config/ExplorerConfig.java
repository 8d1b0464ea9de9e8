package com.chainscope.config;

import com.chainscope.adapter.indexed.EtherscanAdapter;
import com.chainscope.adapter.rpc.EnsReverseResolver;
import com.chainscope.adapter.rpc.Erc20MetadataReader;
import com.chainscope.adapter.rpc.NodeRpcAdapter;
import com.chainscope.adapter.rpc.RpcSubscriptionClient;
import com.chainscope.adapter.rpc.WebClientEvmRpcClient;
import com.chainscope.adapter.rpc.WebSocketRpcSubscriptionClient;
import com.chainscope.cache.CacheStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.socket.client.ReactorNettyWebSocketClient;

import java.time.Clock;
import java.time.Duration;

/**
 * Wires the cache store and both backend adapters. Configuration is resolved here once; core
 * classes receive plain values.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties({
        NetworkProperties.class,
        EtherscanProperties.class,
        CacheProperties.class,
        SubscriptionProperties.class
})
public class ExplorerConfig {

    public static final String RPC_RATE_LIMITER = "nodeRpcRateLimiter";
    public static final String ETHERSCAN_RATE_LIMITER = "etherscanRateLimiter";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CacheStore cacheStore(CacheProperties properties, Clock clock) {
        return new CacheStore(properties.isEnabled(), properties.getMaxEntriesPerKind(), properties.ttls(), clock);
    }

    @Bean(name = RPC_RATE_LIMITER)
    public RateLimiter nodeRpcRateLimiter(NetworkProperties properties) {
        return RateLimiter.of("node-rpc", RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(Math.max(1, properties.getMaxRequestsPerSecond()))
                .timeoutDuration(Duration.ofMillis(Math.max(0, properties.getLimiterTimeoutMs())))
                .build());
    }

    @Bean(name = ETHERSCAN_RATE_LIMITER)
    public RateLimiter etherscanRateLimiter(EtherscanProperties properties) {
        return RateLimiter.of("etherscan", RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(Math.max(1, properties.getRequestsPerSecond()))
                .timeoutDuration(Duration.ofMillis(Math.max(0, properties.getLimiterTimeoutMs())))
                .build());
    }

    @Bean
    public NodeRpcAdapter nodeRpcAdapter(NetworkProperties properties,
                                         WebClient.Builder webClientBuilder,
                                         @Qualifier(RPC_RATE_LIMITER) RateLimiter rateLimiter,
                                         ObjectMapper objectMapper) {
        RpcSubscriptionClient subscriptionClient = null;
        if (properties.hasWebSocket()) {
            subscriptionClient = new WebSocketRpcSubscriptionClient(
                    new ReactorNettyWebSocketClient(), properties.getWsUrl(), objectMapper);
        }
        log.info("Node RPC at {} (chain {}, push {}, local {})", properties.getRpcUrl(), properties.getChainId(),
                subscriptionClient != null ? "enabled" : "disabled", properties.isLocalNode());
        return new NodeRpcAdapter(
                new WebClientEvmRpcClient(webClientBuilder.build()),
                subscriptionClient,
                properties.getRpcUrl(),
                Duration.ofSeconds(properties.getTimeoutSeconds()),
                rateLimiter,
                objectMapper);
    }

    @Bean
    public EtherscanAdapter etherscanAdapter(EtherscanProperties properties,
                                             NetworkProperties networkProperties,
                                             WebClient.Builder webClientBuilder,
                                             @Qualifier(ETHERSCAN_RATE_LIMITER) RateLimiter rateLimiter,
                                             ObjectMapper objectMapper,
                                             Environment environment,
                                             Clock clock) {
        String apiKey = resolveApiKey(environment, properties.getApiKey());
        if (apiKey == null) {
            log.info("No indexed API key configured; history lists will be empty and reads go to the node");
        }
        return new EtherscanAdapter(
                webClientBuilder.clone().baseUrl(properties.getBaseUrl()).build(),
                apiKey,
                networkProperties.getChainId(),
                Duration.ofSeconds(properties.getTimeoutSeconds()),
                rateLimiter,
                objectMapper,
                clock);
    }

    @Bean
    public Erc20MetadataReader erc20MetadataReader(NodeRpcAdapter nodeRpcAdapter, Clock clock) {
        return new Erc20MetadataReader(nodeRpcAdapter, clock);
    }

    @Bean
    public EnsReverseResolver ensReverseResolver(NodeRpcAdapter nodeRpcAdapter) {
        return new EnsReverseResolver(nodeRpcAdapter);
    }

    /** Environment variable first, then the persisted value; null when neither is set. */
    static String resolveApiKey(Environment environment, String configured) {
        String fromEnv = environment.getProperty(EtherscanProperties.API_KEY_ENV);
        if (fromEnv != null && !fromEnv.isBlank()) {
            return fromEnv.trim();
        }
        return configured != null && !configured.isBlank() ? configured.trim() : null;
    }
}
