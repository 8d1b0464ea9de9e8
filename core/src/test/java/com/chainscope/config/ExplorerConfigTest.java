package com.chainscope.config;

import com.chainscope.ChainscopeApplication;
import com.chainscope.adapter.rpc.NodeRpcAdapter;
import com.chainscope.cache.CacheKind;
import com.chainscope.cache.CacheStore;
import com.chainscope.service.ExplorerDataService;
import com.chainscope.subscription.SubscriptionManager;
import io.github.resilience4j.ratelimiter.RateLimiter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.mock.env.MockEnvironment;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(classes = ChainscopeApplication.class, properties = {
        "chainscope.network.rpc-url=http://localhost:18545",
        "chainscope.network.max-requests-per-second=7",
        "chainscope.cache.address-ttl=45s",
        "chainscope.cache.max-entries-per-kind=10"
})
class ExplorerConfigTest {

    @Autowired
    CacheStore cacheStore;

    @Autowired
    NodeRpcAdapter nodeRpcAdapter;

    @Autowired
    @Qualifier(ExplorerConfig.RPC_RATE_LIMITER)
    RateLimiter nodeRpcRateLimiter;

    @Autowired
    @Qualifier(ExplorerConfig.ETHERSCAN_RATE_LIMITER)
    RateLimiter etherscanRateLimiter;

    @Autowired
    @Qualifier(SchedulerConfig.SUBSCRIPTION_SCHEDULER)
    Scheduler subscriptionScheduler;

    @Autowired
    ExplorerDataService explorerDataService;

    @Autowired
    SubscriptionManager subscriptionManager;

    @Test
    @DisplayName("cache store picks up per-kind ttls from properties")
    void cacheStoreConfigured() {
        assertThat(cacheStore.isEnabled()).isTrue();
        assertThat(cacheStore.ttl(CacheKind.ADDRESSES)).isEqualTo(Duration.ofSeconds(45));
        assertThat(cacheStore.ttl(CacheKind.BLOCKS)).isEqualTo(Duration.ofHours(1));
    }

    @Test
    @DisplayName("node adapter polls when no websocket endpoint is configured")
    void nodeAdapterWithoutPush() {
        assertThat(nodeRpcAdapter.getEndpointUrl()).isEqualTo("http://localhost:18545");
        assertThat(nodeRpcAdapter.supportsPush()).isFalse();
        assertThat(subscriptionManager.hasPushSupport()).isFalse();
    }

    @Test
    @DisplayName("rate limiters are sized per backend")
    void rateLimitersConfigured() {
        assertThat(nodeRpcRateLimiter.getRateLimiterConfig().getLimitForPeriod()).isEqualTo(7);
        assertThat(etherscanRateLimiter.getRateLimiterConfig().getLimitForPeriod()).isEqualTo(5);
        assertThat(subscriptionScheduler.isDisposed()).isFalse();
        assertThat(explorerDataService.cacheStats().total()).isZero();
    }

    @Test
    @DisplayName("api key from the environment wins over the persisted value")
    void apiKeyPrecedence() {
        MockEnvironment environment = new MockEnvironment();
        assertThat(ExplorerConfig.resolveApiKey(environment, " persisted ")).isEqualTo("persisted");
        assertThat(ExplorerConfig.resolveApiKey(environment, "  ")).isNull();
        assertThat(ExplorerConfig.resolveApiKey(environment, null)).isNull();

        environment.setProperty(EtherscanProperties.API_KEY_ENV, "from-env");
        assertThat(ExplorerConfig.resolveApiKey(environment, "persisted")).isEqualTo("from-env");
    }
}
