package com.chainscope.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Indexed API (Etherscan V2) settings. The {@code ETHERSCAN_API_KEY} environment variable takes
 * precedence over {@link #apiKey}.
 */
@ConfigurationProperties(prefix = "chainscope.etherscan")
@NoArgsConstructor
@Getter
@Setter
public class EtherscanProperties {

    public static final String API_KEY_ENV = "ETHERSCAN_API_KEY";

    private String apiKey;

    private String baseUrl = "https://api.etherscan.io/v2/api";

    /** Free tier allows 5 calls per second. */
    private int requestsPerSecond = 5;

    private long timeoutSeconds = 10;

    /** How long a call may wait for a local rate-limit permit before failing. */
    private long limiterTimeoutMs = 5_000;
}
