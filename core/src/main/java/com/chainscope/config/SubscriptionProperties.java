package com.chainscope.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Poll intervals used when the node has no push endpoint.
 */
@ConfigurationProperties(prefix = "chainscope.subscriptions")
@NoArgsConstructor
@Getter
@Setter
public class SubscriptionProperties {

    private Duration blockPollInterval = Duration.ofSeconds(2);

    private Duration addressPollInterval = Duration.ofSeconds(3);

    private Duration pendingPollInterval = Duration.ofSeconds(2);
}
