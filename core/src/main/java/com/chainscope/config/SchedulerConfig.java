package com.chainscope.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Scheduler (2 threads) driving subscription poll loops.
 */
@Configuration
public class SchedulerConfig {

    public static final String SUBSCRIPTION_SCHEDULER = "subscription-scheduler";

    @Bean(name = SUBSCRIPTION_SCHEDULER, destroyMethod = "dispose")
    public Scheduler subscriptionScheduler() {
        return Schedulers.newParallel("subscription-poll", 2, true);
    }
}
