package com.chainscope.subscription;

import reactor.core.Disposable;

import java.time.Instant;

/**
 * A running background task.
 *
 * @param address watched address for ADDRESS_ACTIVITY, null otherwise
 * @param push    true when fed by the node's push stream rather than polling
 */
public record Subscription(String id, SubscriptionKind kind, String address, boolean push, Instant startedAt,
                           Disposable handle) {
}
