package com.chainscope.subscription;

/**
 * Terminal event: the subscription has stopped and is no longer active.
 */
public record SubscriptionError(String subscriptionId, String message) implements ExplorerEvent {
}
