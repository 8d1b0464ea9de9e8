package com.chainscope.subscription;

/**
 * Marker for everything delivered on {@link SubscriptionManager#events()}.
 */
public interface ExplorerEvent {

    /** Id of the subscription that produced the event. */
    String subscriptionId();
}
