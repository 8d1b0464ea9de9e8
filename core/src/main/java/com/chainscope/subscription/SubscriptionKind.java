package com.chainscope.subscription;

public enum SubscriptionKind {
    NEW_BLOCKS,
    ADDRESS_ACTIVITY,
    PENDING_TRANSACTIONS
}
