package com.chainscope.subscription;

public record NewBlock(String subscriptionId, long number, String hash) implements ExplorerEvent {
}
