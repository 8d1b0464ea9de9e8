package com.chainscope.subscription;

import com.chainscope.domain.ChainTransaction;

public record PendingTransaction(String subscriptionId, ChainTransaction transaction) implements ExplorerEvent {
}
