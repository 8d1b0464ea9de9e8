package com.chainscope.subscription;

import com.chainscope.domain.ChainTransaction;

/**
 * A mined transaction sent from or to a watched address.
 */
public record NewAddressTransaction(String subscriptionId, String address, ChainTransaction transaction, long blockNumber)
        implements ExplorerEvent {
}
