package com.chainscope.adapter.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import reactor.core.publisher.Flux;

/**
 * Push transport for {@code eth_subscribe}. Each subscriber of the returned flux opens its own
 * connection; cancelling the subscriber closes it.
 */
public interface RpcSubscriptionClient {

    /**
     * @param kind subscription kind, e.g. "newHeads" or "newPendingTransactions"
     * @return the {@code result} payload of every notification
     */
    Flux<JsonNode> subscribe(String kind);
}
