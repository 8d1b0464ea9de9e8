package com.chainscope.adapter.rpc;

import reactor.core.publisher.Mono;

/**
 * JSON-RPC transport. Returns the raw response body; envelope parsing is done by
 * {@link NodeRpcAdapter}.
 */
public interface EvmRpcClient {

    Mono<String> call(String endpointUrl, String method, Object params);
}
