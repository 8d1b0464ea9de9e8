package com.chainscope.adapter.rpc;

import com.chainscope.common.error.NetworkException;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * JSON-RPC over HTTP using WebClient. One instance (and one connection pool) is shared by every
 * caller of the node.
 */
public class WebClientEvmRpcClient implements EvmRpcClient {

    private final WebClient webClient;
    private final AtomicLong ids = new AtomicLong();

    public WebClientEvmRpcClient(WebClient webClient) {
        this.webClient = webClient;
    }

    @Override
    public Mono<String> call(String endpointUrl, String method, Object params) {
        Map<String, Object> body = Map.of(
                "jsonrpc", "2.0",
                "id", ids.incrementAndGet(),
                "method", method,
                "params", params != null ? params : new Object[]{}
        );
        return webClient.post()
                .uri(endpointUrl)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(String.class)
                .onErrorMap(WebClientResponseException.class,
                        e -> new NetworkException(method + " failed with HTTP " + e.getStatusCode().value(), e))
                .onErrorMap(WebClientRequestException.class,
                        e -> new NetworkException(method + " could not reach " + endpointUrl + ": " + e.getMessage(), e));
    }
}
