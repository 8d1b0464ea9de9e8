package com.chainscope.adapter.rpc;

import com.chainscope.adapter.ChainReader;
import com.chainscope.adapter.RpcJson;
import com.chainscope.common.error.BlockchainException;
import com.chainscope.common.error.ExplorerException;
import com.chainscope.common.error.NetworkException;
import com.chainscope.common.error.ResponseParseException;
import com.chainscope.domain.Block;
import com.chainscope.domain.ChainTransaction;
import com.chainscope.domain.TransactionReceipt;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.reactor.ratelimiter.operator.RateLimiterOperator;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Typed wrapper over a JSON-RPC node. Every call passes the local rate limiter and is bounded by
 * the configured timeout.
 * <ul>
 *     <li>timeout or transport failure: {@link NetworkException}</li>
 *     <li>JSON-RPC {@code error} object: {@link BlockchainException}</li>
 *     <li>missing or malformed {@code result}: {@link ResponseParseException}</li>
 *     <li>{@code result: null}: empty Mono (not found)</li>
 * </ul>
 */
@Slf4j
public class NodeRpcAdapter implements ChainReader {

    private static final String LATEST = "latest";

    private final EvmRpcClient rpcClient;
    private final RpcSubscriptionClient subscriptionClient;
    private final String endpointUrl;
    private final Duration timeout;
    private final RateLimiter rateLimiter;
    private final ObjectMapper objectMapper;

    /**
     * @param subscriptionClient null when the node has no push endpoint
     */
    public NodeRpcAdapter(EvmRpcClient rpcClient,
                          RpcSubscriptionClient subscriptionClient,
                          String endpointUrl,
                          Duration timeout,
                          RateLimiter rateLimiter,
                          ObjectMapper objectMapper) {
        this.rpcClient = rpcClient;
        this.subscriptionClient = subscriptionClient;
        this.endpointUrl = endpointUrl;
        this.timeout = timeout;
        this.rateLimiter = rateLimiter;
        this.objectMapper = objectMapper;
    }

    @Override
    public String sourceName() {
        return "rpc";
    }

    public String getEndpointUrl() {
        return endpointUrl;
    }

    @Override
    public Mono<BigInteger> getBalance(String address) {
        return request("eth_getBalance", List.of(address, LATEST), RpcJson::quantityOf);
    }

    @Override
    public Mono<Long> getTransactionCount(String address) {
        return request("eth_getTransactionCount", List.of(address, LATEST), node -> RpcJson.quantityOf(node).longValueExact());
    }

    @Override
    public Mono<String> getCode(String address) {
        return request("eth_getCode", List.of(address, LATEST), RpcJson::textOf);
    }

    @Override
    public Mono<Long> getBlockNumber() {
        return request("eth_blockNumber", List.of(), node -> RpcJson.quantityOf(node).longValueExact());
    }

    @Override
    public Mono<Block> getBlockByNumber(long number, boolean fullTransactions) {
        return request("eth_getBlockByNumber", List.of(RpcJson.toHexQuantity(number), fullTransactions), RpcJson::toBlock);
    }

    @Override
    public Mono<Block> getLatestBlock(boolean fullTransactions) {
        return request("eth_getBlockByNumber", List.of(LATEST, fullTransactions), RpcJson::toBlock);
    }

    public Mono<Block> getBlockByHash(String hash, boolean fullTransactions) {
        return request("eth_getBlockByHash", List.of(hash, fullTransactions), RpcJson::toBlock);
    }

    @Override
    public Mono<ChainTransaction> getTransaction(String hash) {
        return request("eth_getTransactionByHash", List.of(hash), RpcJson::toTransaction);
    }

    @Override
    public Mono<TransactionReceipt> getTransactionReceipt(String hash) {
        return request("eth_getTransactionReceipt", List.of(hash), RpcJson::toReceipt);
    }

    @Override
    public Mono<BigInteger> getGasPrice() {
        return request("eth_gasPrice", List.of(), RpcJson::quantityOf);
    }

    @Override
    public Mono<Long> getChainId() {
        return request("eth_chainId", List.of(), node -> RpcJson.quantityOf(node).longValueExact());
    }

    /**
     * @param to    null for contract deployment estimates
     * @param data  null for plain transfers
     * @param value null for zero value
     */
    public Mono<BigInteger> estimateGas(String from, String to, String data, BigInteger value) {
        Map<String, Object> call = new LinkedHashMap<>();
        call.put("from", from);
        if (to != null) call.put("to", to);
        if (data != null) call.put("data", data);
        if (value != null) call.put("value", RpcJson.toHexQuantity(value));
        return request("eth_estimateGas", List.of(call), RpcJson::quantityOf);
    }

    /** eth_call against the latest block; returns the raw 0x-prefixed return data. */
    public Mono<String> call(String to, String data) {
        return request("eth_call", List.of(Map.of("to", to, "data", data), LATEST), RpcJson::textOf);
    }

    public Mono<String> newPendingTransactionFilter() {
        return request("eth_newPendingTransactionFilter", List.of(), RpcJson::textOf);
    }

    /** Transaction hashes seen by the filter since the previous poll. */
    public Mono<List<String>> getFilterChanges(String filterId) {
        return request("eth_getFilterChanges", List.of(filterId), node -> {
            if (!node.isArray()) {
                throw new ResponseParseException("eth_getFilterChanges result is not an array");
            }
            List<String> hashes = new ArrayList<>();
            node.forEach(h -> hashes.add(h.asText()));
            return hashes;
        });
    }

    public boolean supportsPush() {
        return subscriptionClient != null;
    }

    /** Push stream of new chain heads; fails immediately when no push endpoint is configured. */
    public Flux<BlockHead> newHeads() {
        if (subscriptionClient == null) {
            return Flux.error(new NetworkException("No WebSocket endpoint configured for newHeads"));
        }
        return subscriptionClient.subscribe("newHeads")
                .map(head -> new BlockHead(RpcJson.quantity(head, "number").longValueExact(), head.path("hash").asText()));
    }

    /** Push stream of pending transaction hashes. */
    public Flux<String> newPendingTransactionHashes() {
        if (subscriptionClient == null) {
            return Flux.error(new NetworkException("No WebSocket endpoint configured for newPendingTransactions"));
        }
        return subscriptionClient.subscribe("newPendingTransactions").map(JsonNode::asText);
    }

    private <T> Mono<T> request(String method, Object params, Function<JsonNode, T> mapper) {
        return Mono.defer(() -> rpcClient.call(endpointUrl, method, params))
                .transformDeferred(RateLimiterOperator.of(rateLimiter))
                .timeout(timeout)
                .onErrorMap(e -> !(e instanceof ExplorerException), e -> toNetworkException(method, e))
                .switchIfEmpty(Mono.error(() -> new ResponseParseException(method + " returned an empty body")))
                .map(body -> parseResult(method, body))
                .filter(result -> !result.isNull())
                .map(result -> mapResult(method, result, mapper));
    }

    private NetworkException toNetworkException(String method, Throwable e) {
        if (e instanceof TimeoutException) {
            return new NetworkException(method + " timed out after " + timeout.toMillis() + " ms", e);
        }
        if (e instanceof RequestNotPermitted) {
            return new NetworkException(method + " rejected by local rate limiter", e);
        }
        return new NetworkException(method + " failed: " + e.getMessage(), e);
    }

    JsonNode parseResult(String method, String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ResponseParseException(method + " returned malformed JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new ResponseParseException(method + " returned no JSON object");
        }
        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            String message = error.path("message").asText(error.toString());
            Integer code = error.path("code").isInt() ? error.path("code").asInt() : null;
            throw new BlockchainException(method + ": " + message, code);
        }
        JsonNode result = root.get("result");
        if (result == null) {
            throw new ResponseParseException(method + " response has no result field");
        }
        return result.isNull() ? NullNode.getInstance() : result;
    }

    private static <T> T mapResult(String method, JsonNode result, Function<JsonNode, T> mapper) {
        try {
            return mapper.apply(result);
        } catch (ExplorerException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ResponseParseException(method + " returned an unexpected result: " + e.getMessage(), e);
        }
    }
}
