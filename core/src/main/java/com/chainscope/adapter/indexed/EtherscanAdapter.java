package com.chainscope.adapter.indexed;

import com.chainscope.adapter.ChainReader;
import com.chainscope.adapter.RpcJson;
import com.chainscope.common.error.BlockchainException;
import com.chainscope.common.error.ExplorerException;
import com.chainscope.common.error.NetworkException;
import com.chainscope.common.error.ResponseParseException;
import com.chainscope.domain.AddressTransaction;
import com.chainscope.domain.Block;
import com.chainscope.domain.ChainTransaction;
import com.chainscope.domain.ContractInfo;
import com.chainscope.domain.InternalTransaction;
import com.chainscope.domain.KnownChain;
import com.chainscope.domain.TokenBalance;
import com.chainscope.domain.TokenTransfer;
import com.chainscope.domain.TransactionReceipt;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.reactor.ratelimiter.operator.RateLimiterOperator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Client for the Etherscan V2 multichain API. The chain is selected per request with
 * {@code chainid}; the API key travels as a query parameter and is never logged.
 * <p>
 * Envelope handling: {@code status "1"} carries data; {@code status "0"} is either an empty
 * result ("No transactions found") or a rejection. List rows are converted one by one and a
 * malformed row is dropped.
 */
@Slf4j
public class EtherscanAdapter implements ChainReader {

    static final String START_BLOCK = "0";
    static final String END_BLOCK = "99999999";

    private final WebClient webClient;
    private final String apiKey;
    private final long chainId;
    private final Duration timeout;
    private final RateLimiter rateLimiter;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * @param webClient client whose base URL points at the API endpoint
     * @param apiKey    null or blank when no key is configured
     */
    public EtherscanAdapter(WebClient webClient,
                            String apiKey,
                            long chainId,
                            Duration timeout,
                            RateLimiter rateLimiter,
                            ObjectMapper objectMapper,
                            Clock clock) {
        this.webClient = webClient;
        this.apiKey = apiKey;
        this.chainId = chainId;
        this.timeout = timeout;
        this.rateLimiter = rateLimiter;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public String sourceName() {
        return "etherscan";
    }

    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    /** Value of the {@code chainid} parameter: the known chain's id, else the raw number. */
    String chainIdParam() {
        return KnownChain.fromChainId(chainId)
                .map(c -> String.valueOf(c.getChainId()))
                .orElse(String.valueOf(chainId));
    }

    @Override
    public Mono<BigInteger> getBalance(String address) {
        Map<String, String> params = params("account", "balance");
        params.put("address", address);
        params.put("tag", "latest");
        return get("balance", params).map(body -> {
            JsonNode result = parseStatusEnvelope("balance", body);
            if (!result.isTextual()) {
                throw new ResponseParseException("balance result is not a string");
            }
            try {
                return new BigInteger(result.asText());
            } catch (NumberFormatException e) {
                throw new ResponseParseException("balance result is not a decimal number: " + result.asText(), e);
            }
        });
    }

    @Override
    public Mono<Long> getTransactionCount(String address) {
        Map<String, String> params = params("proxy", "eth_getTransactionCount");
        params.put("address", address);
        params.put("tag", "latest");
        return proxy(params, node -> RpcJson.quantityOf(node).longValueExact());
    }

    @Override
    public Mono<String> getCode(String address) {
        Map<String, String> params = params("proxy", "eth_getCode");
        params.put("address", address);
        params.put("tag", "latest");
        return proxy(params, RpcJson::textOf);
    }

    @Override
    public Mono<Long> getBlockNumber() {
        return proxy(params("proxy", "eth_blockNumber"), node -> RpcJson.quantityOf(node).longValueExact());
    }

    @Override
    public Mono<Block> getBlockByNumber(long number, boolean fullTransactions) {
        Map<String, String> params = params("proxy", "eth_getBlockByNumber");
        params.put("tag", RpcJson.toHexQuantity(number));
        params.put("boolean", String.valueOf(fullTransactions));
        return proxy(params, RpcJson::toBlock);
    }

    @Override
    public Mono<Block> getLatestBlock(boolean fullTransactions) {
        return getBlockNumber().flatMap(number -> getBlockByNumber(number, fullTransactions));
    }

    @Override
    public Mono<ChainTransaction> getTransaction(String hash) {
        Map<String, String> params = params("proxy", "eth_getTransactionByHash");
        params.put("txhash", hash);
        return proxy(params, RpcJson::toTransaction);
    }

    @Override
    public Mono<TransactionReceipt> getTransactionReceipt(String hash) {
        Map<String, String> params = params("proxy", "eth_getTransactionReceipt");
        params.put("txhash", hash);
        return proxy(params, RpcJson::toReceipt);
    }

    @Override
    public Mono<BigInteger> getGasPrice() {
        return proxy(params("proxy", "eth_gasPrice"), RpcJson::quantityOf);
    }

    @Override
    public Mono<Long> getChainId() {
        return Mono.just(chainId);
    }

    public Mono<List<AddressTransaction>> getAddressTransactions(String address) {
        return list("txlist", addressRangeParams("txlist", address), TxListRow.class, TxListRow::toDomain);
    }

    public Mono<List<TokenTransfer>> getTokenTransfers(String address) {
        return list("tokentx", addressRangeParams("tokentx", address), TokenTxRow.class, TokenTxRow::toDomain);
    }

    public Mono<List<InternalTransaction>> getInternalTransactions(String address) {
        return list("txlistinternal", addressRangeParams("txlistinternal", address), InternalTxRow.class,
                row -> row.toDomain(null));
    }

    /** Internal transactions of a single parent transaction. */
    public Mono<List<InternalTransaction>> getInternalTransactionsByHash(String txHash) {
        Map<String, String> params = params("account", "txlistinternal");
        params.put("txhash", txHash);
        return list("txlistinternal", params, InternalTxRow.class, row -> row.toDomain(txHash));
    }

    public Mono<List<TokenBalance>> getTokenBalances(String address) {
        Map<String, String> params = params("account", "tokenlist");
        params.put("address", address);
        return list("tokenlist", params, TokenBalanceRow.class, TokenBalanceRow::toDomain);
    }

    /** Verified source metadata; empty when the API returns no row for the address. */
    public Mono<ContractInfo> getContractInfo(String address) {
        Map<String, String> params = params("contract", "getsourcecode");
        params.put("address", address);
        return list("getsourcecode", params, SourceCodeRow.class, row -> row.toDomain(address, clock.instant()))
                .flatMap(rows -> rows.isEmpty() ? Mono.empty() : Mono.just(rows.get(0)));
    }

    private Map<String, String> params(String module, String action) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("chainid", chainIdParam());
        params.put("module", module);
        params.put("action", action);
        return params;
    }

    private Map<String, String> addressRangeParams(String action, String address) {
        Map<String, String> params = params("account", action);
        params.put("address", address);
        params.put("startblock", START_BLOCK);
        params.put("endblock", END_BLOCK);
        params.put("sort", "desc");
        return params;
    }

    private Mono<String> get(String action, Map<String, String> params) {
        return Mono.defer(() -> webClient.get()
                        .uri(builder -> {
                            params.forEach((name, value) -> builder.queryParam(name, value));
                            if (isConfigured()) {
                                builder.queryParam("apikey", apiKey);
                            }
                            return builder.build();
                        })
                        .retrieve()
                        .bodyToMono(String.class))
                .transformDeferred(RateLimiterOperator.of(rateLimiter))
                .timeout(timeout)
                .onErrorMap(e -> !(e instanceof ExplorerException), e -> toNetworkException(action, e))
                .switchIfEmpty(Mono.error(() -> new ResponseParseException(action + " returned an empty body")));
    }

    private NetworkException toNetworkException(String action, Throwable e) {
        if (e instanceof WebClientResponseException wre) {
            return new NetworkException(action + " failed with HTTP " + wre.getStatusCode().value(), e);
        }
        if (e instanceof WebClientRequestException) {
            return new NetworkException(action + " could not reach the indexed API: " + e.getMessage(), e);
        }
        if (e instanceof TimeoutException) {
            return new NetworkException(action + " timed out after " + timeout.toMillis() + " ms", e);
        }
        if (e instanceof RequestNotPermitted) {
            return new NetworkException(action + " rejected by local rate limiter", e);
        }
        return new NetworkException(action + " failed: " + e.getMessage(), e);
    }

    private JsonNode readTree(String action, String body) {
        try {
            JsonNode root = objectMapper.readTree(body);
            if (root == null || !root.isObject()) {
                throw new ResponseParseException(action + " returned no JSON object");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new ResponseParseException(action + " returned malformed JSON", e);
        }
    }

    /** {@code {status, message, result}} with a single value: any status other than "1" is a rejection. */
    JsonNode parseStatusEnvelope(String action, String body) {
        JsonNode root = readTree(action, body);
        JsonNode result = root.get("result");
        if (result == null) {
            throw new ResponseParseException(action + ": Missing result field");
        }
        if (!"1".equals(root.path("status").asText())) {
            throw new BlockchainException(action + " rejected: " + root.path("message").asText() + " " + result.asText());
        }
        return result;
    }

    /** Proxy module: JSON-RPC shaped, but rejections may still use the status envelope. */
    private <T> Mono<T> proxy(Map<String, String> params, Function<JsonNode, T> mapper) {
        String action = params.get("action");
        return get(action, params)
                .map(body -> {
                    JsonNode root = readTree(action, body);
                    JsonNode error = root.path("error");
                    if (!error.isMissingNode() && !error.isNull()) {
                        Integer code = error.path("code").isInt() ? error.path("code").asInt() : null;
                        throw new BlockchainException(action + ": " + error.path("message").asText(error.toString()), code);
                    }
                    if ("0".equals(root.path("status").asText())) {
                        throw new BlockchainException(action + " rejected: " + root.path("result").asText(root.path("message").asText()));
                    }
                    JsonNode result = root.get("result");
                    if (result == null) {
                        throw new ResponseParseException(action + ": Missing result field");
                    }
                    return result.isNull() ? NullNode.getInstance() : result;
                })
                .filter(result -> !result.isNull())
                .map(result -> {
                    try {
                        return mapper.apply(result);
                    } catch (ExplorerException e) {
                        throw e;
                    } catch (RuntimeException e) {
                        throw new ResponseParseException(action + " returned an unexpected result: " + e.getMessage(), e);
                    }
                });
    }

    private <R, T> Mono<List<T>> list(String action, Map<String, String> params, Class<R> rowType, Function<R, T> converter) {
        return get(action, params).map(body -> {
            JsonNode rows = parseListEnvelope(action, body);
            List<T> out = new ArrayList<>(rows.size());
            for (JsonNode node : rows) {
                try {
                    out.add(converter.apply(objectMapper.treeToValue(node, rowType)));
                } catch (JsonProcessingException | RuntimeException e) {
                    log.debug("Dropping malformed {} row: {}", action, e.getMessage());
                }
            }
            return out;
        });
    }

    /** Returns the result array; an empty array for "No ... found" answers. */
    JsonNode parseListEnvelope(String action, String body) {
        JsonNode root = readTree(action, body);
        JsonNode result = root.get("result");
        if (result == null) {
            throw new ResponseParseException(action + ": Missing result field");
        }
        String status = root.path("status").asText();
        String message = root.path("message").asText();
        if (result.isArray()) {
            if ("0".equals(status) && !result.isEmpty()) {
                throw new BlockchainException(action + " rejected: " + message);
            }
            return result;
        }
        if (result.isTextual()) {
            String text = result.asText();
            if (text.isEmpty() || isNoDataMessage(text) || isNoDataMessage(message)) {
                return objectMapper.createArrayNode();
            }
            if ("0".equals(status)) {
                throw new BlockchainException(action + " rejected: " + message + " " + text);
            }
            throw new NetworkException(action + " returned an error message: " + text);
        }
        throw new ResponseParseException(action + " result is not an array");
    }

    private static boolean isNoDataMessage(String text) {
        return text.startsWith("No transactions found")
                || text.startsWith("No transfers found")
                || text.startsWith("No internal transactions found")
                || text.startsWith("No records found")
                || text.startsWith("No token found");
    }
}
