package com.chainscope.adapter.rpc;

import com.chainscope.common.error.BlockchainException;
import com.chainscope.common.error.NetworkException;
import com.chainscope.common.error.ResponseParseException;
import com.chainscope.domain.Block;
import com.chainscope.domain.ChainTransaction;
import com.chainscope.domain.TransactionReceipt;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NodeRpcAdapterTest {

    private static final String ADDRESS = "0x742d35cc6634c0532925a3b844bc454e4438f44e";
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private MockEvmRpcClient mockRpc;
    private NodeRpcAdapter adapter;

    @BeforeEach
    void setUp() {
        mockRpc = new MockEvmRpcClient();
        adapter = new NodeRpcAdapter(mockRpc, null, "https://test.rpc", Duration.ofMillis(200), fastLimiter(), MAPPER);
    }

    @Test
    @DisplayName("eth_getBalance hex result is decoded")
    void balance() {
        mockRpc.respond("eth_getBalance", "{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":\"0xde0b6b3a7640000\"}");

        BigInteger balance = adapter.getBalance(ADDRESS).block();

        assertThat(balance).isEqualTo(new BigInteger("1000000000000000000"));
        assertThat(mockRpc.calls).containsExactly("eth_getBalance");
        assertThat(mockRpc.lastParams.get("eth_getBalance")).isEqualTo(List.of(ADDRESS, "latest"));
    }

    @Test
    @DisplayName("JSON-RPC error object becomes BlockchainException with code")
    void errorObject() {
        mockRpc.respond("eth_getTransactionCount",
                "{\"jsonrpc\":\"2.0\",\"id\":1,\"error\":{\"code\":-32602,\"message\":\"invalid argument 0\"}}");

        assertThatThrownBy(() -> adapter.getTransactionCount(ADDRESS).block())
                .isInstanceOf(BlockchainException.class)
                .hasMessageContaining("invalid argument 0")
                .extracting(e -> ((BlockchainException) e).getCode())
                .isEqualTo(-32602);
    }

    @Test
    @DisplayName("missing result field is a parse error")
    void missingResult() {
        mockRpc.respond("eth_blockNumber", "{\"jsonrpc\":\"2.0\",\"id\":1}");

        assertThatThrownBy(() -> adapter.getBlockNumber().block())
                .isInstanceOf(ResponseParseException.class)
                .hasMessageContaining("no result field");
    }

    @Test
    @DisplayName("non-hex quantity is a parse error")
    void malformedQuantity() {
        mockRpc.respond("eth_gasPrice", "{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":\"12\"}");

        assertThatThrownBy(() -> adapter.getGasPrice().block())
                .isInstanceOf(ResponseParseException.class);
    }

    @Test
    @DisplayName("non-JSON body is a parse error")
    void malformedJson() {
        mockRpc.respond("eth_chainId", "<html>bad gateway</html>");

        assertThatThrownBy(() -> adapter.getChainId().block())
                .isInstanceOf(ResponseParseException.class);
    }

    @Test
    @DisplayName("null result means not found")
    void nullResultIsEmpty() {
        mockRpc.respond("eth_getTransactionByHash", "{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":null}");

        ChainTransaction tx = adapter.getTransaction("0x" + "aa".repeat(32)).block();

        assertThat(tx).isNull();
    }

    @Test
    @DisplayName("call that never answers times out as NetworkException")
    void timeout() {
        mockRpc.hang("eth_getCode");

        assertThatThrownBy(() -> adapter.getCode(ADDRESS).block())
                .isInstanceOf(NetworkException.class)
                .hasMessageContaining("timed out");
    }

    @Test
    @DisplayName("transport failure is wrapped as NetworkException")
    void transportFailure() {
        mockRpc.fail("eth_blockNumber", new IllegalStateException("connection reset"));

        assertThatThrownBy(() -> adapter.getBlockNumber().block())
                .isInstanceOf(NetworkException.class)
                .hasMessageContaining("connection reset");
    }

    @Test
    @DisplayName("block with full transactions is mapped")
    void blockWithTransactions() {
        mockRpc.respond("eth_getBlockByNumber", """
                {"jsonrpc":"2.0","id":1,"result":{
                  "number":"0x64","hash":"0xB1","parentHash":"0xb0","timestamp":"0x65f0a000",
                  "miner":"0xminer","gasUsed":"0x5208","gasLimit":"0x1c9c380","baseFeePerGas":"0x3b9aca00",
                  "transactions":[{
                    "hash":"0xT1","blockNumber":"0x64","blockHash":"0xb1","transactionIndex":"0x0",
                    "from":"0xAA","to":"0xBB","value":"0x1","gas":"0x5208","gasPrice":"0x3b9aca00",
                    "nonce":"0x7","input":"0x"
                  }]
                }}
                """);

        Block block = adapter.getBlockByNumber(100, true).block();

        assertThat(block).isNotNull();
        assertThat(block.number()).isEqualTo(100L);
        assertThat(block.hash()).isEqualTo("0xb1");
        assertThat(block.timestamp()).isEqualTo(Instant.ofEpochSecond(0x65f0a000L));
        assertThat(block.baseFeePerGas()).isEqualTo(BigInteger.valueOf(1_000_000_000L));
        assertThat(block.transactionHashes()).containsExactly("0xt1");
        assertThat(block.transactions()).singleElement().satisfies(tx -> {
            assertThat(tx.from()).isEqualTo("0xaa");
            assertThat(tx.to()).isEqualTo("0xbb");
            assertThat(tx.nonce()).isEqualTo(7L);
            assertThat(tx.isPending()).isFalse();
        });
        assertThat(mockRpc.lastParams.get("eth_getBlockByNumber")).isEqualTo(List.of("0x64", true));
    }

    @Test
    @DisplayName("receipt status and effective gas price are mapped")
    void receipt() {
        mockRpc.respond("eth_getTransactionReceipt", """
                {"jsonrpc":"2.0","id":1,"result":{
                  "transactionHash":"0xT1","blockNumber":"0x64","gasUsed":"0x5208",
                  "effectiveGasPrice":"0x2","status":"0x0","contractAddress":null
                }}
                """);

        TransactionReceipt receipt = adapter.getTransactionReceipt("0xt1").block();

        assertThat(receipt).isNotNull();
        assertThat(receipt.success()).isFalse();
        assertThat(receipt.gasUsed()).isEqualTo(BigInteger.valueOf(21_000));
        assertThat(receipt.effectiveGasPrice()).isEqualTo(BigInteger.TWO);
        assertThat(receipt.contractAddress()).isNull();
    }

    @Test
    @DisplayName("estimateGas omits absent fields and hex-encodes value")
    void estimateGasParams() {
        mockRpc.respond("eth_estimateGas", "{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":\"0x5208\"}");

        BigInteger gas = adapter.estimateGas(ADDRESS, ADDRESS, null, BigInteger.valueOf(255)).block();

        assertThat(gas).isEqualTo(BigInteger.valueOf(21_000));
        @SuppressWarnings("unchecked")
        Map<String, Object> call = (Map<String, Object>) ((List<Object>) mockRpc.lastParams.get("eth_estimateGas")).get(0);
        assertThat(call).containsEntry("value", "0xff").doesNotContainKey("data");
    }

    @Test
    @DisplayName("push streams fail fast without a WebSocket endpoint")
    void noPushWithoutWebSocket() {
        assertThat(adapter.supportsPush()).isFalse();
        assertThatThrownBy(() -> adapter.newHeads().blockFirst())
                .isInstanceOf(NetworkException.class);
    }

    @Test
    @DisplayName("newHeads notifications are mapped to block heads")
    void newHeadsMapped() throws Exception {
        JsonNode head = MAPPER.readTree("{\"number\":\"0x10\",\"hash\":\"0xh16\"}");
        RpcSubscriptionClient push = kind -> Flux.just(head);
        NodeRpcAdapter pushAdapter = new NodeRpcAdapter(mockRpc, push, "https://test.rpc", Duration.ofSeconds(1), fastLimiter(), MAPPER);

        assertThat(pushAdapter.supportsPush()).isTrue();
        assertThat(pushAdapter.newHeads().collectList().block()).containsExactly(new BlockHead(16, "0xh16"));
    }

    static RateLimiter fastLimiter() {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(1_000_000)
                .timeoutDuration(Duration.ofMillis(1))
                .build();
        return RateLimiter.of("test-node-rpc", config);
    }

    private static class MockEvmRpcClient implements EvmRpcClient {
        private final Map<String, Mono<String>> responses = new HashMap<>();
        private final List<String> calls = new ArrayList<>();
        private final Map<String, Object> lastParams = new HashMap<>();

        void respond(String method, String body) {
            responses.put(method, Mono.just(body));
        }

        void hang(String method) {
            responses.put(method, Mono.never());
        }

        void fail(String method, Throwable error) {
            responses.put(method, Mono.error(error));
        }

        @Override
        public Mono<String> call(String endpointUrl, String method, Object params) {
            calls.add(method);
            lastParams.put(method, params);
            return responses.getOrDefault(method, Mono.just("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":null}"));
        }
    }
}
