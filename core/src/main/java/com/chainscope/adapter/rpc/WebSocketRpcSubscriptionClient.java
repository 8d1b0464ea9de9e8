package com.chainscope.adapter.rpc;

import com.chainscope.common.error.BlockchainException;
import com.chainscope.common.error.ExplorerException;
import com.chainscope.common.error.NetworkException;
import com.chainscope.common.error.ResponseParseException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.client.WebSocketClient;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;
import reactor.core.publisher.Mono;

import java.net.URI;

/**
 * {@code eth_subscribe} over a WebSocket connection to the node.
 */
@Slf4j
public class WebSocketRpcSubscriptionClient implements RpcSubscriptionClient {

    private final WebSocketClient client;
    private final URI endpoint;
    private final ObjectMapper objectMapper;

    public WebSocketRpcSubscriptionClient(WebSocketClient client, String wsUrl, ObjectMapper objectMapper) {
        this.client = client;
        this.endpoint = URI.create(wsUrl);
        this.objectMapper = objectMapper;
    }

    @Override
    public Flux<JsonNode> subscribe(String kind) {
        String request = "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"eth_subscribe\",\"params\":[\"" + kind + "\"]}";
        return Flux.create(sink -> {
            Disposable connection = client.execute(endpoint, session ->
                            session.send(Mono.just(session.textMessage(request)))
                                    .thenMany(session.receive()
                                            .map(WebSocketMessage::getPayloadAsText)
                                            .doOnNext(text -> dispatch(kind, text, sink)))
                                    .then())
                    .subscribe(
                            unused -> {
                            },
                            e -> sink.error(e instanceof ExplorerException
                                    ? e
                                    : new NetworkException("WebSocket " + kind + " subscription failed: " + e.getMessage(), e)),
                            sink::complete);
            sink.onDispose(connection);
        });
    }

    private void dispatch(String kind, String text, FluxSink<JsonNode> sink) {
        JsonNode root;
        try {
            root = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            sink.error(new ResponseParseException("Malformed " + kind + " notification", e));
            return;
        }
        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            sink.error(new BlockchainException("eth_subscribe " + kind + " rejected: " + error.path("message").asText(error.toString()),
                    error.path("code").isInt() ? error.path("code").asInt() : null));
            return;
        }
        if ("eth_subscription".equals(root.path("method").asText())) {
            sink.next(root.path("params").path("result"));
        } else {
            log.debug("eth_subscribe {} acknowledged as {}", kind, root.path("result").asText());
        }
    }
}
