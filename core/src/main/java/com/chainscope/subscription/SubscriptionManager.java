package com.chainscope.subscription;

import com.chainscope.adapter.rpc.NodeRpcAdapter;
import com.chainscope.common.error.NetworkException;
import com.chainscope.common.validation.InputValidator;
import com.chainscope.config.SchedulerConfig;
import com.chainscope.config.SubscriptionProperties;
import com.chainscope.domain.Block;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

/**
 * Keeps one background task per subscription id and multiplexes their output onto
 * {@link #events()}.
 * <p>
 * Tasks use the node's push stream when a WebSocket endpoint is configured and poll otherwise.
 * Subscribing with an id that is already running cancels the old task first. A task that fails
 * emits one {@link SubscriptionError} and is removed.
 */
@Slf4j
@Component
public class SubscriptionManager {

    private final NodeRpcAdapter rpc;
    private final SubscriptionProperties properties;
    private final Scheduler scheduler;
    private final Clock clock;
    private final Map<String, Subscription> subscriptions = new ConcurrentHashMap<>();
    private final Sinks.Many<ExplorerEvent> sink = Sinks.many().multicast().directBestEffort();
    private final Object emitLock = new Object();

    public SubscriptionManager(NodeRpcAdapter rpc,
                               SubscriptionProperties properties,
                               @Qualifier(SchedulerConfig.SUBSCRIPTION_SCHEDULER) Scheduler scheduler,
                               Clock clock) {
        this.rpc = rpc;
        this.properties = properties;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    /**
     * Hot stream shared by every subscription. Events emitted while nobody listens are dropped,
     * as are events for a listener that is not keeping up.
     */
    public Flux<ExplorerEvent> events() {
        return sink.asFlux();
    }

    public boolean hasPushSupport() {
        return rpc.supportsPush();
    }

    public void subscribeToBlocks(String id) {
        boolean push = rpc.supportsPush();
        start(id, SubscriptionKind.NEW_BLOCKS, null, push, push ? pushBlocks(id) : pollBlocks(id));
    }

    public void subscribeToAddress(String id, String address) {
        String watched = InputValidator.requireAddress(address);
        boolean push = rpc.supportsPush();
        start(id, SubscriptionKind.ADDRESS_ACTIVITY, watched, push,
                push ? pushAddress(id, watched) : pollAddress(id, watched));
    }

    public void subscribeToPendingTransactions(String id) {
        boolean push = rpc.supportsPush();
        start(id, SubscriptionKind.PENDING_TRANSACTIONS, null, push, push ? pushPending(id) : pollPending(id));
    }

    /** @return false when no subscription with this id was running */
    public synchronized boolean unsubscribe(String id) {
        Subscription removed = subscriptions.remove(id);
        if (removed == null) {
            return false;
        }
        removed.handle().dispose();
        log.info("Unsubscribed {}", id);
        return true;
    }

    public synchronized void unsubscribeAll() {
        subscriptions.keySet().forEach(this::unsubscribe);
    }

    public Set<String> activeSubscriptions() {
        return Set.copyOf(subscriptions.keySet());
    }

    public boolean isActive(String id) {
        return subscriptions.containsKey(id);
    }

    public Optional<Subscription> subscription(String id) {
        return Optional.ofNullable(subscriptions.get(id));
    }

    @PreDestroy
    public void shutdown() {
        unsubscribeAll();
        synchronized (emitLock) {
            sink.tryEmitComplete();
        }
        log.info("Subscription manager stopped");
    }

    private synchronized void start(String id, SubscriptionKind kind, String address, boolean push,
                                    Flux<ExplorerEvent> source) {
        Subscription previous = subscriptions.remove(id);
        if (previous != null) {
            previous.handle().dispose();
            log.info("Replacing subscription {}", id);
        }
        Disposable.Swap handle = Disposables.swap();
        Subscription subscription = new Subscription(id, kind, address, push, clock.instant(), handle);
        subscriptions.put(id, subscription);
        log.info("Subscribed {} to {}{} via {}", id, kind, address != null ? " " + address : "", push ? "push" : "polling");
        handle.update(source
                .concatWith(Flux.error(() -> new NetworkException("Event stream closed by the node")))
                .subscribe(this::emit, e -> terminate(subscription, e)));
    }

    private void terminate(Subscription subscription, Throwable error) {
        if (subscriptions.remove(subscription.id(), subscription)) {
            log.warn("Subscription {} stopped: {}", subscription.id(), error.getMessage());
            emit(new SubscriptionError(subscription.id(), error.getMessage()));
        }
    }

    private void emit(ExplorerEvent event) {
        synchronized (emitLock) {
            Sinks.EmitResult result = sink.tryEmitNext(event);
            if (result.isFailure()) {
                log.debug("Dropped {} for {}: {}", event.getClass().getSimpleName(), event.subscriptionId(), result);
            }
        }
    }

    private Flux<ExplorerEvent> pushBlocks(String id) {
        return rpc.newHeads()
                .concatMap(head -> rpc.getBlockByHash(head.hash(), false))
                .<ExplorerEvent>map(block -> new NewBlock(id, block.number(), block.hash()));
    }

    /** Emits the head block whenever the head advances; intermediate blocks are skipped. */
    private Flux<ExplorerEvent> pollBlocks(String id) {
        return Flux.defer(() -> {
            AtomicLong lastSeen = new AtomicLong();
            return rpc.getBlockNumber()
                    .doOnNext(lastSeen::set)
                    .thenMany(ticks(properties.getBlockPollInterval()))
                    .concatMap(tick -> rpc.getBlockNumber())
                    .filter(head -> head > lastSeen.get())
                    .concatMap(head -> rpc.getBlockByNumber(head, false))
                    .doOnNext(block -> lastSeen.set(block.number()))
                    .<ExplorerEvent>map(block -> new NewBlock(id, block.number(), block.hash()));
        });
    }

    private Flux<ExplorerEvent> pushAddress(String id, String address) {
        return rpc.newHeads()
                .concatMap(head -> rpc.getBlockByHash(head.hash(), true))
                .concatMapIterable(block -> matching(id, address, block));
    }

    /**
     * Scans every block after the last one seen up to the current head, inclusive. The scan stops
     * at a block the node cannot return yet and resumes there on the next tick.
     */
    private Flux<ExplorerEvent> pollAddress(String id, String address) {
        return Flux.defer(() -> {
            AtomicLong lastSeen = new AtomicLong();
            return rpc.getBlockNumber()
                    .doOnNext(lastSeen::set)
                    .thenMany(ticks(properties.getAddressPollInterval()))
                    .concatMap(tick -> rpc.getBlockNumber())
                    .filter(head -> head > lastSeen.get())
                    .concatMap(head -> Flux.fromStream(LongStream.rangeClosed(lastSeen.get() + 1, head).boxed())
                            .concatMap(number -> rpc.getBlockByNumber(number, true)
                                    .map(Optional::of)
                                    .defaultIfEmpty(Optional.empty())
                                    .doOnNext(block -> {
                                        if (block.isEmpty()) {
                                            log.debug("Block {} not available yet for {}, retrying next poll", number, id);
                                        }
                                    }))
                            .takeWhile(Optional::isPresent)
                            .map(Optional::get)
                            .doOnNext(block -> lastSeen.set(block.number()))
                            .concatMapIterable(block -> matching(id, address, block)));
        });
    }

    private Flux<ExplorerEvent> pushPending(String id) {
        return rpc.newPendingTransactionHashes()
                .concatMap(rpc::getTransaction)
                .<ExplorerEvent>map(tx -> new PendingTransaction(id, tx));
    }

    private Flux<ExplorerEvent> pollPending(String id) {
        return rpc.newPendingTransactionFilter()
                .flatMapMany(filterId -> ticks(properties.getPendingPollInterval())
                        .concatMap(tick -> rpc.getFilterChanges(filterId)))
                .concatMapIterable(hashes -> hashes)
                .concatMap(rpc::getTransaction)
                .<ExplorerEvent>map(tx -> new PendingTransaction(id, tx));
    }

    private Flux<Long> ticks(Duration interval) {
        return Flux.interval(interval, scheduler).onBackpressureDrop();
    }

    private static List<ExplorerEvent> matching(String id, String address, Block block) {
        return block.transactions().stream()
                .filter(tx -> tx.involves(address))
                .map(tx -> (ExplorerEvent) new NewAddressTransaction(id, address, tx, block.number()))
                .collect(Collectors.toList());
    }
}
